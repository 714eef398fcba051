package com.github.salilvnair.coopassist.engine.type;

public enum ResolutionStatus {
    NOT_FOUND,
    RESOLVED,
    AMBIGUOUS
}
