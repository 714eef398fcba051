package com.github.salilvnair.coopassist.engine.type;

public enum RetrievalTier {
    EXACT,
    KEYWORD,
    STATISTICAL,
    EMPTY
}
