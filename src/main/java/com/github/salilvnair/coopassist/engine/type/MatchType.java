package com.github.salilvnair.coopassist.engine.type;

public enum MatchType {
    EXACT,
    REGEX,
    CONTAINS,
    STARTS_WITH
}
