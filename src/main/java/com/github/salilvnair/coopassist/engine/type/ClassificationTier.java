package com.github.salilvnair.coopassist.engine.type;

public enum ClassificationTier {
    PRIORITY_RULE,
    KEYWORD_RULE,
    STATISTICAL,
    NONE
}
