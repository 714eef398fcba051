package com.github.salilvnair.coopassist.engine.type;

public enum AnswerSource {
    RULE_REPLY,
    CATALOG,
    POLICY,
    SELECTION,
    GENERATIVE,
    CANNED_FALLBACK
}
