package com.github.salilvnair.coopassist.engine.type;

public enum ClarificationKind {
    PRODUCT,
    POLICY_CATEGORY
}
