package com.github.salilvnair.coopassist.engine.type;

public enum QueryType {
    POLICY,
    PRODUCT,
    CHAT,
    GENERAL
}
