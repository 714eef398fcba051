package com.github.salilvnair.coopassist.engine.model;

public record SelectableOption(
        String displayText,
        String payload
) {}
