package com.github.salilvnair.coopassist.engine.model;

public record Utterance(
        String raw,
        String normalized
) {
    public boolean isBlank() {
        return normalized == null || normalized.isBlank();
    }
}
