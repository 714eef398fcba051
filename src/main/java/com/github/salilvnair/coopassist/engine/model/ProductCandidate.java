package com.github.salilvnair.coopassist.engine.model;

public record ProductCandidate(
        String key,
        String name,
        String specification,
        String category,
        double score
) {
    public String displayText() {
        if (specification == null || specification.isBlank()) {
            return name;
        }
        return name + " (" + specification + ")";
    }
}
