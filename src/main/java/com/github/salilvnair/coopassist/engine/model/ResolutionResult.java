package com.github.salilvnair.coopassist.engine.model;

import com.github.salilvnair.coopassist.engine.type.ResolutionStatus;

import java.util.List;

public record ResolutionResult(
        ResolutionStatus status,
        String fragment,
        List<ProductCandidate> candidates
) {
    public ResolutionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ResolutionResult of(String fragment, List<ProductCandidate> candidates) {
        ResolutionStatus status = switch (candidates.size()) {
            case 0 -> ResolutionStatus.NOT_FOUND;
            case 1 -> ResolutionStatus.RESOLVED;
            default -> ResolutionStatus.AMBIGUOUS;
        };
        return new ResolutionResult(status, fragment, candidates);
    }

    public static ResolutionResult notFound(String fragment) {
        return new ResolutionResult(ResolutionStatus.NOT_FOUND, fragment, List.of());
    }

    public ProductCandidate best() {
        return candidates.isEmpty() ? null : candidates.get(0);
    }
}
