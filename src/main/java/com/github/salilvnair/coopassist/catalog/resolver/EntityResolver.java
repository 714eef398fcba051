package com.github.salilvnair.coopassist.catalog.resolver;

import com.github.salilvnair.coopassist.engine.model.ResolutionResult;

public interface EntityResolver {
    /**
     * Score the fragment against the catalog. Never throws for unknown products; returns NOT_FOUND instead.
     */
    ResolutionResult resolve(String utteranceFragment);

    /**
     * Resolve a previously offered choice by catalog key, bypassing scoring.
     */
    ResolutionResult resolveSelection(String catalogKey);
}
