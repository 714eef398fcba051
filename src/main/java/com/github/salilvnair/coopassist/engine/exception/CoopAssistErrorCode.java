package com.github.salilvnair.coopassist.engine.exception;

public enum CoopAssistErrorCode {

    // =========================
    // Startup data errors
    // =========================
    MALFORMED_RULE_TABLE(
            "Intent rule table is malformed",
            false
    ),

    MALFORMED_CATALOG(
            "Product catalog is malformed",
            false
    ),

    MALFORMED_POLICY_CORPUS(
            "Policy corpus is malformed",
            false
    ),

    INTENT_MODEL_LOAD_FAILED(
            "Statistical intent model could not be loaded",
            true
    ),

    // =========================
    // Resolution errors
    // =========================
    ENTITY_NOT_FOUND(
            "No catalog product matched the request",
            true
    ),

    INVALID_SELECTION(
            "Selected option is not part of the pending clarification",
            true
    ),

    // =========================
    // External dependencies
    // =========================
    LLM_UNAVAILABLE(
            "Generative model client is not configured",
            true
    ),

    LLM_CALL_FAILED(
            "Generative model call failed",
            true
    ),

    LLM_TIMEOUT(
            "Generative model call timed out",
            true
    ),

    SECONDARY_CACHE_FAILED(
            "Secondary cache store operation failed",
            true
    ),

    // =========================
    // Pipeline errors
    // =========================
    PIPELINE_NO_FINAL_RESULT(
            "Engine pipeline completed without producing a result",
            false
    ),

    DUPLICATE_ENGINE_STEP(
            "Duplicate engine step detected",
            false
    ),

    MISSING_TERMINAL_STEP(
            "Exactly one terminal engine step is required",
            false
    ),

    MISSING_DEPENDENT_STEP(
            "Engine step depends on a step that is not registered",
            false
    ),

    PIPELINE_STEP_CYCLE(
            "Engine step ordering contains a cycle",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    CoopAssistErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
