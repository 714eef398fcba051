package com.github.salilvnair.coopassist.llm.core;

/**
 * External generative model. Implementations are supplied by the host application; when none is
 * registered the engine answers with a crafted apology instead.
 */
public interface LlmClient {
    String generateText(String prompt, String contextHints);
}
