package com.github.salilvnair.coopassist.llm;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.llm.core.LlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Last tier of every answer path. The model call runs on a bounded executor and is abandoned after the
 * configured timeout; an absent client, a timeout, an error or a blank answer all yield empty.
 */
@Slf4j
@Component
public class GenerativeFallbackService {

    private static final String PROMPT_TEMPLATE = """
            你是一个社区生鲜团购群的客服小助手。请只根据下面提供的资料，用简短友好的中文回答用户的问题。
            如果资料里没有答案，请礼貌地说明并建议用户联系群管理员。

            用户问题：%s
            """;

    private final ObjectProvider<LlmClient> llmClient;
    private final CoopAssistFlowConfig flowConfig;
    private final Executor executor;

    public GenerativeFallbackService(ObjectProvider<LlmClient> llmClient,
                                     CoopAssistFlowConfig flowConfig,
                                     @Qualifier("coopAssistFallbackExecutor") Executor executor) {
        this.llmClient = llmClient;
        this.flowConfig = flowConfig;
        this.executor = executor;
    }

    public boolean isAvailable() {
        return flowConfig.getFallback().isEnabled() && llmClient.getIfAvailable() != null;
    }

    public Optional<String> generate(String userText, List<String> contextHints) {
        LlmClient client = llmClient.getIfAvailable();
        if (!flowConfig.getFallback().isEnabled() || client == null) {
            log.debug("Co-op Assist: generative fallback skipped, reason={}", CoopAssistErrorCode.LLM_UNAVAILABLE);
            return Optional.empty();
        }
        String prompt = String.format(PROMPT_TEMPLATE, userText);
        String hints = String.join("\n", contextHints);
        Duration timeout = flowConfig.getFallback().getTimeout();
        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(() -> client.generateText(prompt, hints), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Co-op Assist: generative fallback rejected, executor saturated. cause={}", ex.getMessage());
            return Optional.empty();
        }
        try {
            String answer = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (answer == null || answer.isBlank()) {
                log.warn("Co-op Assist: generative model returned a blank answer");
                return Optional.empty();
            }
            return Optional.of(answer.trim());
        } catch (TimeoutException ex) {
            call.cancel(true);
            log.warn("Co-op Assist: {} after {}", CoopAssistErrorCode.LLM_TIMEOUT.defaultMessage(), timeout);
            return Optional.empty();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("Co-op Assist: {}. cause={}", CoopAssistErrorCode.LLM_CALL_FAILED.defaultMessage(), cause.getMessage());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            log.warn("Co-op Assist: generative fallback interrupted");
            return Optional.empty();
        }
    }
}
