package com.github.salilvnair.coopassist.cache;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.context.EngineContext;
import com.github.salilvnair.coopassist.engine.core.ConversationalEngine;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import com.github.salilvnair.coopassist.intent.QueryTypeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Warms the result cache with common questions through the regular tiered path. Preheat runs never reach the
 * generative model and leave no dialogue state behind.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class CachePreheater {

    static final String PREHEAT_USER = "coopassist-preheat";

    private final ConversationalEngine engine;
    private final AdaptiveCacheManager<EngineResult> cache;
    private final QueryTypeResolver queryTypeResolver;
    private final CoopAssistFlowConfig flowConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (isEnabled()) {
            preheat();
        }
    }

    public boolean isEnabled() {
        return flowConfig.getCache().isEnabled() && flowConfig.getCache().isPreheatEnabled();
    }

    public int preheat() {
        List<String> queries = preheatQueries();
        log.info("Co-op Assist: preheating result cache with {} queries.", queries.size());
        int warmed = warm(queries);
        log.info("Co-op Assist: cache preheat complete, {} new entries.", warmed);
        return warmed;
    }

    /**
     * Re-runs only the preheat queries whose answer is no longer cached. Present entries are not touched, so
     * their access counters do not grow.
     */
    public int refill() {
        List<String> missing = preheatQueries().stream()
                .filter(q -> !cache.contains(keyFor(q)))
                .toList();
        if (missing.isEmpty()) {
            return 0;
        }
        int warmed = warm(missing);
        log.info("Co-op Assist: cache preheat refill ran {} queries, {} new entries.", missing.size(), warmed);
        return warmed;
    }

    // preheat runs skip the follow-up rewrite, so the key never carries a context token
    CacheKey keyFor(String query) {
        Utterance utterance = new Utterance(query, TextNormalizer.normalize(query));
        return CacheKey.of(queryTypeResolver.resolve(utterance), utterance.normalized(), null);
    }

    private int warm(List<String> queries) {
        int before = cache.size();
        for (String query : queries) {
            engine.process(EngineContext.builder()
                    .userId(PREHEAT_USER)
                    .message(query)
                    .preheat(true)
                    .build());
        }
        return Math.max(0, cache.size() - before);
    }

    private List<String> preheatQueries() {
        List<String> queries = new ArrayList<>(flowConfig.getCache().getPreheatPolicyQueries());
        queries.addAll(flowConfig.getCache().getPreheatProductQueries());
        return queries;
    }
}
