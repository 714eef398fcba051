package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.cache.AdaptiveCacheManager;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Commits tiered answers before the generative fallback runs. Clarifications and generated text are never cached.
 */
@RequiredArgsConstructor
@Component
@MustRunAfter(IntentDispatchStep.class)
@MustRunBefore(GenerativeFallbackStep.class)
public class CacheWriteStep implements EngineStep {

    private final AdaptiveCacheManager<EngineResult> cache;

    @Override
    public StepResult execute(EngineSession session) {
        if (session.hasFinalResult() && session.isCacheable() && session.getCacheKey() != null) {
            cache.put(session.getCacheKey(), session.getFinalResult());
        }
        return new StepResult.Continue();
    }
}
