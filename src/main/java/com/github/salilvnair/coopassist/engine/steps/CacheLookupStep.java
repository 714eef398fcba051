package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.cache.AdaptiveCacheManager;
import com.github.salilvnair.coopassist.cache.CacheKey;
import com.github.salilvnair.coopassist.catalog.ProductCatalog;
import com.github.salilvnair.coopassist.catalog.ProductPopularity;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.intent.QueryTypeResolver;
import com.github.salilvnair.coopassist.session.DialogueSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Component
@MustRunAfter(FollowUpContextStep.class)
public class CacheLookupStep implements EngineStep {

    private final AdaptiveCacheManager<EngineResult> cache;
    private final QueryTypeResolver queryTypeResolver;
    private final ProductCatalog catalog;
    private final ProductPopularity popularity;
    private final DialogueSessionManager sessions;

    @Override
    public StepResult execute(EngineSession session) {
        CacheKey key = CacheKey.of(queryTypeResolver.resolve(session.getUtterance()),
                session.getUtterance().normalized(), session.getContextToken());
        session.setCacheKey(key);
        Optional<EngineResult> hit = cache.get(key);
        if (hit.isEmpty()) {
            return new StepResult.Continue();
        }
        EngineResult result = hit.get().asCached();
        log.debug("Co-op Assist: cache hit {} for user={}", key.asString(), session.getUserId());
        if (result.subjectKey() != null && !session.isPreheat()) {
            catalog.findByKey(result.subjectKey()).ifPresent(p -> {
                sessions.setLastContext(session.getUserId(),
                        new ProductCandidate(p.getKey(), p.getName(), p.getSpecification(), p.getCategory(), 1.0d));
                popularity.recordView(p.getKey());
            });
        }
        session.complete(result, false);
        return new StepResult.Stop(result);
    }
}
