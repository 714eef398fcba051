package com.github.salilvnair.coopassist.engine.session;

import com.github.salilvnair.coopassist.cache.CacheKey;
import com.github.salilvnair.coopassist.engine.context.EngineContext;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.policy.PolicySearchResult;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * State of a single request as it moves through the pipeline. Lives for one message only;
 * anything that must survive across messages belongs to the dialogue session manager.
 */
@Getter
@Setter
public class EngineSession {

    private final EngineContext context;

    private Utterance utterance;
    private String contextToken;
    private CacheKey cacheKey;
    private IntentClassification classification;
    private PolicySearchResult policyResult;
    private EngineResult finalResult;
    private boolean cacheable;
    private final List<String> fallbackHints = new ArrayList<>();

    public EngineSession(EngineContext context) {
        this.context = context;
    }

    public String getUserId() {
        return context.getUserId();
    }

    public String getRawMessage() {
        return context.getMessage();
    }

    public boolean isPreheat() {
        return context.isPreheat();
    }

    public void complete(EngineResult result, boolean cacheable) {
        this.finalResult = result;
        this.cacheable = cacheable;
    }

    public boolean hasFinalResult() {
        return finalResult != null;
    }
}
