package com.github.salilvnair.coopassist.engine.model;

import com.github.salilvnair.coopassist.engine.type.AnswerSource;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;

import java.util.List;

/**
 * @param subjectKey catalog key of the product the answer is about, if any; restores follow-up context on cache hits
 */
public record EngineResult(
        String responseText,
        List<SelectableOption> options,
        Intent intent,
        ClassificationTier tier,
        AnswerSource source,
        String subjectKey,
        boolean fromCache
) {
    public EngineResult {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static EngineResult text(String responseText, Intent intent, ClassificationTier tier, AnswerSource source) {
        return new EngineResult(responseText, List.of(), intent, tier, source, null, false);
    }

    public EngineResult asCached() {
        return new EngineResult(responseText, options, intent, tier, source, subjectKey, true);
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }
}
