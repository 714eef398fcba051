package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Cheap cache-key tagging from the deterministic rule tiers only, so a cache hit never pays for the
 * statistical model.
 */
@RequiredArgsConstructor
@Component
public class QueryTypeResolver {

    private final PriorityRuleIntentResolver priorityRules;
    private final KeywordRuleIntentResolver keywordRules;

    public QueryType resolve(Utterance utterance) {
        IntentClassification classification = priorityRules.resolve(utterance);
        if (classification == null) {
            classification = keywordRules.resolve(utterance);
        }
        return classification == null ? QueryType.GENERAL : classification.intent().queryType();
    }
}
