package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.intent.model.IntentModelHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tiers run in a fixed order and the first confident tier wins:
 * priority rules, general rule table, statistical model, then UNKNOWN.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class CompositeIntentClassifier {

    private final PriorityRuleIntentResolver priorityRules;
    private final KeywordRuleIntentResolver keywordRules;
    private final StatisticalIntentResolver statistical;
    private final IntentModelHolder modelHolder;

    public IntentClassification classify(Utterance utterance) {
        if (utterance == null || utterance.isBlank()) {
            return IntentClassification.unknown();
        }
        for (IntentResolver resolver : List.of(priorityRules, keywordRules, statistical)) {
            IntentClassification classification = resolver.resolve(utterance);
            if (classification != null) {
                log.debug("Co-op Assist: '{}' classified as {} by {} (confidence={})",
                        utterance.normalized(), classification.intent(), classification.tier(), classification.confidence());
                return classification;
            }
        }
        log.debug("Co-op Assist: '{}' unclassified (statistical tier available={})",
                utterance.normalized(), modelHolder.isAvailable());
        return IntentClassification.unknown();
    }

    public boolean statisticalTierAvailable() {
        return modelHolder.isAvailable();
    }
}
