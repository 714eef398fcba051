package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class PriorityRuleIntentResolver implements IntentResolver {

    private final IntentRuleTables ruleTables;

    @Override
    public IntentClassification resolve(Utterance utterance) {
        IntentRule rule = ruleTables.priority().firstMatch(utterance.normalized());
        if (rule == null) {
            return null;
        }
        log.debug("Co-op Assist: priority rule '{}' matched -> {}", rule.pattern(), rule.intent());
        return new IntentClassification(rule.intent(), 1.0d, ClassificationTier.PRIORITY_RULE);
    }
}
