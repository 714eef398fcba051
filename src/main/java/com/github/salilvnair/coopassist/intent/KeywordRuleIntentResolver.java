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
public class KeywordRuleIntentResolver implements IntentResolver {

    private final IntentRuleTables ruleTables;

    @Override
    public IntentClassification resolve(Utterance utterance) {
        IntentRule rule = ruleTables.general().firstMatch(utterance.normalized());
        if (rule == null) {
            return null;
        }
        log.debug("Co-op Assist: keyword rule {}:'{}' matched -> {}", rule.matchType(), rule.pattern(), rule.intent());
        return new IntentClassification(rule.intent(), 1.0d, ClassificationTier.KEYWORD_RULE);
    }
}
