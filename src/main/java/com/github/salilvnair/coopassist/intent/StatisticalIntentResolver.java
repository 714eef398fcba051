package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.model.Utterance;
import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.intent.model.IntentModelHolder;
import com.github.salilvnair.coopassist.intent.model.StatisticalIntentModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Component
public class StatisticalIntentResolver implements IntentResolver {

    private final IntentModelHolder modelHolder;
    private final CoopAssistFlowConfig flowConfig;

    @Override
    public IntentClassification resolve(Utterance utterance) {
        Optional<StatisticalIntentModel> model = modelHolder.current();
        if (model.isEmpty() || utterance.isBlank()) {
            return null;
        }
        StatisticalIntentModel.Prediction prediction;
        try {
            prediction = model.get().predict(utterance.normalized());
        } catch (RuntimeException ex) {
            log.warn("Co-op Assist: statistical intent model failed, skipping tier. cause={}", ex.getMessage());
            return null;
        }
        if (prediction == null) {
            return null;
        }
        Intent intent = Intent.fromCode(prediction.label());
        double threshold = flowConfig.getIntent().getStatisticalThreshold();
        if (intent == Intent.UNKNOWN || prediction.probability() < threshold) {
            log.debug("Co-op Assist: statistical prediction {}@{} below threshold {}",
                    prediction.label(), prediction.probability(), threshold);
            return null;
        }
        return new IntentClassification(intent, prediction.probability(), ClassificationTier.STATISTICAL);
    }
}
