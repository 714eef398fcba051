package com.github.salilvnair.coopassist.engine.steps;

import com.github.salilvnair.coopassist.engine.pipeline.EngineStep;
import com.github.salilvnair.coopassist.engine.pipeline.StepResult;
import com.github.salilvnair.coopassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.coopassist.engine.session.EngineSession;
import com.github.salilvnair.coopassist.intent.CompositeIntentClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
@MustRunAfter(CacheLookupStep.class)
public class IntentResolutionStep implements EngineStep {

    private final CompositeIntentClassifier classifier;

    @Override
    public StepResult execute(EngineSession session) {
        session.setClassification(classifier.classify(session.getUtterance()));
        return new StepResult.Continue();
    }
}
