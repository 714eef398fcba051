package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.model.IntentClassification;
import com.github.salilvnair.coopassist.engine.model.Utterance;

public interface IntentResolver {
    /**
     * Return the classification or null if this tier is not confident.
     */
    IntentClassification resolve(Utterance utterance);
}
