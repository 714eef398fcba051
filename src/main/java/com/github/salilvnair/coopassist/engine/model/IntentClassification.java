package com.github.salilvnair.coopassist.engine.model;

import com.github.salilvnair.coopassist.engine.type.ClassificationTier;
import com.github.salilvnair.coopassist.engine.type.Intent;

public record IntentClassification(
        Intent intent,
        double confidence,
        ClassificationTier tier
) {
    public static IntentClassification unknown() {
        return new IntentClassification(Intent.UNKNOWN, 0.0d, ClassificationTier.NONE);
    }

    public boolean isUnknown() {
        return intent == Intent.UNKNOWN;
    }
}
