package com.github.salilvnair.coopassist.intent.model;

/**
 * Pre-trained text classifier consulted when no deterministic rule matches.
 * How the model is trained is outside this library.
 */
public interface StatisticalIntentModel {

    Prediction predict(String normalizedText);

    String version();

    record Prediction(String label, double probability) {}
}
