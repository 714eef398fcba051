package com.github.salilvnair.coopassist.intent.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON export of a multinomial naive Bayes classifier over {@code TextTokenizer} tokens.
 */
@Data
@NoArgsConstructor
public class NaiveBayesArtifact {
    private String version;
    private List<String> labels = new ArrayList<>();
    private Map<String, Double> classLogPriors = new LinkedHashMap<>();
    private Map<String, Map<String, Double>> featureLogProbs = new LinkedHashMap<>();
}
