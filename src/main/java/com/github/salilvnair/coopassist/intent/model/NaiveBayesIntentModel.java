package com.github.salilvnair.coopassist.intent.model;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.text.TextTokenizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class NaiveBayesIntentModel implements StatisticalIntentModel {

    private final String version;
    private final List<String> labels;
    private final Map<String, Double> priors;
    private final Map<String, Map<String, Double>> featureLogProbs;
    private final Set<String> vocabulary;

    public NaiveBayesIntentModel(NaiveBayesArtifact artifact) {
        validate(artifact);
        this.version = artifact.getVersion() == null ? "unversioned" : artifact.getVersion();
        this.labels = List.copyOf(artifact.getLabels());
        this.priors = Map.copyOf(artifact.getClassLogPriors());
        this.featureLogProbs = Map.copyOf(artifact.getFeatureLogProbs());
        Set<String> vocab = new HashSet<>();
        featureLogProbs.values().forEach(m -> vocab.addAll(m.keySet()));
        this.vocabulary = Set.copyOf(vocab);
    }

    @Override
    public Prediction predict(String normalizedText) {
        List<String> tokens = new ArrayList<>();
        for (String token : TextTokenizer.tokenize(normalizedText)) {
            if (vocabulary.contains(token)) {
                tokens.add(token);
            }
        }
        double[] joint = new double[labels.size()];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            Map<String, Double> logProbs = featureLogProbs.getOrDefault(label, Map.of());
            double floor = floorOf(logProbs);
            double score = priors.get(label);
            for (String token : tokens) {
                score += logProbs.getOrDefault(token, floor);
            }
            joint[i] = score;
            max = Math.max(max, score);
        }
        double sum = 0.0d;
        int best = 0;
        for (int i = 0; i < joint.length; i++) {
            joint[i] = Math.exp(joint[i] - max);
            sum += joint[i];
            if (joint[i] > joint[best]) {
                best = i;
            }
        }
        return new Prediction(labels.get(best), joint[best] / sum);
    }

    @Override
    public String version() {
        return version;
    }

    // unseen-for-this-label tokens get the label's smallest known log probability
    private static double floorOf(Map<String, Double> logProbs) {
        double floor = -20.0d;
        if (!logProbs.isEmpty()) {
            floor = logProbs.values().stream().mapToDouble(Double::doubleValue).min().orElse(floor);
        }
        return floor;
    }

    private static void validate(NaiveBayesArtifact artifact) {
        if (artifact == null || artifact.getLabels() == null || artifact.getLabels().isEmpty()) {
            throw invalid("Naive Bayes artifact has no labels");
        }
        if (artifact.getClassLogPriors() == null) {
            throw invalid("Naive Bayes artifact has no class priors");
        }
        for (String label : artifact.getLabels()) {
            if (label == null || label.isBlank()) {
                throw invalid("Naive Bayes artifact has a blank label");
            }
            if (artifact.getClassLogPriors().get(label) == null) {
                throw invalid("Naive Bayes artifact has no prior for label '" + label + "'");
            }
        }
        if (artifact.getFeatureLogProbs() == null) {
            throw invalid("Naive Bayes artifact has no feature table");
        }
        artifact.getFeatureLogProbs().forEach((label, logProbs) -> {
            if (label == null || logProbs == null) {
                throw invalid("Naive Bayes artifact has an empty feature row for label '" + label + "'");
            }
            logProbs.forEach((token, logProb) -> {
                if (token == null || logProb == null) {
                    throw invalid("Naive Bayes artifact has a null feature weight for label '" + label + "'");
                }
            });
        });
    }

    private static CoopAssistException invalid(String message) {
        return new CoopAssistException(CoopAssistErrorCode.INTENT_MODEL_LOAD_FAILED, message);
    }
}
