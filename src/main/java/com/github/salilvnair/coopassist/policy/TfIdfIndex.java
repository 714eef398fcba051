package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import com.github.salilvnair.coopassist.engine.text.TextTokenizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF vectors over the policy corpus with smoothed idf: ln((1 + n) / (1 + df)) + 1.
 */
public final class TfIdfIndex {

    private final List<PolicySentence> documents;
    private final Map<String, Double> idf;
    private final List<Map<String, Double>> vectors;

    public TfIdfIndex(List<PolicySentence> documents) {
        this.documents = List.copyOf(documents);
        Map<String, Integer> documentFrequency = new HashMap<>();
        List<List<String>> tokenized = new ArrayList<>();
        for (PolicySentence document : this.documents) {
            List<String> tokens = TextTokenizer.tokenize(document.normalized());
            tokenized.add(tokens);
            for (String term : new HashSet<>(tokens)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }
        int n = this.documents.size();
        Map<String, Double> weights = new HashMap<>();
        documentFrequency.forEach((term, df) -> weights.put(term, Math.log((1.0d + n) / (1.0d + df)) + 1.0d));
        this.idf = Map.copyOf(weights);
        List<Map<String, Double>> built = new ArrayList<>();
        for (List<String> tokens : tokenized) {
            built.add(vectorize(tokens));
        }
        this.vectors = List.copyOf(built);
    }

    public List<Hit> query(String text, double minSimilarity) {
        Map<String, Double> queryVector = vectorize(TextTokenizer.tokenize(TextNormalizer.normalize(text)));
        List<Hit> hits = new ArrayList<>();
        if (queryVector.isEmpty()) {
            return hits;
        }
        for (int i = 0; i < documents.size(); i++) {
            double similarity = cosine(queryVector, vectors.get(i));
            if (similarity >= minSimilarity) {
                hits.add(new Hit(documents.get(i), similarity));
            }
        }
        hits.sort(Comparator.comparingDouble(Hit::similarity).reversed());
        return hits;
    }

    public int size() {
        return documents.size();
    }

    private Map<String, Double> vectorize(List<String> tokens) {
        Map<String, Double> vector = new HashMap<>();
        if (tokens.isEmpty()) {
            return vector;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        double norm = 0.0d;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            Double weight = idf.get(entry.getKey());
            if (weight == null) {
                continue;
            }
            double value = ((double) entry.getValue() / tokens.size()) * weight;
            vector.put(entry.getKey(), value);
            norm += value * value;
        }
        if (norm == 0.0d) {
            return Map.of();
        }
        double length = Math.sqrt(norm);
        vector.replaceAll((k, v) -> v / length);
        return vector;
    }

    private static double cosine(Map<String, Double> left, Map<String, Double> right) {
        Map<String, Double> smaller = left.size() <= right.size() ? left : right;
        Map<String, Double> larger = smaller == left ? right : left;
        double dot = 0.0d;
        Set<String> terms = smaller.keySet();
        for (String term : terms) {
            Double other = larger.get(term);
            if (other != null) {
                dot += smaller.get(term) * other;
            }
        }
        return dot;
    }

    public record Hit(PolicySentence sentence, double similarity) {}
}
