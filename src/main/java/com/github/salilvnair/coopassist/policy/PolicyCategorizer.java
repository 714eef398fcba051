package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.constants.SelectionConstants;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Weighted keyword categorization: a priority keyword scores 3, an ordinary keyword scores 1.
 * Highest total wins, ties go to the category declared first, zero falls back to {@code general}.
 */
public final class PolicyCategorizer {

    public static final int PRIORITY_WEIGHT = 3;
    public static final int ORDINARY_WEIGHT = 1;

    private final List<PolicyCategory> categories;

    public PolicyCategorizer(List<PolicyCategory> categories) {
        this.categories = Collections.unmodifiableList(validate(categories));
    }

    public Categorization categorize(String text) {
        String normalized = TextNormalizer.normalize(text);
        Map<String, Integer> scores = new LinkedHashMap<>();
        String best = SelectionConstants.GENERAL_POLICY_CATEGORY;
        int bestScore = 0;
        for (PolicyCategory category : categories) {
            int score = score(category, normalized);
            scores.put(category.getName(), score);
            // strict '>' keeps the earlier declared category on ties
            if (score > bestScore) {
                best = category.getName();
                bestScore = score;
            }
        }
        return new Categorization(best, bestScore, Collections.unmodifiableMap(scores));
    }

    /**
     * Shared-keyword weight between two texts, restricted to one category's vocabulary.
     */
    public int overlap(String categoryName, String left, String right) {
        PolicyCategory category = find(categoryName).orElse(null);
        if (category == null) {
            return 0;
        }
        String a = TextNormalizer.normalize(left);
        String b = TextNormalizer.normalize(right);
        int total = 0;
        for (String keyword : category.getPriorityKeywords()) {
            if (a.contains(keyword) && b.contains(keyword)) {
                total += PRIORITY_WEIGHT;
            }
        }
        for (String keyword : category.getKeywords()) {
            if (a.contains(keyword) && b.contains(keyword)) {
                total += ORDINARY_WEIGHT;
            }
        }
        return total;
    }

    public List<PolicyCategory> categories() {
        return categories;
    }

    public Optional<PolicyCategory> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return categories.stream().filter(c -> c.getName().equalsIgnoreCase(name.trim())).findFirst();
    }

    private int score(PolicyCategory category, String normalized) {
        int total = 0;
        for (String keyword : category.getPriorityKeywords()) {
            if (normalized.contains(keyword)) {
                total += PRIORITY_WEIGHT;
            }
        }
        for (String keyword : category.getKeywords()) {
            if (normalized.contains(keyword)) {
                total += ORDINARY_WEIGHT;
            }
        }
        return total;
    }

    private static List<PolicyCategory> validate(List<PolicyCategory> source) {
        List<String> violations = new ArrayList<>();
        List<PolicyCategory> normalized = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (PolicyCategory category : source == null ? List.<PolicyCategory>of() : source) {
            if (category == null || category.getName() == null || category.getName().isBlank()) {
                violations.add("category without a name");
                continue;
            }
            String name = category.getName().trim();
            if (SelectionConstants.GENERAL_POLICY_CATEGORY.equalsIgnoreCase(name)) {
                violations.add("'" + name + "' is reserved for uncategorized sentences");
                continue;
            }
            if (!names.add(name.toLowerCase())) {
                violations.add("duplicate category '" + name + "'");
                continue;
            }
            List<String> priority = normalizeKeywords(category.getPriorityKeywords());
            List<String> ordinary = new ArrayList<>(normalizeKeywords(category.getKeywords()));
            ordinary.removeAll(priority);
            if (priority.isEmpty() && ordinary.isEmpty()) {
                violations.add("category '" + name + "' has no keywords");
                continue;
            }
            normalized.add(PolicyCategory.builder()
                    .name(name)
                    .displayName(category.getDisplayName() == null ? name : category.getDisplayName())
                    .keywords(List.copyOf(ordinary))
                    .priorityKeywords(priority)
                    .build());
        }
        if (normalized.isEmpty() && violations.isEmpty()) {
            violations.add("no policy categories declared");
        }
        if (!violations.isEmpty()) {
            throw new CoopAssistException(CoopAssistErrorCode.MALFORMED_POLICY_CORPUS,
                    "Policy category validation failed. Violations: " + String.join(" | ", violations));
        }
        return normalized;
    }

    private static List<String> normalizeKeywords(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(TextNormalizer::normalize)
                .distinct()
                .toList();
    }

    public record Categorization(String category, int score, Map<String, Integer> scores) {

        public boolean isGeneral() {
            return score == 0;
        }
    }
}
