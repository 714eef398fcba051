package com.github.salilvnair.coopassist.catalog.resolver;

import com.github.salilvnair.coopassist.catalog.ProductCatalog;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps an unresolved fragment to a catalog category: by the category name itself, then by item words
 * ("桃" -> 水果). Only categories the catalog actually carries are ever returned.
 */
@Slf4j
@Component
public class CategoryGuesser {

    private final ProductCatalog catalog;
    private final List<CategoryKeywordRule> rules;

    public CategoryGuesser(ProductCatalog catalog, CoopAssistFlowConfig flowConfig) {
        this.catalog = catalog;
        List<CoopAssistFlowConfig.CategoryKeywords> configured = flowConfig.getResolver().getCategoryKeywords();
        this.rules = configured == null || configured.isEmpty()
                ? DefaultCategoryKeywords.defaults()
                : validate(configured);
    }

    /**
     * @param useItemWords false restricts the guess to category names, for messages not known to be about products
     */
    public Optional<String> guess(String fragment, boolean useItemWords) {
        String text = TextNormalizer.normalize(fragment);
        if (text.isBlank()) {
            return Optional.empty();
        }
        List<String> categories = new ArrayList<>(catalog.groupedByCategory().keySet());
        for (String category : categories) {
            String name = TextNormalizer.normalize(category);
            if (text.contains(name) || name.contains(text)) {
                return Optional.of(category);
            }
        }
        if (!useItemWords) {
            return Optional.empty();
        }
        String best = null;
        int bestScore = 0;
        for (CategoryKeywordRule rule : rules) {
            if (!categories.contains(rule.category())) {
                continue;
            }
            int score = 0;
            for (String keyword : rule.keywords()) {
                if (text.contains(keyword)) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = rule.category();
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("Co-op Assist: '{}' guessed as category {} (score {})", fragment, best, bestScore);
        }
        return Optional.ofNullable(best);
    }

    private static List<CategoryKeywordRule> validate(List<CoopAssistFlowConfig.CategoryKeywords> configured) {
        List<CategoryKeywordRule> rules = new ArrayList<>();
        for (CoopAssistFlowConfig.CategoryKeywords entry : configured) {
            if (entry == null || entry.getCategory() == null || entry.getCategory().isBlank()) {
                throw new CoopAssistException(CoopAssistErrorCode.MALFORMED_RULE_TABLE,
                        "Category keyword entry without a category");
            }
            List<String> keywords = entry.getKeywords() == null ? List.of() : entry.getKeywords().stream()
                    .filter(k -> k != null && !k.isBlank())
                    .map(TextNormalizer::normalize)
                    .toList();
            if (keywords.isEmpty()) {
                throw new CoopAssistException(CoopAssistErrorCode.MALFORMED_RULE_TABLE,
                        "Category keyword entry '" + entry.getCategory() + "' has no keywords");
            }
            rules.add(new CategoryKeywordRule(entry.getCategory().trim(), keywords));
        }
        return List.copyOf(rules);
    }
}
