package com.github.salilvnair.coopassist.catalog.resolver;

import com.github.salilvnair.coopassist.catalog.Product;
import com.github.salilvnair.coopassist.catalog.ProductCatalog;
import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import com.github.salilvnair.coopassist.engine.model.ResolutionResult;
import com.github.salilvnair.coopassist.engine.text.FillerStripper;
import com.github.salilvnair.coopassist.engine.text.StringSimilarity;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

@Slf4j
@RequiredArgsConstructor
@Component
public class FuzzyProductMatcher implements EntityResolver {

    private static final Set<String> GREETINGS = Set.of(
            "你好", "您好", "hi", "hello", "在吗", "在不在", "早上好", "晚上好", "谢谢", "好的");

    private static final double CONTAINMENT_BASE = 0.7d;
    private static final double CONTAINMENT_SPAN = 0.3d;
    private static final double PARTIAL_WEIGHT = 0.9d;
    private static final double ALIAS_WEIGHT = 0.9d;

    private final ProductCatalog catalog;
    private final FillerStripper fillerStripper;
    private final CoopAssistFlowConfig flowConfig;

    @Override
    public ResolutionResult resolve(String utteranceFragment) {
        String cleaned = fillerStripper.strip(TextNormalizer.normalize(utteranceFragment));
        if (cleaned.isEmpty() || GREETINGS.contains(cleaned)) {
            return ResolutionResult.notFound(cleaned);
        }
        double threshold = flowConfig.getResolver().getThreshold();
        List<ProductCandidate> candidates = new ArrayList<>();
        for (Product product : catalog.products()) {
            double score = score(cleaned, product);
            if (score >= threshold) {
                candidates.add(toCandidate(product, score));
            }
        }
        // List.sort is stable, so equal scores keep catalog order
        candidates.sort(Comparator.comparingDouble(ProductCandidate::score).reversed());
        ResolutionResult result = ResolutionResult.of(cleaned, candidates);
        log.debug("Co-op Assist: resolved fragment '{}' -> {} with {} candidate(s)",
                cleaned, result.status(), candidates.size());
        return result;
    }

    @Override
    public ResolutionResult resolveSelection(String catalogKey) {
        return catalog.findByKey(catalogKey)
                .map(p -> ResolutionResult.of(p.getName(), List.of(toCandidate(p, 1.0d))))
                .orElseGet(() -> ResolutionResult.notFound(catalogKey));
    }

    double score(String query, Product product) {
        double best = similarity(query, TextNormalizer.normalize(product.getName()));
        for (String alias : product.getKeywords()) {
            best = Math.max(best, ALIAS_WEIGHT * similarity(query, TextNormalizer.normalize(alias)));
        }
        return best;
    }

    double similarity(String query, String target) {
        if (query.isEmpty() || target.isEmpty()) {
            return 0.0d;
        }
        if (query.equals(target)) {
            return 1.0d;
        }
        if (target.contains(query) || query.contains(target)) {
            double ratio = (double) Math.min(query.length(), target.length()) / Math.max(query.length(), target.length());
            return CONTAINMENT_BASE + CONTAINMENT_SPAN * ratio;
        }
        double overlap = StringSimilarity.tokenJaccard(query, target);
        int shortLimit = flowConfig.getResolver().getShortStringMaxLength();
        double edit = query.length() <= shortLimit && target.length() <= shortLimit
                ? StringSimilarity.editRatio(query, target)
                : 0.0d;
        return PARTIAL_WEIGHT * Math.max(overlap, edit);
    }

    private ProductCandidate toCandidate(Product product, double score) {
        return new ProductCandidate(
                product.getKey(),
                product.getName(),
                product.getSpecification(),
                product.getCategory(),
                score);
    }
}
