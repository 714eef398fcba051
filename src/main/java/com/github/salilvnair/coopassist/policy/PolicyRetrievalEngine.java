package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import com.github.salilvnair.coopassist.engine.type.RetrievalTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tiered policy search. Tiers run in order and a later tier only runs while fewer than topK
 * sentences have been collected:
 * <ol>
 *     <li>EXACT: the query text occurs inside a sentence (or a whole sentence occurs inside the query)</li>
 *     <li>KEYWORD: sentences of the query's own category ranked by shared category keywords</li>
 *     <li>STATISTICAL: TF-IDF cosine similarity, skipped whenever the EXACT tier found anything</li>
 * </ol>
 * An empty result is reported as tier EMPTY and left to the generative fallback.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class PolicyRetrievalEngine {

    private final PolicyCorpus corpus;
    private final TfIdfIndex index;
    private final DecisiveFactBooster booster;
    private final CoopAssistFlowConfig flowConfig;

    public PolicySearchResult search(String query) {
        return search(query, flowConfig.getPolicy().getTopK());
    }

    public PolicySearchResult search(String query, int topK) {
        String normalized = TextNormalizer.normalize(query);
        PolicyCategorizer.Categorization guess = corpus.getCategorizer().categorize(normalized);
        if (topK <= 0 || normalized.isEmpty() || corpus.isEmpty()) {
            return new PolicySearchResult(query, guess.category(), List.of(), List.of(RetrievalTier.EMPTY));
        }

        Map<Integer, RankedSentence> collected = new LinkedHashMap<>();
        List<RetrievalTier> tiers = new ArrayList<>();

        tiers.add(RetrievalTier.EXACT);
        List<RankedSentence> exact = exactTier(normalized);
        collect(collected, exact, topK);

        if (collected.size() < topK && !guess.isGeneral()) {
            tiers.add(RetrievalTier.KEYWORD);
            collect(collected, keywordTier(normalized, guess.category()), topK);
        }

        if (collected.size() < topK && exact.isEmpty()) {
            tiers.add(RetrievalTier.STATISTICAL);
            collect(collected, statisticalTier(normalized), topK);
        }

        List<RankedSentence> ranked = booster.promote(guess.category(), new ArrayList<>(collected.values()));
        if (ranked.isEmpty()) {
            tiers.add(RetrievalTier.EMPTY);
        }
        log.debug("Co-op Assist: policy search '{}' category={} tiers={} hits={}",
                normalized, guess.category(), tiers, ranked.size());
        return new PolicySearchResult(query, guess.category(), ranked, tiers);
    }

    /**
     * All sentences of one category with the decisive fact first. Used when the user picks a category.
     */
    public PolicySearchResult browseCategory(String category) {
        List<RankedSentence> ranked = new ArrayList<>();
        for (PolicySentence sentence : corpus.sentencesInCategory(category)) {
            ranked.add(new RankedSentence(sentence, 1.0d, RetrievalTier.KEYWORD));
        }
        List<RankedSentence> promoted = booster.promote(category, ranked);
        List<RetrievalTier> tiers = promoted.isEmpty()
                ? List.of(RetrievalTier.KEYWORD, RetrievalTier.EMPTY)
                : List.of(RetrievalTier.KEYWORD);
        return new PolicySearchResult(category, category, promoted, tiers);
    }

    public List<PolicyCategory> browsableCategories() {
        return corpus.populatedCategories();
    }

    public List<String> contextHints(int limit) {
        return corpus.sentences().stream().limit(Math.max(limit, 0)).map(PolicySentence::content).toList();
    }

    public PolicyCorpus corpus() {
        return corpus;
    }

    private List<RankedSentence> exactTier(String normalized) {
        String query = TextNormalizer.compact(normalized);
        int minLength = flowConfig.getPolicy().getMinExactQueryLength();
        List<RankedSentence> hits = new ArrayList<>();
        if (query.length() < minLength) {
            return hits;
        }
        for (PolicySentence sentence : corpus.sentences()) {
            String content = TextNormalizer.compact(sentence.normalized());
            if (content.contains(query) || (content.length() >= minLength && query.contains(content))) {
                hits.add(new RankedSentence(sentence, 1.0d, RetrievalTier.EXACT));
            }
        }
        return hits;
    }

    private List<RankedSentence> keywordTier(String normalized, String category) {
        PolicyCategorizer categorizer = corpus.getCategorizer();
        List<RankedSentence> hits = new ArrayList<>();
        for (PolicySentence sentence : corpus.sentencesInCategory(category)) {
            int overlap = categorizer.overlap(category, normalized, sentence.normalized());
            hits.add(new RankedSentence(sentence, overlap, RetrievalTier.KEYWORD));
        }
        hits.sort(Comparator.comparingDouble(RankedSentence::score).reversed());
        return booster.promote(category, hits);
    }

    private List<RankedSentence> statisticalTier(String normalized) {
        List<RankedSentence> hits = new ArrayList<>();
        for (TfIdfIndex.Hit hit : index.query(normalized, flowConfig.getPolicy().getMinSimilarity())) {
            hits.add(new RankedSentence(hit.sentence(), hit.similarity(), RetrievalTier.STATISTICAL));
        }
        return hits;
    }

    private static void collect(Map<Integer, RankedSentence> collected, List<RankedSentence> hits, int topK) {
        for (RankedSentence hit : hits) {
            if (collected.size() >= topK) {
                return;
            }
            collected.putIfAbsent(hit.sentence().id(), hit);
        }
    }
}
