package com.github.salilvnair.coopassist.policy;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.text.TextNormalizer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Policy sentences categorized once at load. Each sentence carries exactly one category.
 */
@Slf4j
public final class PolicyCorpus {

    private final List<PolicySentence> sentences;
    private final List<String> sectionNames;
    @Getter
    private final PolicyCategorizer categorizer;
    @Getter
    private final String version;
    @Getter
    private final String lastUpdated;

    public PolicyCorpus(List<PolicySection> sections, PolicyCategorizer categorizer, String version, String lastUpdated) {
        this.categorizer = categorizer;
        this.version = version == null ? "unversioned" : version;
        this.lastUpdated = lastUpdated;
        List<String> violations = new ArrayList<>();
        List<PolicySentence> loaded = new ArrayList<>();
        List<String> names = new ArrayList<>();
        int id = 0;
        for (PolicySection section : sections == null ? List.<PolicySection>of() : sections) {
            if (section == null || section.getName() == null || section.getName().isBlank()) {
                violations.add("section without a name");
                continue;
            }
            names.add(section.getName());
            List<String> contents = section.getSentences() == null ? List.of() : section.getSentences();
            for (int i = 0; i < contents.size(); i++) {
                String content = contents.get(i);
                if (content == null || content.isBlank()) {
                    violations.add(section.getName() + "[" + i + "] is blank");
                    continue;
                }
                PolicyCategorizer.Categorization categorization = categorizer.categorize(content);
                loaded.add(new PolicySentence(
                        id++,
                        section.getName(),
                        content.trim(),
                        TextNormalizer.normalize(content),
                        categorization.category(),
                        categorization.scores()));
            }
        }
        if (!violations.isEmpty()) {
            throw new CoopAssistException(CoopAssistErrorCode.MALFORMED_POLICY_CORPUS,
                    "Policy corpus validation failed. Violations: " + String.join(" | ", violations));
        }
        this.sentences = Collections.unmodifiableList(loaded);
        this.sectionNames = Collections.unmodifiableList(names);
        log.info("Co-op Assist: policy corpus version={} loaded with {} sentences across {} sections. categories={}",
                this.version, sentences.size(), sectionNames.size(), categoryDistribution());
    }

    public List<PolicySentence> sentences() {
        return sentences;
    }

    public List<String> sectionNames() {
        return sectionNames;
    }

    public List<PolicySentence> sentencesInCategory(String category) {
        if (category == null) {
            return List.of();
        }
        return sentences.stream().filter(s -> s.category().equalsIgnoreCase(category.trim())).toList();
    }

    public List<PolicySentence> sentencesInSection(String section) {
        return sentences.stream().filter(s -> s.section().equals(section)).toList();
    }

    /** Categories that own at least one sentence, in declaration order. */
    public List<PolicyCategory> populatedCategories() {
        return categorizer.categories().stream()
                .filter(c -> !sentencesInCategory(c.getName()).isEmpty())
                .toList();
    }

    public Map<String, Integer> categoryDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (PolicySentence sentence : sentences) {
            distribution.merge(sentence.category(), 1, Integer::sum);
        }
        return distribution;
    }

    public boolean isEmpty() {
        return sentences.isEmpty();
    }
}
