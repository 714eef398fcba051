package com.github.salilvnair.coopassist.policy;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Moves the sentence that actually answers the question to the front: the account to pay for
 * payment questions, the street address for pickup questions.
 */
@Component
public class DecisiveFactBooster {

    private static final List<Pattern> ACCOUNT_IDENTIFIERS = List.of(
            Pattern.compile("[\\w.+-]+@[\\w-]+\\.[\\w.]+"),
            Pattern.compile("(?<![\\w@])@[a-z0-9][\\w.-]{1,}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(venmo|zelle|paypal)\\s*(账号|账户|id)?\\s*[:：]\\s*\\S+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d{3}[-\\s]?\\d{3}[-\\s]?\\d{4}"),
            Pattern.compile("\\d{6,}")
    );

    private static final List<Pattern> STREET_ADDRESSES = List.of(
            Pattern.compile("\\d+\\s+[a-z0-9 .'-]*\\b(st|street|ave|avenue|rd|road|blvd|boulevard|dr|drive|ln|lane|way|ct|court|pl|place)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("[\\u4e00-\\u9fa5a-z0-9]+(路|街|大道|道|巷)\\s*\\d+\\s*号", Pattern.CASE_INSENSITIVE)
    );

    private final Map<String, List<Pattern>> factsByCategory;

    public DecisiveFactBooster() {
        this(Map.of("payment", ACCOUNT_IDENTIFIERS, "pickup", STREET_ADDRESSES));
    }

    public DecisiveFactBooster(Map<String, List<Pattern>> factsByCategory) {
        this.factsByCategory = Map.copyOf(factsByCategory);
    }

    public boolean appliesTo(String category) {
        return category != null && factsByCategory.containsKey(category);
    }

    public boolean holdsDecisiveFact(String category, PolicySentence sentence) {
        List<Pattern> patterns = category == null ? null : factsByCategory.get(category);
        if (patterns == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(sentence.content()).find()) {
                return true;
            }
        }
        return false;
    }

    /** Stable partition: decisive sentences first, relative order otherwise kept. */
    public List<RankedSentence> promote(String category, List<RankedSentence> ranked) {
        if (!appliesTo(category)) {
            return ranked;
        }
        List<RankedSentence> decisive = new ArrayList<>();
        List<RankedSentence> rest = new ArrayList<>();
        for (RankedSentence sentence : ranked) {
            if (holdsDecisiveFact(category, sentence.sentence())) {
                decisive.add(sentence);
            } else {
                rest.add(sentence);
            }
        }
        decisive.addAll(rest);
        return decisive;
    }
}
