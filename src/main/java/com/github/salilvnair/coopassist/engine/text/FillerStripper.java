package com.github.salilvnair.coopassist.engine.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes conversational filler around a product mention ("有没有…", "…卖不？", "…多少钱").
 * <p>
 * Rules run once each, in table order. Longer phrases must precede their own prefixes
 * ("有没有" before "有"), otherwise the shorter rule leaves a dangling fragment behind.
 */
public final class FillerStripper {

    private static final String TRAILING_PUNCTUATION = "[\\s?!.,~;:'\"-]*$";

    private final List<FillerRule> rules;

    public FillerStripper(List<FillerRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static FillerStripper defaults() {
        List<FillerRule> rules = new ArrayList<>();
        rules.add(FillerRule.of("trailing-punctuation", TRAILING_PUNCTUATION));
        rules.add(FillerRule.of("greeting-prefix", "^(请问一下|请问|你好|您好|hello|hi)[\\s,!]*"));
        rules.add(FillerRule.of("want-prefix", "^(我想要买|我想买|我要买|我想要|我想|我要|想买|要买|买)"));
        rules.add(FillerRule.of("audience-prefix", "^(你们家|你们|你家|这里|群里)"));
        rules.add(FillerRule.of("availability-prefix", "^(卖不卖|有没有|有不有|还有没有|还有|有卖|卖不|有不|有(?!机))"));
        rules.add(FillerRule.of("price-phrase", "(多少钱一斤|一斤多少钱|一斤多少|多少钱|什么价|怎么卖|价格是多少|价格|价钱|售价)"));
        rules.add(FillerRule.of("availability-suffix-long", "(还有吗|有卖吗|卖不卖|有没有|有不有)$"));
        rules.add(FillerRule.of("availability-suffix-short", "(卖不|有不|卖吗|有吗|没有)$"));
        rules.add(FillerRule.of("particle-suffix", "(吗|呢|啊|呀|吧|的)$"));
        rules.add(FillerRule.of("trailing-punctuation-again", TRAILING_PUNCTUATION));
        return new FillerStripper(rules);
    }

    public String strip(String normalized) {
        if (normalized == null) {
            return "";
        }
        String current = normalized.trim();
        for (FillerRule rule : rules) {
            current = rule.pattern().matcher(current).replaceFirst(rule.replacement()).trim();
            if (current.isEmpty()) {
                return current;
            }
        }
        return current;
    }

    public List<FillerRule> rules() {
        return rules;
    }

    public record FillerRule(String name, Pattern pattern, String replacement) {

        public static FillerRule of(String name, String regex) {
            return new FillerRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), "");
        }
    }
}
