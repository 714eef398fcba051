package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.engine.type.MatchType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered, immutable rule list. Position is priority: the first matching rule wins.
 */
public final class IntentRuleTable {

    private final String name;
    private final List<IntentRule> rules;

    public IntentRuleTable(String name, List<IntentRule> rules) {
        this.name = name;
        this.rules = List.copyOf(validate(name, rules));
    }

    public String name() {
        return name;
    }

    public List<IntentRule> rules() {
        return rules;
    }

    public IntentRule firstMatch(String text) {
        for (IntentRule rule : rules) {
            if (rule.matches(text)) {
                return rule;
            }
        }
        return null;
    }

    private static List<IntentRule> validate(String name, List<IntentRule> rules) {
        if (rules == null) {
            throw new CoopAssistException(CoopAssistErrorCode.MALFORMED_RULE_TABLE,
                    "Intent rule table '" + name + "' is missing");
        }
        List<String> violations = new ArrayList<>();
        List<IntentRule> checked = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            IntentRule rule = rules.get(i);
            String position = name + "[" + i + "]";
            if (rule == null) {
                violations.add(position + " is empty");
                continue;
            }
            if (rule.intent() == null || rule.intent() == Intent.UNKNOWN) {
                violations.add(position + " has no routable intent");
            }
            if (rule.matchType() == null) {
                violations.add(position + " has no match type");
            }
            if (rule.pattern() == null || rule.pattern().isBlank()) {
                violations.add(position + " has a blank pattern");
                continue;
            }
            if (rule.matchType() == MatchType.REGEX && rule.compiled() == null) {
                try {
                    rule = new IntentRule(rule.intent(), rule.matchType(), rule.pattern(),
                            Pattern.compile(rule.pattern(), Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException ex) {
                    violations.add(position + " has an invalid regex: " + ex.getDescription());
                    continue;
                }
            }
            checked.add(rule);
        }
        if (!violations.isEmpty()) {
            throw new CoopAssistException(CoopAssistErrorCode.MALFORMED_RULE_TABLE,
                    "Intent rule table validation failed. Violations: " + String.join(" | ", violations));
        }
        return checked;
    }
}
