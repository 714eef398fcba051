package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.type.Intent;
import com.github.salilvnair.coopassist.engine.type.MatchType;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Regex rules are compiled when their {@link IntentRuleTable} is built, so an invalid pattern fails the table.
 */
public record IntentRule(
        Intent intent,
        MatchType matchType,
        String pattern,
        Pattern compiled
) {

    public static IntentRule regex(Intent intent, String pattern) {
        return new IntentRule(intent, MatchType.REGEX, pattern, null);
    }

    public static IntentRule contains(Intent intent, String pattern) {
        return new IntentRule(intent, MatchType.CONTAINS, pattern, null);
    }

    public static IntentRule exact(Intent intent, String pattern) {
        return new IntentRule(intent, MatchType.EXACT, pattern, null);
    }

    public static IntentRule startsWith(Intent intent, String pattern) {
        return new IntentRule(intent, MatchType.STARTS_WITH, pattern, null);
    }

    public boolean matches(String text) {
        if (text == null) {
            return false;
        }
        return switch (matchType) {
            case REGEX -> compiled != null && compiled.matcher(text).find();
            case CONTAINS -> text.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
            case STARTS_WITH -> text.toLowerCase(Locale.ROOT).startsWith(pattern.toLowerCase(Locale.ROOT));
            case EXACT -> text.trim().equalsIgnoreCase(pattern.trim());
        };
    }
}
