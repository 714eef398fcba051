package com.github.salilvnair.coopassist.engine.text;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits mixed Chinese / Latin text into ASCII words, single Han characters and Han bigrams.
 */
@UtilityClass
public final class TextTokenizer {

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        StringBuilder word = new StringBuilder();
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (isHan(c)) {
                flush(word, tokens);
                tokens.add(String.valueOf(c));
                if (i + 1 < length && isHan(text.charAt(i + 1))) {
                    tokens.add(text.substring(i, i + 2));
                }
            } else if (Character.isLetterOrDigit(c)) {
                word.append(Character.toLowerCase(c));
            } else {
                flush(word, tokens);
            }
        }
        flush(word, tokens);
        return tokens;
    }

    public static Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    public static boolean isHan(char c) {
        return Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN;
    }

    private static void flush(StringBuilder word, List<String> tokens) {
        if (word.length() > 0) {
            tokens.add(word.toString());
            word.setLength(0);
        }
    }
}
