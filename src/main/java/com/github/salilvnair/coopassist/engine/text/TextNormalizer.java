package com.github.salilvnair.coopassist.engine.text;

import lombok.experimental.UtilityClass;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@UtilityClass
public final class TextNormalizer {

    // NFKC already folds full-width ASCII forms; these CJK marks have no compatibility mapping.
    private static final Map<Character, String> CJK_PUNCTUATION = Map.ofEntries(
            Map.entry('。', "."),
            Map.entry('、', ","),
            Map.entry('“', "\""),
            Map.entry('”', "\""),
            Map.entry('‘', "'"),
            Map.entry('’', "'"),
            Map.entry('「', " "),
            Map.entry('」', " "),
            Map.entry('『', " "),
            Map.entry('』', " "),
            Map.entry('《', " "),
            Map.entry('》', " "),
            Map.entry('—', "-"),
            Map.entry('·', " ")
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+");

    /** Width-fold, lower-case, fold CJK punctuation to ASCII and collapse whitespace. */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String folded = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        StringBuilder sb = new StringBuilder(folded.length());
        for (int i = 0; i < folded.length(); i++) {
            char c = folded.charAt(i);
            String replacement = CJK_PUNCTUATION.get(c);
            sb.append(replacement != null ? replacement : String.valueOf(c));
        }
        String lower = sb.toString().toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }

    /** Normalized text with every punctuation mark and space removed. */
    public static String compact(String raw) {
        return PUNCTUATION.matcher(normalize(raw)).replaceAll("");
    }
}
