package com.github.salilvnair.coopassist.engine.helper;

import com.github.salilvnair.coopassist.engine.constants.SelectionConstants;
import com.github.salilvnair.coopassist.engine.model.PendingClarification;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import lombok.experimental.UtilityClass;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes selection messages: an option payload sent back by a button, or an ordinal typed by the user
 * ("2", "第2个", "第二个").
 */
@UtilityClass
public final class SelectionParser {

    private static final Pattern ORDINAL = Pattern.compile("^第?\\s*([0-9]+|[一二三四五六七八九十])\\s*(个|项|种)?$");
    private static final Map<String, Integer> CHINESE_NUMERALS = Map.of(
            "一", 1, "二", 2, "三", 3, "四", 4, "五", 5,
            "六", 6, "七", 7, "八", 8, "九", 9, "十", 10);

    public static boolean isPayload(String text) {
        return isProductPayload(text) || isPolicyPayload(text);
    }

    public static boolean isProductPayload(String text) {
        return text != null && text.trim().startsWith(SelectionConstants.PRODUCT_SELECTION_PREFIX);
    }

    public static boolean isPolicyPayload(String text) {
        return text != null && text.trim().startsWith(SelectionConstants.POLICY_CATEGORY_PREFIX);
    }

    public static String payloadValue(String text) {
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        return trimmed.substring(colon + 1).trim();
    }

    public static int ordinal(String normalized) {
        if (normalized == null) {
            return -1;
        }
        Matcher matcher = ORDINAL.matcher(normalized.trim());
        if (!matcher.matches()) {
            return -1;
        }
        String number = matcher.group(1);
        Integer chinese = CHINESE_NUMERALS.get(number);
        if (chinese != null) {
            return chinese;
        }
        try {
            return Integer.parseInt(number);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    /** The option the message selects from the pending clarification, or null when it is not a selection. */
    public static SelectableOption select(PendingClarification pending, String raw, String normalized) {
        if (pending == null) {
            return null;
        }
        if (isPayload(raw)) {
            return pending.optionByPayload(raw.trim());
        }
        int ordinal = ordinal(normalized);
        return ordinal > 0 ? pending.optionByOrdinal(ordinal) : null;
    }
}
