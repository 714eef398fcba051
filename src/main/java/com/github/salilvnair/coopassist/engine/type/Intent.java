package com.github.salilvnair.coopassist.engine.type;

import java.util.Locale;

public enum Intent {
    GREETING("greeting", QueryType.CHAT),
    IDENTITY_QUERY("identity_query", QueryType.CHAT),
    WHAT_DO_YOU_SELL("what_do_you_sell", QueryType.PRODUCT),
    INQUIRY_AVAILABILITY("inquiry_availability", QueryType.PRODUCT),
    INQUIRY_PRICE_OR_BUY("inquiry_price_or_buy", QueryType.PRODUCT),
    REQUEST_RECOMMENDATION("request_recommendation", QueryType.PRODUCT),
    INQUIRY_POLICY("inquiry_policy", QueryType.POLICY),
    REFUND_REQUEST("refund_request", QueryType.POLICY),
    UNKNOWN("unknown", QueryType.GENERAL);

    private final String code;
    private final QueryType queryType;

    Intent(String code, QueryType queryType) {
        this.code = code;
        this.queryType = queryType;
    }

    public String code() {
        return code;
    }

    public QueryType queryType() {
        return queryType;
    }

    /**
     * Maps an external label (rule table entry or statistical model output) onto the taxonomy.
     * Labels outside the taxonomy resolve to {@link #UNKNOWN}.
     */
    public static Intent fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Intent value : values()) {
            if (value.code.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
