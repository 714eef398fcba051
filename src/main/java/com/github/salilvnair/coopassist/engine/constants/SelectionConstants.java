package com.github.salilvnair.coopassist.engine.constants;

public final class SelectionConstants {

    private SelectionConstants() {
    }

    public static final String PRODUCT_SELECTION_PREFIX = "product_selection:";
    public static final String POLICY_CATEGORY_PREFIX = "policy_category:";
    public static final String GENERAL_POLICY_CATEGORY = "general";
}
