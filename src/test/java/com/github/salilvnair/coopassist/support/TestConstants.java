package com.github.salilvnair.coopassist.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String USER_ALICE = "alice";
    public static final String USER_BOB = "bob";

    public static final String MSG_STRAWBERRY_AVAILABLE = "草莓卖不？";
    public static final String MSG_HOW_TO_PAY = "怎么付款";
    public static final String MSG_CHICKEN_AVAILABLE = "鸡有吗";
    public static final String MSG_REFUND = "我要退货";
    public static final String MSG_HELLO = "你好";
    public static final String MSG_PRICE_FOLLOW_UP = "多少钱";
    public static final String MSG_WEATHER = "今天天气怎么样";

    public static final String KEY_STRAWBERRY = "strawberry";
    public static final String KEY_FREE_RANGE_CHICKEN = "free-range-chicken";
    public static final String KEY_FARM_CHICKEN = "farm-chicken";
    public static final String KEY_CHICKEN_WINGS = "chicken-wings";
    public static final String KEY_EGGS = "eggs";

    public static final String NAME_STRAWBERRY = "草莓";
    public static final String NAME_FARM_CHICKEN = "土鸡";
    public static final String NAME_CHICKEN_WINGS = "鸡翅";

    public static final String VENMO_HANDLE = "@coop-fresh";
    public static final String PICKUP_ADDRESS = "123 Main Street";
    public static final String GENERATED_ANSWER = "天气的问题我不太清楚，不过群里今天有新鲜草莓哦。";
}
