package com.github.salilvnair.coopassist.engine.constants;

public final class ReplyConstants {

    private ReplyConstants() {
    }

    public static final String GREETING = "您好！有什么可以帮您的吗？";
    public static final String IDENTITY = "我是这里的生鲜小助手，可以帮您查询产品、价格和社区政策，有什么问题随时问我哦！";
    public static final String EMPTY_INPUT = "抱歉，我没有听清您的问题，可以再说一遍吗？";
    public static final String CLARIFY_PRODUCT = "您好，关于您咨询的产品，我找到了几个相似的：您是指 %s 呢？请点击选择。";
    public static final String CLARIFY_POLICY = "您想了解哪方面的政策呢？请点击选择：";
    public static final String PRODUCT_NOT_FOUND = "抱歉，暂时没有找到“%s”。您可以看看我们的这些产品：%s";
    public static final String PRODUCT_NOT_FOUND_NO_SUGGESTION = "抱歉，暂时没有找到“%s”，欢迎看看群里的最新产品～";
    public static final String PRODUCT_AVAILABLE = "有的！%s";
    public static final String PRODUCT_PRICE = "%s";
    public static final String CATALOG_HEADER = "我们目前有这些产品：";
    public static final String RECOMMENDATION_HEADER = "为您推荐当季新鲜的产品：";
    public static final String POLICY_HEADER = "关于%s，请参考：";
    public static final String REFUND_GUIDANCE = "很抱歉给您带来不便！申请退款请参考以下规定：";
    public static final String REFUND_CONTACT = "请提供订单信息和商品照片，我们会尽快为您处理。";
    public static final String FALLBACK_APOLOGY = "抱歉，这个问题我暂时回答不了，您可以换个说法，或者在群里联系管理员哦。";
    public static final String SELECTION_EXPIRED = "选择已过期，请重新告诉我您想了解的产品或问题。";
    public static final String SEASONAL_MARKER = "【当季新鲜】";
}
