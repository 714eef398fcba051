package com.github.salilvnair.coopassist.intent;

import com.github.salilvnair.coopassist.engine.type.Intent;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Built-in rule tables. Patterns run against normalized text (ASCII punctuation, lower case).
 */
@UtilityClass
public final class DefaultIntentRules {

    private static final String END = "[\\s?!.~]*$";

    public static IntentRuleTables tables() {
        return new IntentRuleTables(priorityTable(), generalTable());
    }

    public static IntentRuleTable priorityTable() {
        return new IntentRuleTable("priority", List.of(
                // refund requests must win over the policy keyword scan ("我要退货" vs "退货政策")
                IntentRule.regex(Intent.REFUND_REQUEST, "^(我要|我想要|我想|我需要|申请|要求|帮我)(退货|退款|退钱|赔偿)"),
                IntentRule.regex(Intent.REFUND_REQUEST, "^(退货|退款|退钱)" + END),
                IntentRule.regex(Intent.GREETING, "^(你好|您好|你好啊|您好啊|hi|hello|嗨|早上好|晚上好|在吗)" + END),
                IntentRule.regex(Intent.IDENTITY_QUERY, "你是(谁|什么|机器人|ai|助手|真人)"),
                IntentRule.regex(Intent.IDENTITY_QUERY, "(介绍|说说)(一下)?(你)?自己"),
                IntentRule.regex(Intent.IDENTITY_QUERY, "你叫什么(名字)?")
        ));
    }

    public static IntentRuleTable generalTable() {
        return new IntentRuleTable("general", List.of(
                IntentRule.regex(Intent.WHAT_DO_YOU_SELL, "(卖|有)(什么|哪些|啥)(产品|商品|东西)"),
                IntentRule.regex(Intent.WHAT_DO_YOU_SELL, "(商品|产品)(列表|清单)"),
                IntentRule.regex(Intent.WHAT_DO_YOU_SELL, "都有(什么|哪些|啥)"),
                IntentRule.contains(Intent.WHAT_DO_YOU_SELL, "卖什么"),
                IntentRule.contains(Intent.WHAT_DO_YOU_SELL, "菜单"),

                IntentRule.regex(Intent.REQUEST_RECOMMENDATION, "(推荐|介绍)(点|一些|几样|一下)?(好吃的|东西|产品)"),
                IntentRule.regex(Intent.REQUEST_RECOMMENDATION, "什么(比较好|值得买|好吃|特色)"),
                IntentRule.regex(Intent.REQUEST_RECOMMENDATION, "有什么(推荐|好的|特色)"),
                IntentRule.contains(Intent.REQUEST_RECOMMENDATION, "当季有什么"),
                IntentRule.contains(Intent.REQUEST_RECOMMENDATION, "推荐"),

                IntentRule.regex(Intent.INQUIRY_POLICY, "(退货|退款|配送|送货|运费|支付|付款|取货|自取|自提)(政策|方式|流程|怎么|地址|时间|规则|标准|范围)"),
                IntentRule.regex(Intent.INQUIRY_POLICY, "怎么(退货|退款|配送|送货|支付|付款|取货|自取|自提)"),
                IntentRule.regex(Intent.INQUIRY_POLICY, "(在哪|哪里)(取货|自取|自提|取)"),
                IntentRule.regex(Intent.INQUIRY_POLICY, "质量(问题|有问题)"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "政策"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "群规"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "运费"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "起送"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "截单"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "取货点"),
                IntentRule.contains(Intent.INQUIRY_POLICY, "venmo"),

                IntentRule.regex(Intent.INQUIRY_PRICE_OR_BUY, "(多少钱|价格|价钱|怎么卖|一斤多少|售价|什么价)"),
                IntentRule.regex(Intent.INQUIRY_PRICE_OR_BUY, "(我要|来|买)(一斤|两斤|一个|一袋|一箱|一份|一只|一盒)"),
                IntentRule.regex(Intent.INQUIRY_PRICE_OR_BUY, "^(我要买|我想买|我要订|我想订)"),

                IntentRule.regex(Intent.INQUIRY_AVAILABILITY, "(卖不卖|有没有|有不有|还有没有|还有吗|有卖吗|卖不|有不|卖吗|有吗)" + END),
                IntentRule.regex(Intent.INQUIRY_AVAILABILITY, "^(卖不卖|有没有|有不有|还有没有|有卖|卖不|有不)"),
                IntentRule.regex(Intent.INQUIRY_AVAILABILITY, "(还有|有没有)(别的|其他的)?(水果|蔬菜|产品)")
        ));
    }
}
