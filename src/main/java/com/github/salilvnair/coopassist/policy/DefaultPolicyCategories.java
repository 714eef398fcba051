package com.github.salilvnair.coopassist.policy;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration order doubles as the tie-break order when two categories score the same.
 */
@UtilityClass
public final class DefaultPolicyCategories {

    public static List<PolicyCategory> defaults() {
        return List.of(
                category("payment", "付款方式",
                        List.of("付款", "支付", "汇款", "转账", "账号", "账户", "付钱", "zelle", "现金"),
                        List.of("venmo", "付款方式", "支付方式")),
                category("pickup", "取货地点",
                        List.of("取货", "自取", "地址", "位置", "自提", "提货"),
                        List.of("取货地址", "取货点", "自取地址")),
                category("delivery", "配送服务",
                        List.of("配送", "送货", "截单", "送达", "快递", "物流", "起送", "送到"),
                        List.of("配送时间", "配送范围", "运费")),
                category("refund", "退款退货",
                        List.of("credit", "退钱", "赔偿", "补偿", "退回"),
                        List.of("退款", "退货")),
                category("quality", "质量保证",
                        List.of("质量", "新鲜", "坏了", "保证", "保鲜"),
                        List.of("质量问题", "质量保证")),
                category("group_rules", "群规须知",
                        List.of("规定", "须知", "条款", "政策", "禁止"),
                        List.of("群规"))
        );
    }

    private static PolicyCategory category(String name, String displayName, List<String> keywords, List<String> priority) {
        return PolicyCategory.builder()
                .name(name)
                .displayName(displayName)
                .keywords(new ArrayList<>(keywords))
                .priorityKeywords(new ArrayList<>(priority))
                .build();
    }
}
