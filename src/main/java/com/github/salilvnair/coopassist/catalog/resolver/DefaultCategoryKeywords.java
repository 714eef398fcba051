package com.github.salilvnair.coopassist.catalog.resolver;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Built-in item words per category. Declaration order breaks score ties, so "瓜" lands on fruit.
 */
@UtilityClass
public class DefaultCategoryKeywords {

    public static List<CategoryKeywordRule> defaults() {
        return List.of(
                new CategoryKeywordRule("水果", List.of("果", "莓", "橙", "桃", "芒", "龙眼", "荔枝", "凤梨", "葡萄",
                        "石榴", "山楂", "芭乐", "瓜", "苹果", "梨", "柑橘", "香蕉", "菠萝", "李子", "樱桃", "蓝莓",
                        "草莓", "猕猴桃")),
                new CategoryKeywordRule("蔬菜", List.of("菜", "瓜", "菇", "笋", "姜", "菠菜", "花苔", "萝卜", "南瓜",
                        "玉米", "花生", "白菜", "茄子", "土豆", "黄瓜", "豆角", "番茄", "洋葱", "芹菜", "生菜")),
                new CategoryKeywordRule("禽类", List.of("鸡", "鸭", "鹅", "鸽子", "禽", "家禽", "散养", "走地")),
                new CategoryKeywordRule("海鲜", List.of("鱼", "虾", "螺", "蛏", "蛤", "海鲜", "水产", "河鲜", "贝", "蟹")),
                new CategoryKeywordRule("熟食面点", List.of("饺", "饼", "爪", "包子", "花卷", "生煎", "火烧", "粽",
                        "面", "小吃", "点心")),
                new CategoryKeywordRule("蛋类", List.of("蛋", "鸡蛋", "鸭蛋", "皮蛋", "咸蛋"))
        );
    }
}
