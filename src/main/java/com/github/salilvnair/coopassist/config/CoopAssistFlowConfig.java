package com.github.salilvnair.coopassist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "coopassist.flow")
@Getter
@Setter
public class CoopAssistFlowConfig {

    private IntentClassifier intent = new IntentClassifier();
    private Resolver resolver = new Resolver();
    private PolicyRetrieval policy = new PolicyRetrieval();
    private Cache cache = new Cache();
    private Session session = new Session();
    private Fallback fallback = new Fallback();

    @Getter
    @Setter
    public static class IntentClassifier {
        private double statisticalThreshold = 0.3d;
        private String modelLocation = "classpath:intent-model.json";
        private boolean modelEnabled = true;
    }

    @Getter
    @Setter
    public static class Resolver {
        private double threshold = 0.6d;
        private int maxOptions = 5;
        private int shortStringMaxLength = 6;
        private int notFoundSuggestions = 5;
        /** Item words that point at a catalog category; empty means the built-in table. */
        private List<CategoryKeywords> categoryKeywords = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class CategoryKeywords {
        private String category;
        private List<String> keywords = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class PolicyRetrieval {
        private int topK = 3;
        private double minSimilarity = 0.1d;
        private int minExactQueryLength = 2;
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration policyTtl = Duration.ofHours(48);
        private Duration productTtl = Duration.ofHours(12);
        private Duration chatTtl = Duration.ofHours(8);
        private Duration generalTtl = Duration.ofHours(24);
        private Duration hotTtl = Duration.ofDays(7);
        private Duration rareTtl = Duration.ofHours(6);
        private long hotThreshold = 100L;
        private long warmThreshold = 10L;
        private int maintenanceBatchSize = 200;
        private long maintenanceIntervalMs = 3_600_000L;
        private Duration statsRetention = Duration.ofDays(7);
        private int hotKeyLimit = 10;
        private boolean preheatEnabled = true;
        private List<String> preheatPolicyQueries = new ArrayList<>(List.of(
                "配送时间", "付款方式", "取货地点", "质量保证", "群规", "退款政策",
                "运费标准", "起送金额", "配送范围", "免费配送", "取货时间", "质量问题"));
        private List<String> preheatProductQueries = new ArrayList<>(List.of(
                "鸡", "蔬菜", "水果", "海鲜", "蛋类", "时令水果", "新鲜蔬菜", "禽类", "干货"));
        private SecondaryStore secondary = new SecondaryStore();
    }

    @Getter
    @Setter
    public static class SecondaryStore {
        private boolean enabled = false;
        private String keyPrefix = "coopassist:cache:";
        private Duration failureBackoff = Duration.ofSeconds(30);
        private Duration commandTimeout = Duration.ofMillis(200);
    }

    @Getter
    @Setter
    public static class Session {
        private Duration pendingTtl = Duration.ofMinutes(10);
        private Duration idleTtl = Duration.ofMinutes(60);
        private long housekeepingIntervalMs = 300_000L;
        private List<String> followUpKeywords = new ArrayList<>(List.of(
                "它", "这个", "那个", "刚才", "刚刚"));
        private List<String> priceFollowUpKeywords = new ArrayList<>(List.of(
                "多少钱", "什么价", "价格是", "几多钱", "价格", "售价", "怎么卖"));
    }

    @Getter
    @Setter
    public static class Fallback {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(8);
        private int maxHintSentences = 20;
        private int poolSize = 4;
        private int queueCapacity = 50;
    }
}
