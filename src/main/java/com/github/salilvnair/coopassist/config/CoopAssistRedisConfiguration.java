package com.github.salilvnair.coopassist.config;

import com.github.salilvnair.coopassist.cache.store.RedisSecondaryCacheStore;
import com.github.salilvnair.coopassist.cache.store.SecondaryCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(StringRedisTemplate.class)
@ConditionalOnProperty(prefix = "coopassist.flow.cache.secondary", name = "enabled", havingValue = "true")
public class CoopAssistRedisConfiguration {

    @Bean
    public SecondaryCacheStore redisSecondaryCacheStore(StringRedisTemplate redisTemplate) {
        return new RedisSecondaryCacheStore(redisTemplate);
    }

    // applied after spring.data.redis.* so a slow backend never holds a request past the bound
    @Bean
    public LettuceClientConfigurationBuilderCustomizer coopAssistRedisTimeoutCustomizer(CoopAssistFlowConfig flowConfig) {
        Duration timeout = flowConfig.getCache().getSecondary().getCommandTimeout();
        log.info("Co-op Assist: secondary cache command timeout={}", timeout);
        return builder -> builder.commandTimeout(timeout);
    }
}
