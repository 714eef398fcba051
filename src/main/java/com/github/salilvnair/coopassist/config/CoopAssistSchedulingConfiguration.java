package com.github.salilvnair.coopassist.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration(proxyBeanMethods = false)
@EnableScheduling
public class CoopAssistSchedulingConfiguration {

    // fixed size with a bounded queue; overflow is rejected and the caller gets the canned reply
    @Bean(name = "coopAssistFallbackExecutor")
    public ThreadPoolTaskExecutor coopAssistFallbackExecutor(CoopAssistFlowConfig flowConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(flowConfig.getFallback().getPoolSize());
        executor.setMaxPoolSize(flowConfig.getFallback().getPoolSize());
        executor.setQueueCapacity(flowConfig.getFallback().getQueueCapacity());
        executor.setThreadNamePrefix("coopassist-llm-");
        return executor;
    }
}
