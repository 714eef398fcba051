package com.github.salilvnair.coopassist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.coopassist.cache.AdaptiveCacheManager;
import com.github.salilvnair.coopassist.cache.TtlPolicy;
import com.github.salilvnair.coopassist.cache.store.SecondaryCacheStore;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration(proxyBeanMethods = false)
public class CoopAssistCacheConfiguration {

    @Bean
    public AdaptiveCacheManager<EngineResult> coopAssistResultCache(TtlPolicy ttlPolicy,
                                                                    CoopAssistFlowConfig flowConfig,
                                                                    Clock clock,
                                                                    ObjectProvider<ObjectMapper> objectMapper,
                                                                    ObjectProvider<SecondaryCacheStore> secondaryStore) {
        SecondaryCacheStore store = secondaryStore.getIfAvailable();
        log.info("Co-op Assist: result cache enabled={} secondary store={}",
                flowConfig.getCache().isEnabled(), store == null ? "none" : store.getClass().getSimpleName());
        return new AdaptiveCacheManager<>(ttlPolicy, flowConfig, clock,
                objectMapper.getIfAvailable(ObjectMapper::new), store, EngineResult.class);
    }
}
