package com.github.salilvnair.coopassist.api.controller;

import com.github.salilvnair.coopassist.cache.AdaptiveCacheManager;
import com.github.salilvnair.coopassist.cache.CachePreheater;
import com.github.salilvnair.coopassist.cache.CacheStatistics;
import com.github.salilvnair.coopassist.cache.MaintenanceReport;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CacheControllerTest {

    private AdaptiveCacheManager<EngineResult> cache;
    private CachePreheater preheater;
    private MockMvc mockMvc;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        cache = mock(AdaptiveCacheManager.class);
        preheater = mock(CachePreheater.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheController(cache, preheater)).build();
    }

    @Test
    void statsExposesHitRateAndHotKeys() throws Exception {
        when(cache.statistics()).thenReturn(new CacheStatistics(3L, 1L, 0.75d, 2, 2, 4L, 0,
                List.of(new CacheStatistics.HotKey("怎么付款", QueryType.POLICY, 3L)),
                Map.of(QueryType.POLICY, 3L), false, false, null));

        mockMvc.perform(get("/api/v1/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hitRate").value(0.75d))
                .andExpect(jsonPath("$.topHotKeys[0].query").value("怎么付款"))
                .andExpect(jsonPath("$.typeDistribution.POLICY").value(3));
    }

    @Test
    void invalidateWithoutTypeClearsEverything() throws Exception {
        when(cache.invalidateAll()).thenReturn(5);

        mockMvc.perform(post("/api/v1/cache/invalidate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("ALL"))
                .andExpect(jsonPath("$.invalidated").value(5));
    }

    @Test
    void invalidateByType() throws Exception {
        when(cache.invalidateType(QueryType.PRODUCT)).thenReturn(2);

        mockMvc.perform(post("/api/v1/cache/invalidate").param("type", "product"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("PRODUCT"))
                .andExpect(jsonPath("$.invalidated").value(2));
    }

    @Test
    void unknownTypeIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/cache/invalidate").param("type", "weather"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown query type: weather"));

        verify(cache, never()).invalidateType(any(QueryType.class));
    }

    @Test
    void maintainAndPreheatDelegate() throws Exception {
        when(cache.maintain()).thenReturn(new MaintenanceReport(10, 3, 1, 0, 1));
        when(preheater.preheat()).thenReturn(7);

        mockMvc.perform(post("/api/v1/cache/maintain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evicted").value(3));
        mockMvc.perform(post("/api/v1/cache/preheat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warmed").value(7));
    }
}
