package com.github.salilvnair.coopassist.api.controller;

import com.github.salilvnair.coopassist.cache.AdaptiveCacheManager;
import com.github.salilvnair.coopassist.cache.CachePreheater;
import com.github.salilvnair.coopassist.cache.CacheStatistics;
import com.github.salilvnair.coopassist.cache.MaintenanceReport;
import com.github.salilvnair.coopassist.engine.model.EngineResult;
import com.github.salilvnair.coopassist.engine.type.QueryType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final AdaptiveCacheManager<EngineResult> cache;
    private final CachePreheater preheater;

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> stats() {
        return ResponseEntity.ok(cache.statistics());
    }

    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(@RequestParam(name = "type", required = false) String type) {
        if (type == null || type.isBlank()) {
            int removed = cache.invalidateAll();
            log.info("Co-op Assist Admin: invalidated all cached results ({}).", removed);
            return ResponseEntity.ok(Map.of("type", "ALL", "invalidated", removed));
        }
        QueryType queryType;
        try {
            queryType = QueryType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown query type: " + type));
        }
        int removed = cache.invalidateType(queryType);
        return ResponseEntity.ok(Map.of("type", queryType.name(), "invalidated", removed));
    }

    @PostMapping("/maintain")
    public ResponseEntity<MaintenanceReport> maintain() {
        return ResponseEntity.ok(cache.maintain());
    }

    @PostMapping("/preheat")
    public ResponseEntity<Map<String, Object>> preheat() {
        return ResponseEntity.ok(Map.of("warmed", preheater.preheat()));
    }
}
