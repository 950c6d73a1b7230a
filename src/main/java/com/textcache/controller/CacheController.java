package com.textcache.controller;

import com.textcache.model.dto.CacheStatistics;
import com.textcache.model.dto.InvalidationFrequencyStats;
import com.textcache.model.dto.InvalidationRecommendation;
import com.textcache.model.dto.MetricsExport;
import com.textcache.model.dto.PerformanceStats;
import com.textcache.model.dto.SlowOperation;
import com.textcache.monitoring.PerformanceMonitor;
import com.textcache.service.TieredResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache monitoring and management controller.
 * Exposes statistics for both cache tiers and invalidation operations.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final TieredResponseCache cache;
    private final PerformanceMonitor monitor;

    public CacheController(TieredResponseCache cache, PerformanceMonitor monitor) {
        this.cache = cache;
        this.monitor = monitor;
    }

    /**
     * Status of Redis and the memory tier, plus performance statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cache.getCacheStats());
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceStats> getPerformance() {
        return ResponseEntity.ok(monitor.getPerformanceStats());
    }

    /**
     * Operations slower than {@code threshold_multiplier} times the average of their kind.
     */
    @GetMapping("/performance/slow-operations")
    public ResponseEntity<Map<String, List<SlowOperation>>> getSlowOperations(
            @RequestParam(name = "threshold_multiplier", defaultValue = "2.0") double thresholdMultiplier) {
        if (thresholdMultiplier <= 0) {
            throw new IllegalArgumentException("threshold_multiplier must be positive");
        }
        return ResponseEntity.ok(monitor.getRecentSlowOperations(thresholdMultiplier));
    }

    @PostMapping("/performance/reset")
    public ResponseEntity<Map<String, String>> resetPerformance() {
        log.info("Performance statistics reset requested");
        cache.resetPerformanceStats();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Performance statistics reset"
        ));
    }

    @GetMapping("/invalidation/stats")
    public ResponseEntity<InvalidationFrequencyStats> getInvalidationStats() {
        return ResponseEntity.ok(monitor.getInvalidationFrequencyStats());
    }

    @GetMapping("/invalidation/recommendations")
    public ResponseEntity<List<InvalidationRecommendation>> getInvalidationRecommendations() {
        return ResponseEntity.ok(monitor.getInvalidationRecommendations());
    }

    @GetMapping("/metrics/export")
    public ResponseEntity<MetricsExport> exportMetrics() {
        return ResponseEntity.ok(monitor.exportMetrics());
    }

    /**
     * Invalidate entries whose key contains {@code pattern}.
     */
    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(
            @RequestParam(name = "pattern", defaultValue = "") String pattern,
            @RequestParam(name = "operation_context", defaultValue = "") String operationContext) {
        log.info("Cache invalidation requested: pattern='{}', context='{}'", pattern, operationContext);
        int deleted = cache.invalidatePattern(pattern, operationContext);
        return ResponseEntity.ok(invalidationResult(pattern, deleted));
    }

    @PostMapping("/invalidate/all")
    public ResponseEntity<Map<String, Object>> invalidateAll(
            @RequestParam(name = "operation_context", defaultValue = "manual_clear_all") String operationContext) {
        log.info("Full cache invalidation requested: context='{}'", operationContext);
        int deleted = cache.invalidateAll(operationContext);
        return ResponseEntity.ok(invalidationResult("", deleted));
    }

    @PostMapping("/invalidate/operation/{operation}")
    public ResponseEntity<Map<String, Object>> invalidateOperation(
            @PathVariable("operation") String operation,
            @RequestParam(name = "operation_context", required = false) String operationContext) {
        log.info("Cache invalidation requested for operation '{}'", operation);
        int deleted = operationContext != null
                ? cache.invalidateByOperation(operation, operationContext)
                : cache.invalidateByOperation(operation);
        return ResponseEntity.ok(invalidationResult("operation:" + operation, deleted));
    }

    @PostMapping("/invalidate/memory")
    public ResponseEntity<Map<String, Object>> invalidateMemory(
            @RequestParam(name = "operation_context", defaultValue = "memory_cache_clear") String operationContext) {
        int removed = cache.invalidateMemoryCache(operationContext);
        return ResponseEntity.ok(invalidationResult("memory_cache", removed));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected cache request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", String.valueOf(e.getMessage())
        ));
    }

    private static Map<String, Object> invalidationResult(String pattern, int keysInvalidated) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("pattern", pattern);
        result.put("keys_invalidated", keysInvalidated);
        return result;
    }
}
