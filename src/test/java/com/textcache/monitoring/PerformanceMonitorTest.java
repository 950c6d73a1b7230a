package com.textcache.monitoring;

import com.textcache.MutableClock;
import com.textcache.config.TextCacheProperties;
import com.textcache.model.dto.InvalidationFrequencyStats;
import com.textcache.model.dto.InvalidationRecommendation;
import com.textcache.model.dto.MemoryUsageStats;
import com.textcache.model.dto.MemoryWarning;
import com.textcache.model.dto.MetricsExport;
import com.textcache.model.dto.PerformanceStats;
import com.textcache.model.dto.Severity;
import com.textcache.model.dto.SlowOperation;
import com.textcache.model.metric.InvalidationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PerformanceMonitor.
 */
class PerformanceMonitorTest {

    private MutableClock clock;
    private TextCacheProperties properties;
    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        properties = new TextCacheProperties();
        monitor = new PerformanceMonitor(properties, clock);
    }

    private void recordGet(boolean hit) {
        monitor.recordCacheOperationTime("get", Duration.ofMillis(2), hit, 100, null);
    }

    private void recordInvalidation(String pattern, int keys) {
        monitor.recordInvalidationEvent(pattern, keys, Duration.ofMillis(5), InvalidationType.MANUAL, "test", null);
    }

    @Test
    void testEmptyStatsKeepTopLevelCounters() {
        PerformanceStats stats = monitor.getPerformanceStats();

        assertEquals(0.0, stats.getCacheHitRate());
        assertEquals(0, stats.getTotalCacheOperations());
        assertEquals(0, stats.getCacheHits());
        assertEquals(0, stats.getCacheMisses());
        assertNull(stats.getKeyGeneration());
        assertNull(stats.getCacheOperations());
        assertNull(stats.getCompression());
        assertNull(stats.getMemoryUsage());
        assertNull(stats.getInvalidation());
    }

    @Test
    void testHitMissAccounting() {
        recordGet(true);
        recordGet(false);
        recordGet(true);
        recordGet(true);
        monitor.recordCacheOperationTime("set", Duration.ofMillis(3), false, 100, null);

        assertEquals(3, monitor.getCacheHits());
        assertEquals(1, monitor.getCacheMisses());
        assertEquals(5, monitor.getTotalOperations());
        assertEquals(60.0, monitor.getCacheHitRate(), 1e-9);

        PerformanceStats.CacheOperationStats ops = monitor.getPerformanceStats().getCacheOperations();
        assertEquals(5, ops.getTotalOperations());
        assertEquals(4, ops.getByOperationType().get("get").getCount());
        assertEquals(1, ops.getByOperationType().get("set").getCount());
        assertEquals(3.0, ops.getByOperationType().get("set").getMaxDurationMs(), 1e-9);
    }

    @Test
    void testConcurrentRecordingKeepsCountersAndBound() throws Exception {
        properties.getMonitoring().setMaxMeasurements(100);
        monitor = new PerformanceMonitor(properties, clock);
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startSignal = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    for (int i = 0; i < perThread; i++) {
                        recordGet(i % 2 == 0);
                    }
                    return null;
                }));
            }
            startSignal.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, monitor.getTotalOperations());
        assertEquals(threads * perThread / 2, monitor.getCacheHits());
        assertEquals(threads * perThread / 2, monitor.getCacheMisses());
        assertEquals(50.0, monitor.getCacheHitRate(), 1e-9);
        assertEquals(100, monitor.exportMetrics().getCacheOperationTimes().size());
    }

    @Test
    void testKeyGenerationAggregates() {
        monitor.recordKeyGenerationTime(Duration.ofMillis(1), 10, "summarize", null);
        monitor.recordKeyGenerationTime(Duration.ofMillis(3), 30, "summarize", null);
        monitor.recordKeyGenerationTime(Duration.ofMillis(200), 2000, "summarize", null);
        monitor.recordKeyGenerationTime(Duration.ofMillis(4), 40, "qa", null);

        PerformanceStats.KeyGenerationStats keyGen = monitor.getPerformanceStats().getKeyGeneration();

        assertEquals(4, keyGen.getTotalOperations());
        assertEquals(52.0, keyGen.getAvgDurationMs(), 1e-9);
        assertEquals(3.5, keyGen.getMedianDurationMs(), 1e-9);
        assertEquals(200.0, keyGen.getMaxDurationMs(), 1e-9);
        assertEquals(1.0, keyGen.getMinDurationMs(), 1e-9);
        assertEquals(2000, keyGen.getMaxTextLength());
        assertEquals(1, keyGen.getSlowOperations());
    }

    @Test
    void testRetentionPrunesOldMeasurements() {
        monitor.recordKeyGenerationTime(Duration.ofMillis(1), 10, "summarize", null);
        recordGet(true);

        clock.advance(Duration.ofMinutes(61));
        monitor.recordKeyGenerationTime(Duration.ofMillis(2), 20, "summarize", null);

        PerformanceStats stats = monitor.getPerformanceStats();
        assertEquals(1, stats.getKeyGeneration().getTotalOperations());
        assertEquals(2.0, stats.getKeyGeneration().getAvgDurationMs(), 1e-9);
        assertNull(stats.getCacheOperations());
        // counters are process-lifetime
        assertEquals(1, stats.getCacheHits());
    }

    @Test
    void testMaxMeasurementsKeepsNewest() {
        properties.getMonitoring().setMaxMeasurements(5);
        monitor = new PerformanceMonitor(properties, clock);

        for (int i = 1; i <= 8; i++) {
            monitor.recordKeyGenerationTime(Duration.ofMillis(i), i, "summarize", null);
        }

        MetricsExport export = monitor.exportMetrics();
        assertEquals(5, export.getKeyGenerationTimes().size());
        assertEquals(4, export.getKeyGenerationTimes().get(0).getTextLength());
        assertEquals(8, export.getKeyGenerationTimes().get(4).getTextLength());
    }

    @Test
    void testStatsAreIdempotent() {
        recordGet(true);
        recordGet(false);
        monitor.recordKeyGenerationTime(Duration.ofMillis(7), 10, "summarize", null);
        monitor.recordCompressionRatio(2000, 500, Duration.ofMillis(1), "summarize");
        recordInvalidation("summarize", 3);

        PerformanceStats first = monitor.getPerformanceStats();
        PerformanceStats second = monitor.getPerformanceStats();

        assertEquals(first, second);
    }

    @Test
    void testCompressionSummary() {
        monitor.recordCompressionRatio(1000, 250, Duration.ofMillis(2), "summarize");
        monitor.recordCompressionRatio(1000, 750, Duration.ofMillis(4), "summarize");

        PerformanceStats.CompressionStats compression = monitor.getPerformanceStats().getCompression();

        assertEquals(2, compression.getTotalOperations());
        assertEquals(0.5, compression.getAvgCompressionRatio(), 1e-9);
        assertEquals(0.25, compression.getBestCompressionRatio(), 1e-9);
        assertEquals(0.75, compression.getWorstCompressionRatio(), 1e-9);
        assertEquals(2000, compression.getTotalBytesProcessed());
        assertEquals(1000, compression.getTotalBytesSaved());
        assertEquals(50.0, compression.getOverallSavingsPercent(), 1e-9);
    }

    @Test
    void testSlowOperationFlagsOutlier() {
        for (long ms : new long[]{1, 1, 1, 10}) {
            monitor.recordKeyGenerationTime(Duration.ofMillis(ms), 10, "summarize", null);
        }

        Map<String, List<SlowOperation>> slow = monitor.getRecentSlowOperations(2.0);

        assertEquals(1, slow.get("key_generation").size());
        SlowOperation outlier = slow.get("key_generation").get(0);
        assertEquals(10.0, outlier.getDurationMs(), 1e-9);
        assertTrue(outlier.getTimesSlower() > 2.0);
        assertTrue(slow.get("cache_operations").isEmpty());
        assertTrue(slow.get("compression").isEmpty());
        assertTrue(slow.get("invalidation").isEmpty());
    }

    @Test
    void testSlowOperationUniformValuesNotFlagged() {
        for (int i = 0; i < 4; i++) {
            monitor.recordCacheOperationTime("get", Duration.ofMillis(5), true, 10, null);
        }

        assertTrue(monitor.getRecentSlowOperations(2.0).get("cache_operations").isEmpty());
    }

    @Test
    void testDominantOutlierMasksSmallerOne() {
        // mean 22.6 -> threshold 45.2: 10 is not flagged next to 100
        for (long ms : new long[]{1, 1, 1, 10, 100}) {
            monitor.recordKeyGenerationTime(Duration.ofMillis(ms), 10, "summarize", null);
        }

        List<SlowOperation> slow = monitor.getRecentSlowOperations(2.0).get("key_generation");

        assertEquals(1, slow.size());
        assertEquals(100.0, slow.get(0).getDurationMs(), 1e-9);
    }

    @Test
    void testNoInvalidationsMarker() {
        InvalidationFrequencyStats stats = monitor.getInvalidationFrequencyStats();

        assertEquals(Boolean.TRUE, stats.getNoInvalidations());
        assertEquals(0, stats.getTotalInvalidations());
        assertEquals(Severity.NORMAL, stats.getThresholds().getCurrentAlertLevel());
        assertNull(stats.getRates());
        assertTrue(monitor.getInvalidationRecommendations().isEmpty());
    }

    @Test
    void testInvalidationFrequencyStats() {
        properties.getMonitoring().setRetention(Duration.ofHours(48));
        monitor = new PerformanceMonitor(properties, clock);

        recordInvalidation("summarize", 2);
        clock.advance(Duration.ofHours(2));
        recordInvalidation("summarize", 4);
        recordInvalidation("sentiment", 0);
        monitor.recordInvalidationEvent("memory_cache", 6, Duration.ofMillis(1), InvalidationType.MEMORY, "", null);

        InvalidationFrequencyStats stats = monitor.getInvalidationFrequencyStats();

        assertNull(stats.getNoInvalidations());
        assertEquals(4, stats.getTotalInvalidations());
        assertEquals(12, stats.getTotalKeysInvalidated());
        assertEquals(3, stats.getRates().getLastHour());
        assertEquals(4, stats.getRates().getLast24Hours());
        assertEquals(4 / 48.0, stats.getRates().getAveragePerHour(), 1e-9);
        assertEquals("summarize", stats.getPatterns().getMostCommonPatterns().keySet().iterator().next());
        assertEquals(2, stats.getPatterns().getMostCommonPatterns().get("summarize"));
        assertEquals(3, stats.getPatterns().getInvalidationTypes().get("manual"));
        assertEquals(1, stats.getPatterns().getInvalidationTypes().get("memory"));
        assertEquals(3.0, stats.getEfficiency().getAvgKeysPerInvalidation(), 1e-9);
    }

    @Test
    void testAlertLevels() {
        properties.getMonitoring().setInvalidationWarningPerHour(2);
        properties.getMonitoring().setInvalidationCriticalPerHour(3);
        monitor = new PerformanceMonitor(properties, clock);

        recordInvalidation("a", 1);
        assertEquals(Severity.NORMAL, monitor.getInvalidationFrequencyStats().getThresholds().getCurrentAlertLevel());

        recordInvalidation("b", 1);
        assertEquals(Severity.WARNING, monitor.getInvalidationFrequencyStats().getThresholds().getCurrentAlertLevel());

        recordInvalidation("c", 1);
        assertEquals(Severity.CRITICAL, monitor.getInvalidationFrequencyStats().getThresholds().getCurrentAlertLevel());
    }

    @Test
    void testHighFrequencyRecommendation() {
        properties.getMonitoring().setInvalidationWarningPerHour(2);
        properties.getMonitoring().setInvalidationCriticalPerHour(4);
        monitor = new PerformanceMonitor(properties, clock);

        recordInvalidation("a", 5);
        recordInvalidation("b", 5);

        InvalidationRecommendation frequency = findIssue(monitor.getInvalidationRecommendations(),
                "High invalidation frequency");
        assertEquals(Severity.WARNING, frequency.getSeverity());
        assertTrue(frequency.getMessage().contains("2 times per hour"));
        assertFalse(frequency.getSuggestions().isEmpty());

        recordInvalidation("c", 5);
        recordInvalidation("d", 5);

        frequency = findIssue(monitor.getInvalidationRecommendations(), "High invalidation frequency");
        assertEquals(Severity.CRITICAL, frequency.getSeverity());
    }

    @Test
    void testDominantPatternRecommendation() {
        recordInvalidation("summarize", 5);
        recordInvalidation("summarize", 5);
        recordInvalidation("sentiment", 5);

        InvalidationRecommendation dominant = findIssue(monitor.getInvalidationRecommendations(),
                "Dominant invalidation pattern");
        assertEquals(Severity.INFO, dominant.getSeverity());
        assertTrue(dominant.getMessage().contains("'summarize'"));
    }

    @Test
    void testEfficiencyRecommendations() {
        recordInvalidation("a", 0);
        recordInvalidation("b", 0);
        assertEquals(Severity.INFO, findIssue(monitor.getInvalidationRecommendations(),
                "Low invalidation efficiency").getSeverity());

        monitor.resetStats();
        recordInvalidation("a", 150);
        recordInvalidation("b", 250);
        InvalidationRecommendation impact = findIssue(monitor.getInvalidationRecommendations(),
                "High invalidation impact");
        assertEquals(Severity.WARNING, impact.getSeverity());
        assertTrue(impact.getMessage().contains("200"));
    }

    @Test
    void testMemoryUsageStatsAndWarnings() {
        properties.getMonitoring().setMemoryWarningThresholdBytes(1000);
        properties.getMonitoring().setMemoryCriticalThresholdBytes(2000);
        monitor = new PerformanceMonitor(properties, clock);

        assertEquals(Boolean.TRUE, monitor.getMemoryUsageStats().getNoMeasurements());
        assertTrue(monitor.getMemoryWarnings().isEmpty());

        monitor.recordMemoryUsage(10, 500, 100, 20L, 300L, null);
        clock.advance(Duration.ofMinutes(30));
        monitor.recordMemoryUsage(95, 1200, 100, 20L, 300L, null);

        MemoryUsageStats stats = monitor.getMemoryUsageStats();
        assertNull(stats.getNoMeasurements());
        assertEquals(115, stats.getCurrent().getCacheEntryCount());
        assertEquals(95, stats.getCurrent().getMemoryCacheEntryCount());
        assertTrue(stats.getCurrent().isWarningThresholdReached());
        assertFalse(stats.getThresholds().isCriticalThresholdReached());
        assertEquals(2, stats.getTrends().getTotalMeasurements());
        assertTrue(stats.getTrends().getGrowthRateMbPerHour() > 0);

        List<MemoryWarning> warnings = monitor.getMemoryWarnings();
        assertEquals(2, warnings.size());
        assertEquals(Severity.WARNING, warnings.get(0).getSeverity());
        assertEquals(Severity.INFO, warnings.get(1).getSeverity());

        monitor.recordMemoryUsage(10, 2500, 100, null, null, null);
        assertEquals(Severity.CRITICAL, monitor.getMemoryWarnings().get(0).getSeverity());
        assertNotNull(monitor.getPerformanceStats().getMemoryUsage());
    }

    @Test
    void testResetClearsEverything() {
        recordGet(true);
        monitor.recordKeyGenerationTime(Duration.ofMillis(1), 10, "summarize", null);
        monitor.recordCompressionRatio(2000, 500, Duration.ofMillis(1), "summarize");
        monitor.recordMemoryUsage(1, 100, 100, null, null, null);
        recordInvalidation("summarize", 3);

        monitor.resetStats();

        MetricsExport export = monitor.exportMetrics();
        assertTrue(export.getKeyGenerationTimes().isEmpty());
        assertTrue(export.getCacheOperationTimes().isEmpty());
        assertTrue(export.getCompressionRatios().isEmpty());
        assertTrue(export.getMemoryUsageMeasurements().isEmpty());
        assertTrue(export.getInvalidationEvents().isEmpty());
        assertEquals(0, export.getCacheHits());
        assertEquals(0, export.getTotalOperations());
        assertEquals(0, export.getTotalInvalidations());
        assertEquals(0, export.getTotalKeysInvalidated());
    }

    @Test
    void testExportIncludesCountersAndTimestamp() {
        recordGet(false);
        recordInvalidation("summarize", 3);

        MetricsExport export = monitor.exportMetrics();

        assertEquals(1, export.getCacheMisses());
        assertEquals(1, export.getTotalInvalidations());
        assertEquals(3, export.getTotalKeysInvalidated());
        assertEquals(clock.instant(), export.getExportTimestamp());
        assertEquals("test", export.getInvalidationEvents().get(0).getOperationContext());
    }

    @Test
    void testInvalidConfigurationRejected() {
        properties.getMonitoring().setInvalidationWarningPerHour(200);
        assertThrows(IllegalArgumentException.class, () -> new PerformanceMonitor(properties, clock));

        properties = new TextCacheProperties();
        properties.getMonitoring().setMaxMeasurements(0);
        assertThrows(IllegalArgumentException.class, () -> new PerformanceMonitor(properties, clock));
    }

    private static InvalidationRecommendation findIssue(List<InvalidationRecommendation> recommendations,
                                                        String issue) {
        return recommendations.stream()
                .filter(r -> issue.equals(r.getIssue()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No recommendation: " + issue));
    }
}
