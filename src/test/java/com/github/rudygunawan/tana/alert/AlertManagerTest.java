package com.github.rudygunawan.tana.alert;

import com.github.rudygunawan.tana.metrics.CacheMetrics;
import com.github.rudygunawan.tana.time.FakeTicker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AlertManagerTest {

    @Test
    void testLowHitRateAlert() {
        List<String> received = new CopyOnWriteArrayList<>();
        CacheMetrics metrics = new CacheMetrics();
        metrics.recordHit(Duration.ofMillis(1));
        for (int i = 0; i < 9; i++) {
            metrics.recordMiss();
        }
        AlertManager manager = new AlertManager(metrics,
                AlertConfig.builder(received::add).hitRateThreshold(0.5).build());

        List<String> alerts = manager.checkAlerts();

        assertEquals(alerts, received);
        assertEquals(2, received.size());
        assertTrue(received.get(0).contains("Low hit rate"));
        assertTrue(received.get(0).contains("Actual: 0.1"));
        assertTrue(received.get(0).contains("Threshold: 0.5"));
        assertTrue(received.get(1).contains("High miss rate"));
        assertTrue(received.get(1).contains("Actual: 0.9"));
    }

    @Test
    void testHealthyMetricsRaiseNothing() {
        List<String> received = new CopyOnWriteArrayList<>();
        CacheMetrics metrics = new CacheMetrics();
        for (int i = 0; i < 9; i++) {
            metrics.recordHit(Duration.ofMillis(1));
        }
        metrics.recordMiss();
        AlertManager manager = new AlertManager(metrics, AlertConfig.defaults(received::add));

        assertTrue(manager.checkAlerts().isEmpty());
        assertTrue(received.isEmpty());
    }

    @Test
    void testIdleCacheReportsLowHitRate() {
        // With no requests the hit rate is 0.0, which is below any positive floor
        List<String> received = new CopyOnWriteArrayList<>();
        AlertManager manager = new AlertManager(new CacheMetrics(), AlertConfig.defaults(received::add));

        manager.checkAlerts();

        assertEquals(1, received.size());
        assertTrue(received.get(0).contains("Low hit rate"));
    }

    @Test
    void testLatencyAlerts() {
        List<String> received = new CopyOnWriteArrayList<>();
        CacheMetrics metrics = new CacheMetrics();
        for (int i = 0; i < 100; i++) {
            metrics.recordHit(Duration.ofMillis(350));
        }
        AlertManager manager = new AlertManager(metrics, AlertConfig.defaults(received::add));

        manager.checkAlerts();

        assertEquals(3, received.size());
        assertTrue(received.get(0).contains("High p95 latency"));
        assertTrue(received.get(0).contains("Actual: 350ms (Threshold: 200ms)"));
        assertTrue(received.get(1).contains("High p99 latency"));
        assertTrue(received.get(1).contains("Threshold: 300ms"));
        assertTrue(received.get(2).contains("High average latency"));
        assertTrue(received.get(2).contains("Threshold: 100ms"));
    }

    @Test
    void testLatencyEqualToThresholdDoesNotAlert() {
        List<String> received = new CopyOnWriteArrayList<>();
        CacheMetrics metrics = new CacheMetrics();
        metrics.recordHit(Duration.ofMillis(100));
        AlertManager manager = new AlertManager(metrics, AlertConfig.builder(received::add)
                .p95LatencyThresholdMs(100)
                .p99LatencyThresholdMs(100)
                .averageLatencyThresholdMs(100)
                .build());

        manager.checkAlerts();

        assertTrue(received.isEmpty(), received.toString());
    }

    @Test
    void testEvictionRateAlert() {
        List<String> received = new CopyOnWriteArrayList<>();
        FakeTicker ticker = new FakeTicker();
        CacheMetrics metrics = new CacheMetrics(ticker);
        metrics.recordHit(Duration.ofMillis(1));
        metrics.recordEviction();
        metrics.recordEviction();
        metrics.recordEviction();
        AlertManager manager = new AlertManager(metrics, AlertConfig.builder(received::add)
                .evictionsPerMinuteThreshold(2)
                .build());

        manager.checkAlerts();
        assertEquals(1, received.size());
        assertTrue(received.get(0).contains("High eviction rate"));
        assertTrue(received.get(0).contains("Actual: 3 evictions/min"));

        // Outside the check interval the evictions no longer count
        ticker.advance(2, TimeUnit.MINUTES);
        received.clear();
        manager.checkAlerts();
        assertTrue(received.isEmpty());
    }

    @Test
    void testCallbackFailureDoesNotStopOtherAlerts() {
        AtomicInteger calls = new AtomicInteger();
        CacheMetrics metrics = new CacheMetrics();
        metrics.recordMiss();
        AlertManager manager = new AlertManager(metrics, AlertConfig.defaults(message -> {
            calls.incrementAndGet();
            throw new IllegalStateException("notification channel down");
        }));

        List<String> alerts = assertDoesNotThrow(manager::checkAlerts);

        assertEquals(2, alerts.size());
        assertEquals(2, calls.get());
    }

    @Test
    @Timeout(10)
    void testTimerRunsChecksPeriodically() throws Exception {
        CountDownLatch latch = new CountDownLatch(3);
        AlertConfig config = AlertConfig.builder(message -> {
                    latch.countDown();
                    throw new RuntimeException("failing callback must not cancel the timer");
                })
                .missRateThreshold(1.0)
                .alertCheckInterval(Duration.ofMillis(20))
                .build();
        AlertManager manager = new AlertManager(new CacheMetrics(), config);
        assertEquals(AlertManager.State.IDLE, manager.state());

        manager.start();
        manager.start();
        assertEquals(AlertManager.State.MONITORING, manager.state());

        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } finally {
            manager.close();
        }
        assertEquals(AlertManager.State.CLOSED, manager.state());
    }

    @Test
    void testCloseIsFinal() {
        AlertManager manager = new AlertManager(new CacheMetrics(), AlertConfig.defaults(message -> { }));
        manager.close();
        manager.close();

        assertEquals(AlertManager.State.CLOSED, manager.state());
        assertThrows(IllegalStateException.class, manager::start);
    }
}
