package com.github.rudygunawan.tana.alert;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class AlertConfigTest {

    private static final Consumer<String> IGNORE = message -> { };

    @Test
    void testDefaults() {
        AlertConfig config = AlertConfig.defaults(IGNORE);

        assertEquals(0.5, config.hitRateThreshold());
        assertEquals(0.5, config.missRateThreshold());
        assertEquals(200, config.p95LatencyThresholdMs());
        assertEquals(300, config.p99LatencyThresholdMs());
        assertEquals(1000, config.evictionsPerMinuteThreshold());
        assertEquals(100, config.averageLatencyThresholdMs());
        assertEquals(Duration.ofMinutes(1), config.alertCheckInterval());
    }

    @Test
    void testBuilderOverrides() {
        List<String> received = new ArrayList<>();
        AlertConfig config = AlertConfig.builder(received::add)
                .hitRateThreshold(0.9)
                .missRateThreshold(0.1)
                .p95LatencyThresholdMs(20)
                .p99LatencyThresholdMs(30)
                .evictionsPerMinuteThreshold(5)
                .averageLatencyThresholdMs(10)
                .alertCheckInterval(Duration.ofSeconds(15))
                .build();

        assertEquals(0.9, config.hitRateThreshold());
        assertEquals(0.1, config.missRateThreshold());
        assertEquals(20, config.p95LatencyThresholdMs());
        assertEquals(30, config.p99LatencyThresholdMs());
        assertEquals(5, config.evictionsPerMinuteThreshold());
        assertEquals(10, config.averageLatencyThresholdMs());
        assertEquals(Duration.ofSeconds(15), config.alertCheckInterval());

        config.notifyCallback().accept("hello");
        assertEquals(List.of("hello"), received);
    }

    @Test
    void testInvalidValues() {
        assertThrows(NullPointerException.class, () -> AlertConfig.builder(null));

        AlertConfig.Builder builder = AlertConfig.builder(IGNORE);
        assertThrows(IllegalArgumentException.class, () -> builder.hitRateThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> builder.missRateThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> builder.p95LatencyThresholdMs(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.p99LatencyThresholdMs(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.evictionsPerMinuteThreshold(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.averageLatencyThresholdMs(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.alertCheckInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.alertCheckInterval(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> builder.alertCheckInterval(null));
    }
}
