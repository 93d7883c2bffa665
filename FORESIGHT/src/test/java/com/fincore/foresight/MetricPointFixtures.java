package com.fincore.foresight;

import com.fincore.foresight.domain.model.MetricPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Builders for synthetic metric series used across tests.
 */
public final class MetricPointFixtures {

    /** Monday 2024-01-01 00:00 UTC */
    public static final Instant MONDAY_MIDNIGHT = Instant.parse("2024-01-01T00:00:00Z");

    private MetricPointFixtures() {}

    public static MetricPoint point(String source, String metricName, Instant timestamp, double value) {
        return MetricPoint.builder()
                .timestamp(timestamp)
                .source(source)
                .metricName(metricName)
                .value(value)
                .build();
    }

    /**
     * {@code count} points one minute apart starting at {@code start}.
     */
    public static List<MetricPoint> series(String source, String metricName, Instant start, int count,
                                           IntToDoubleFunction valueAt) {
        List<MetricPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(point(source, metricName, start.plus(Duration.ofMinutes(i)), valueAt.applyAsDouble(i)));
        }
        return points;
    }

    /**
     * A bounded, deterministic wave around {@code base}.
     */
    public static double wave(int i, double base, double amplitude) {
        return base + amplitude * Math.sin(i / 3.0);
    }
}
