package com.fincore.foresight.feature;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.MetricPoint;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a slice of one series into numeric feature vectors.
 * <p>
 * Forecast rows are the {@code windowSize} previous values followed by hour-of-day,
 * weekday (Monday = 0) and the row index as a trend proxy. Anomaly rows are the value,
 * its relative rate of change, hour-of-day and weekday.
 */
@Component
public class FeatureBuilder {

    /** Calendar and trend features appended after the value window */
    public static final int TIME_FEATURES = 3;

    /** Width of an anomaly feature row */
    public static final int ANOMALY_FEATURES = 4;

    private static final Duration STEP = Duration.ofMinutes(1);

    private final int windowSize;
    private final ZoneId zone;
    private final double epsilon;

    @Autowired
    public FeatureBuilder(ForesightProperties properties) {
        this(properties.getFeatures().getWindowSize(),
                properties.getFeatures().zoneId(),
                properties.getFeatures().getEpsilon());
    }

    public FeatureBuilder(int windowSize, ZoneId zone, double epsilon) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
        this.zone = zone;
        this.epsilon = epsilon;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int forecastFeatureWidth() {
        return windowSize + TIME_FEATURES;
    }

    /**
     * Copy of the slice ordered by ascending timestamp. Ties keep arrival order.
     */
    public static List<MetricPoint> sortByTimestamp(Collection<MetricPoint> series) {
        List<MetricPoint> sorted = new ArrayList<>(series);
        sorted.sort(Comparator.comparing(MetricPoint::getTimestamp));
        return sorted;
    }

    /**
     * One row per index {@code i >= windowSize}; the target is {@code values[i]}.
     * Yields an empty set when the slice has no more than {@code windowSize} points.
     */
    public TrainingSet buildTrainingSet(Collection<MetricPoint> series) {
        List<MetricPoint> sorted = sortByTimestamp(series);
        int rows = Math.max(0, sorted.size() - windowSize);
        double[][] features = new double[rows][];
        double[] targets = new double[rows];

        for (int i = windowSize; i < sorted.size(); i++) {
            double[] row = new double[forecastFeatureWidth()];
            for (int w = 0; w < windowSize; w++) {
                row[w] = sorted.get(i - windowSize + w).getValue();
            }
            Instant timestamp = sorted.get(i).getTimestamp();
            row[windowSize] = hourOfDay(timestamp);
            row[windowSize + 1] = weekday(timestamp);
            row[windowSize + 2] = i;

            features[i - windowSize] = row;
            targets[i - windowSize] = sorted.get(i).getValue();
        }
        return new TrainingSet(features, targets);
    }

    /**
     * Timestamp of forecast step {@code step} (1-based), one minute apart.
     */
    public Instant stepTimestamp(Instant lastTimestamp, int step) {
        return lastTimestamp.plus(STEP.multipliedBy(step));
    }

    /**
     * Feature row for forecast step {@code step} given the current trailing window.
     *
     * @param window        trailing values, exactly {@code windowSize} long
     * @param lastTimestamp timestamp of the last observed point
     * @param step          1-based step beyond the last observed point
     * @param historyLength number of historical points the window was taken from
     */
    public double[] buildStepFeatures(double[] window, Instant lastTimestamp, int step, int historyLength) {
        if (window.length != windowSize) {
            throw new IllegalArgumentException("Window must hold " + windowSize
                    + " values but holds " + window.length);
        }
        Instant future = stepTimestamp(lastTimestamp, step);
        double[] row = new double[forecastFeatureWidth()];
        System.arraycopy(window, 0, row, 0, windowSize);
        row[windowSize] = hourOfDay(future);
        row[windowSize + 1] = weekday(future);
        row[windowSize + 2] = historyLength + step - 1;
        return row;
    }

    /**
     * One row per index {@code i >= 1} of the timestamp-sorted slice.
     */
    public double[][] buildAnomalyFeatures(Collection<MetricPoint> series) {
        List<MetricPoint> sorted = sortByTimestamp(series);
        int rows = Math.max(0, sorted.size() - 1);
        double[][] features = new double[rows][];

        for (int i = 1; i < sorted.size(); i++) {
            double current = sorted.get(i).getValue();
            double previous = sorted.get(i - 1).getValue();
            Instant timestamp = sorted.get(i).getTimestamp();
            features[i - 1] = new double[]{
                    current,
                    (current - previous) / (previous + epsilon),
                    hourOfDay(timestamp),
                    weekday(timestamp)
            };
        }
        return features;
    }

    int hourOfDay(Instant timestamp) {
        return ZonedDateTime.ofInstant(timestamp, zone).getHour();
    }

    int weekday(Instant timestamp) {
        return ZonedDateTime.ofInstant(timestamp, zone).getDayOfWeek().getValue() - 1;
    }
}
