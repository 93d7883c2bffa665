package com.fincore.foresight.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single timestamped observation of one metric emitted by one source.
 * <p>
 * Points are immutable once created; the labels map is copied on construction.
 */
@Value
public class MetricPoint {

    /** Observation time */
    Instant timestamp;

    /** Series owner, typically a service name */
    String source;

    /** Metric name within the source */
    String metricName;

    /** Observed value */
    double value;

    /** Optional free-form labels */
    Map<String, String> labels;

    @Builder
    public MetricPoint(Instant timestamp, String source, String metricName, double value,
                       Map<String, String> labels) {
        this.timestamp = timestamp;
        this.source = source;
        this.metricName = metricName;
        this.value = value;
        this.labels = labels == null || labels.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Identity of the series this point belongs to.
     */
    public SeriesKey seriesKey() {
        return new SeriesKey(source, metricName);
    }
}
