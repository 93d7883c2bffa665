package com.fincore.foresight.domain.model;

import lombok.Value;

/**
 * Identity of one logical time series: a (source, metric name) pair.
 * All models are keyed by it.
 */
@Value
public class SeriesKey {

    String source;
    String metricName;

    public static SeriesKey of(String source, String metricName) {
        return new SeriesKey(source, metricName);
    }

    @Override
    public String toString() {
        return source + "/" + metricName;
    }
}
