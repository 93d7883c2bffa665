package com.fincore.foresight.domain.repository;

import com.fincore.foresight.domain.model.MetricPoint;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Bounded, arrival-ordered store of metric observations.
 */
public interface MetricStore {

    /**
     * Append points in the given order, evicting the oldest stored points once the
     * capacity is exceeded.
     *
     * @return number of points ingested
     */
    int append(Collection<MetricPoint> points);

    /**
     * Points matching every non-null filter, in arrival order. Null filters act as
     * wildcards; {@code since} and {@code until} are inclusive.
     */
    List<MetricPoint> query(String source, String metricName, Instant since, Instant until);

    /**
     * Point-in-time copy of the whole store, in arrival order.
     */
    List<MetricPoint> snapshot();

    int size();

    int capacity();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Drop every stored point.
     */
    void clear();
}
