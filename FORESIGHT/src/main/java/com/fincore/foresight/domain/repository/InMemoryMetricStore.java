package com.fincore.foresight.domain.repository;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.MetricPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-memory FIFO store keeping the most recent {@code capacity} points.
 * <p>
 * Readers always receive copies, so a training pass works on a snapshot while
 * ingestion keeps appending.
 */
@Slf4j
@Repository
public class InMemoryMetricStore implements MetricStore {

    private final int capacity;
    private final Deque<MetricPoint> points = new ArrayDeque<>();

    @Autowired
    public InMemoryMetricStore(ForesightProperties properties) {
        this(properties.getStore().getCapacity());
    }

    public InMemoryMetricStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Store capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized int append(Collection<MetricPoint> batch) {
        // all or nothing: reject the batch before any point lands
        batch.forEach(point -> Objects.requireNonNull(point, "point"));
        points.addAll(batch);

        int evicted = 0;
        while (points.size() > capacity) {
            points.pollFirst();
            evicted++;
        }
        if (evicted > 0) {
            log.debug("Evicted {} oldest points, store at capacity {}", evicted, capacity);
        }
        return batch.size();
    }

    @Override
    public synchronized List<MetricPoint> query(String source, String metricName,
                                                Instant since, Instant until) {
        List<MetricPoint> result = new ArrayList<>();
        for (MetricPoint point : points) {
            if (source != null && !source.equals(point.getSource())) {
                continue;
            }
            if (metricName != null && !metricName.equals(point.getMetricName())) {
                continue;
            }
            if (since != null && point.getTimestamp().isBefore(since)) {
                continue;
            }
            if (until != null && point.getTimestamp().isAfter(until)) {
                continue;
            }
            result.add(point);
        }
        return result;
    }

    @Override
    public synchronized List<MetricPoint> snapshot() {
        return new ArrayList<>(points);
    }

    @Override
    public synchronized int size() {
        return points.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public synchronized void clear() {
        points.clear();
    }
}
