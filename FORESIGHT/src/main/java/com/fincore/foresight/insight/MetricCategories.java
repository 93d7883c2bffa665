package com.fincore.foresight.insight;

import com.fincore.foresight.domain.model.MetricPoint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Name-based metric categorisation shared by the derived signals.
 */
final class MetricCategories {

    private MetricCategories() {
    }

    /**
     * Points whose metric name contains any of the given fragments, ignoring case.
     */
    static List<MetricPoint> matching(Collection<MetricPoint> points, String... fragments) {
        List<MetricPoint> matches = new ArrayList<>();
        for (MetricPoint point : points) {
            String name = point.getMetricName().toLowerCase(Locale.ROOT);
            for (String fragment : fragments) {
                if (name.contains(fragment)) {
                    matches.add(point);
                    break;
                }
            }
        }
        return matches;
    }

    static double[] values(Collection<MetricPoint> points) {
        return points.stream().mapToDouble(MetricPoint::getValue).toArray();
    }

    /**
     * Distinct sources in first-seen order.
     */
    static List<String> sources(Collection<MetricPoint> points) {
        Set<String> sources = new LinkedHashSet<>();
        points.forEach(point -> sources.add(point.getSource()));
        return new ArrayList<>(sources);
    }
}
