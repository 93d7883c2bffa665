package com.fincore.foresight.insight;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.exception.NoDataException;
import com.fincore.foresight.domain.exception.SeriesNotFoundException;
import com.fincore.foresight.domain.model.CapacityPlan;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.repository.MetricStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Extrapolates the resource needs of one source under compound monthly growth.
 * <p>
 * A value {@code v} observed today is projected to {@code v * (1 + rate)^(days / 30)}.
 * Categories are matched by metric name fragment; categories without data are left
 * out of the plan.
 */
@Slf4j
@Component
public class CapacityProjector {

    static final List<String> CATEGORIES = List.of("cpu", "memory", "connections", "requests");

    private static final double DAYS_PER_MONTH = 30.0;
    private static final double SCALE_PEAK_PERCENT = 80.0;
    private static final double MONITOR_GROWTH_FACTOR = 1.5;
    private static final int MAX_TIMELINE_WEEKS = 4;

    private final MetricStore metricStore;
    private final ForesightProperties.Capacity settings;
    private final Clock clock;

    public CapacityProjector(MetricStore metricStore, ForesightProperties properties, Clock clock) {
        this.metricStore = metricStore;
        this.settings = properties.getCapacity();
        this.clock = clock;
    }

    /**
     * Project the capacity of {@code source} {@code horizonDays} ahead.
     *
     * @throws NoDataException         when the store holds no points at all
     * @throws SeriesNotFoundException when the source has never reported
     */
    public CapacityPlan plan(String source, double growthRate, int horizonDays) {
        if (metricStore.isEmpty()) {
            throw new NoDataException("No metrics data available");
        }
        if (metricStore.query(source, null, null, null).isEmpty()) {
            throw new SeriesNotFoundException("No data found for service: " + source);
        }
        Instant now = clock.instant();
        List<MetricPoint> recent = metricStore.query(source, null, now.minus(settings.getWindow()), null);
        return plan(source, recent, growthRate, horizonDays, now);
    }

    CapacityPlan plan(String source, List<MetricPoint> recent, double growthRate, int horizonDays, Instant now) {
        double multiplier = growthMultiplier(growthRate, horizonDays / DAYS_PER_MONTH);
        CapacityPlan plan = CapacityPlan.builder()
                .source(source)
                .generatedAt(now)
                .build();

        for (String category : CATEGORIES) {
            double[] values = MetricCategories.values(MetricCategories.matching(recent, category));
            if (values.length == 0) {
                continue;
            }
            boolean percentage = isPercentage(category);
            double currentAverage = StatUtils.mean(values);
            double currentPeak = StatUtils.max(values);
            double projectedAverage = currentAverage * multiplier;
            double projectedPeak = currentPeak * multiplier;

            plan.getCurrentCapacity().put(category, CapacityPlan.CurrentUsage.builder()
                    .average(currentAverage)
                    .peak(currentPeak)
                    .unit(percentage ? "percent" : "count")
                    .build());
            plan.getPredictedCapacityNeeds().put(category, CapacityPlan.ProjectedUsage.builder()
                    .average(projectedAverage)
                    .peak(projectedPeak)
                    .growthFactor(multiplier)
                    .build());

            if (percentage && projectedPeak > SCALE_PEAK_PERCENT) {
                plan.getScalingRecommendations().add(String.format(Locale.ROOT,
                        "Scale %s capacity - projected to reach %.1f%% in %d days",
                        category, projectedPeak, horizonDays));
            } else if (projectedAverage > currentAverage * MONITOR_GROWTH_FACTOR) {
                plan.getScalingRecommendations().add(String.format(Locale.ROOT,
                        "Monitor %s usage - %.1f%% increase expected",
                        category, (multiplier - 1.0) * 100.0));
            }

            int weeks = Math.min(MAX_TIMELINE_WEEKS, horizonDays / 7);
            for (int week = 1; week <= weeks; week++) {
                double projected = currentAverage * growthMultiplier(growthRate, week * 7 / DAYS_PER_MONTH);
                plan.getTimeline().add(CapacityPlan.Milestone.builder()
                        .week(week)
                        .metric(category)
                        .projectedValue(projected)
                        .capacityUtilization(percentage ? projected / 100.0 : projected)
                        .build());
            }
        }

        double baseCost = settings.getBaseMonthlyCost();
        double additionalCost = baseCost * (multiplier - 1.0);
        plan.setCostImplications(CapacityPlan.CostEstimate.builder()
                .currentMonthlyCost(baseCost)
                .projectedMonthlyCost(baseCost * multiplier)
                .additionalCost(additionalCost)
                .costPerUserGrowth(additionalCost / Math.max(1.0, growthRate * 100.0))
                .build());

        log.debug("Capacity plan for {}: {} categories, {} recommendations",
                source, plan.getCurrentCapacity().size(), plan.getScalingRecommendations().size());
        return plan;
    }

    static double growthMultiplier(double growthRate, double months) {
        return Math.pow(1.0 + growthRate, months);
    }

    private static boolean isPercentage(String category) {
        return "cpu".equals(category) || "memory".equals(category);
    }
}
