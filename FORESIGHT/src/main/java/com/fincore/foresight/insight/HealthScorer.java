package com.fincore.foresight.insight;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.exception.NoDataException;
import com.fincore.foresight.domain.model.HealthIssue;
import com.fincore.foresight.domain.model.HealthSignal;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.repository.MetricStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives an aggregate system health score from the most recent raw observations.
 * <p>
 * Three categories are scored independently, each only when matching metrics exist:
 * error rate, latency and CPU. The overall score is the mean of the categories present,
 * or a neutral 0.5 when none is. Trained models are not consulted.
 */
@Slf4j
@Component
public class HealthScorer {

    static final double NEUTRAL_SCORE = 0.5;
    static final int CATEGORY_COUNT_FOR_FULL_CONFIDENCE = 5;

    private static final double ERROR_RATE_THRESHOLD = 0.05;
    private static final double LATENCY_THRESHOLD_MS = 500.0;
    private static final double CPU_THRESHOLD_PERCENT = 70.0;

    private final MetricStore metricStore;
    private final ForesightProperties.Health settings;
    private final Clock clock;

    public HealthScorer(MetricStore metricStore, ForesightProperties properties, Clock clock) {
        this.metricStore = metricStore;
        this.settings = properties.getHealth();
        this.clock = clock;
    }

    /**
     * Score the observations of the configured trailing window.
     *
     * @throws NoDataException when the store holds no points at all
     */
    public HealthSignal assess() {
        if (metricStore.isEmpty()) {
            throw new NoDataException("No metrics data available");
        }
        Instant now = clock.instant();
        List<MetricPoint> recent = metricStore.query(null, null, now.minus(settings.getWindow()), null);
        return assess(recent, now);
    }

    HealthSignal assess(List<MetricPoint> recent, Instant now) {
        List<Double> scores = new ArrayList<>();
        List<HealthIssue> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        Mean mean = new Mean();

        List<MetricPoint> errors = MetricCategories.matching(recent, "error");
        if (!errors.isEmpty()) {
            double errorRate = mean.evaluate(MetricCategories.values(errors));
            scores.add(Math.max(0.0, 1.0 - errorRate * 10.0));
            if (errorRate > ERROR_RATE_THRESHOLD) {
                issues.add(HealthIssue.builder()
                        .type("high_error_rate")
                        .severity("high")
                        .description(String.format(Locale.ROOT,
                                "Error rate is %.2f%%, above 5%% threshold", errorRate * 100.0))
                        .affectedSources(MetricCategories.sources(errors))
                        .build());
                recommendations.add("Investigate error logs and recent deployments");
            }
        }

        List<MetricPoint> latencies = MetricCategories.matching(recent, "duration", "latency");
        if (!latencies.isEmpty()) {
            double latency = mean.evaluate(MetricCategories.values(latencies));
            scores.add(Math.max(0.0, 1.0 - latency / 1000.0));
            if (latency > LATENCY_THRESHOLD_MS) {
                issues.add(HealthIssue.builder()
                        .type("high_latency")
                        .severity("medium")
                        .description(String.format(Locale.ROOT,
                                "Average response time is %.0fms, above 500ms threshold", latency))
                        .affectedSources(MetricCategories.sources(latencies))
                        .build());
                recommendations.add("Consider scaling services or optimizing database queries");
            }
        }

        List<MetricPoint> cpu = MetricCategories.matching(recent, "cpu");
        if (!cpu.isEmpty()) {
            double cpuUsage = mean.evaluate(MetricCategories.values(cpu));
            scores.add(Math.max(0.0, 1.0 - cpuUsage / 100.0));
            if (cpuUsage > CPU_THRESHOLD_PERCENT) {
                issues.add(HealthIssue.builder()
                        .type("high_cpu_usage")
                        .severity("high")
                        .description(String.format(Locale.ROOT,
                                "CPU usage is %.1f%%, above 70%% threshold", cpuUsage))
                        .affectedSources(MetricCategories.sources(cpu))
                        .build());
                recommendations.add("Scale horizontally or optimize CPU-intensive operations");
            }
        }

        double overall = scores.isEmpty()
                ? NEUTRAL_SCORE
                : scores.stream().mapToDouble(Double::doubleValue).average().orElse(NEUTRAL_SCORE);
        double confidence = Math.min(1.0, (double) scores.size() / CATEGORY_COUNT_FOR_FULL_CONFIDENCE);

        if (overall < 0.7) {
            recommendations.add("System health is degrading - consider immediate intervention");
        } else if (overall < 0.8) {
            recommendations.add("Monitor system closely - potential issues detected");
        } else {
            recommendations.add("System is healthy - maintain current monitoring");
        }

        log.debug("Health assessed over {} points: score={}, categories={}, issues={}",
                recent.size(), overall, scores.size(), issues.size());

        return HealthSignal.builder()
                .overallHealthScore(overall)
                .predictedIssues(issues)
                .recommendations(recommendations)
                .confidence(confidence)
                .predictionHorizon(settings.getPredictionHorizonMinutes())
                .generatedAt(now)
                .build();
    }
}
