package com.fincore.foresight.insight;

import com.fincore.foresight.domain.model.InsightSummary;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.ModelStatus;
import com.fincore.foresight.domain.repository.MetricStore;
import com.fincore.foresight.ml.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cross-series findings over the last day: source variability and a coarse risk level.
 */
@Slf4j
@Component
public class InsightSummarizer {

    static final Duration WINDOW = Duration.ofHours(24);
    static final int MIN_MONITORING_POINTS = 100;

    private static final double VARIABILITY_RATIO = 0.5;
    private static final double ERROR_RATE_THRESHOLD = 0.05;

    private final MetricStore metricStore;
    private final ModelRegistry modelRegistry;
    private final Clock clock;

    public InsightSummarizer(MetricStore metricStore, ModelRegistry modelRegistry, Clock clock) {
        this.metricStore = metricStore;
        this.modelRegistry = modelRegistry;
        this.clock = clock;
    }

    public InsightSummary summarize() {
        Instant now = clock.instant();
        InsightSummary summary = InsightSummary.builder()
                .timestamp(now)
                .modelsStatus(modelStatus())
                .riskAssessment(InsightSummary.RiskAssessment.builder().build())
                .build();

        if (metricStore.isEmpty()) {
            return summary;
        }

        List<MetricPoint> recent = metricStore.query(null, null, now.minus(WINDOW), null);

        Map<String, DescriptiveStatistics> bySource = new LinkedHashMap<>();
        for (MetricPoint point : recent) {
            bySource.computeIfAbsent(point.getSource(), s -> new DescriptiveStatistics())
                    .addValue(point.getValue());
        }
        bySource.forEach((source, stats) -> {
            double deviation = stats.getStandardDeviation();
            if (deviation > stats.getMean() * VARIABILITY_RATIO) {
                summary.getKeyFindings().add(String.format(Locale.ROOT,
                        "%s shows high performance variability (std: %.2f)", source, deviation));
                summary.getRecommendations().add("Investigate " + source + " for potential instability");
            }
        });

        InsightSummary.RiskAssessment risk = summary.getRiskAssessment();
        if (recent.size() < MIN_MONITORING_POINTS) {
            risk.getRiskFactors().add("Insufficient monitoring data");
        }
        double[] errorValues = MetricCategories.values(MetricCategories.matching(recent, "error"));
        if (errorValues.length > 0 && new DescriptiveStatistics(errorValues).getMean() > ERROR_RATE_THRESHOLD) {
            risk.getRiskFactors().add("Elevated error rates detected");
            risk.setOverallRisk(InsightSummary.RiskLevel.MEDIUM);
        }

        log.debug("Insight summary over {} points: {} findings, risk {}",
                recent.size(), summary.getKeyFindings().size(), risk.getOverallRisk());
        return summary;
    }

    public ModelStatus modelStatus() {
        return ModelStatus.builder()
                .forecastModels(modelRegistry.forecastModelCount())
                .trainedForecastModels(modelRegistry.trainedForecastModelCount())
                .anomalyModels(modelRegistry.anomalyModelCount())
                .trainedAnomalyModels(modelRegistry.trainedAnomalyModelCount())
                .storedPoints(metricStore.size())
                .storeCapacity(metricStore.capacity())
                .build();
    }
}
