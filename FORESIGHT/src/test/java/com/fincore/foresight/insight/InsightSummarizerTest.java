package com.fincore.foresight.insight;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.InsightSummary;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.ModelStatus;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.domain.repository.InMemoryMetricStore;
import com.fincore.foresight.feature.FeatureBuilder;
import com.fincore.foresight.ml.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.fincore.foresight.MetricPointFixtures.MONDAY_MIDNIGHT;
import static com.fincore.foresight.MetricPointFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InsightSummarizer}.
 */
class InsightSummarizerTest {

    private static final Instant NOW = MONDAY_MIDNIGHT.plus(Duration.ofHours(4));

    private InMemoryMetricStore store;
    private ModelRegistry registry;
    private InsightSummarizer summarizer;

    @BeforeEach
    void setUp() {
        ForesightProperties properties = new ForesightProperties();
        store = new InMemoryMetricStore(1_000);
        registry = new ModelRegistry(new FeatureBuilder(properties), properties);
        summarizer = new InsightSummarizer(store, registry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should return an empty low-risk summary for an empty store")
    void emptyStore() {
        InsightSummary summary = summarizer.summarize();

        assertThat(summary.getTimestamp()).isEqualTo(NOW);
        assertThat(summary.getKeyFindings()).isEmpty();
        assertThat(summary.getRiskAssessment().getOverallRisk()).isEqualTo(InsightSummary.RiskLevel.LOW);
        assertThat(summary.getRiskAssessment().getRiskFactors()).isEmpty();
    }

    @Test
    @DisplayName("should report sources whose deviation exceeds half their mean")
    void variability() {
        store.append(series("svc-a", "latency_ms", NOW.minus(Duration.ofHours(1)), 10, i -> i % 2 == 0 ? 1 : 100));
        store.append(series("svc-b", "latency_ms", NOW.minus(Duration.ofHours(1)), 10, i -> 100 + i % 2));

        InsightSummary summary = summarizer.summarize();

        assertThat(summary.getKeyFindings()).singleElement()
                .asString().startsWith("svc-a shows high performance variability (std: ");
        assertThat(summary.getRecommendations()).containsExactly("Investigate svc-a for potential instability");
        assertThat(summary.getRiskAssessment().getRiskFactors()).containsExactly("Insufficient monitoring data");
        assertThat(summary.getRiskAssessment().getOverallRisk()).isEqualTo(InsightSummary.RiskLevel.LOW);
    }

    @Test
    @DisplayName("should raise the risk level on elevated error rates")
    void elevatedErrors() {
        List<MetricPoint> points = new ArrayList<>(
                series("svc-a", "error_rate", NOW.minus(Duration.ofHours(3)), 120, i -> 0.08));
        store.append(points);

        InsightSummary summary = summarizer.summarize();

        assertThat(summary.getRiskAssessment().getOverallRisk()).isEqualTo(InsightSummary.RiskLevel.MEDIUM);
        assertThat(summary.getRiskAssessment().getRiskFactors()).containsExactly("Elevated error rates detected");
    }

    @Test
    @DisplayName("should ignore observations older than a day")
    void trailingDay() {
        store.append(series("svc-a", "latency_ms", NOW.minus(Duration.ofHours(30)), 10, i -> i % 2 == 0 ? 1 : 100));

        InsightSummary summary = summarizer.summarize();

        assertThat(summary.getKeyFindings()).isEmpty();
    }

    @Test
    @DisplayName("should report registry and store sizes")
    void modelStatus() {
        store.append(series("svc-a", "latency_ms", NOW.minus(Duration.ofHours(1)), 25, i -> 100 + i));
        registry.getOrCreateForecastModel(SeriesKey.of("svc-a", "latency_ms"))
                .train(store.snapshot());
        registry.getOrCreateAnomalyModel(SeriesKey.of("svc-a", "latency_ms"));

        ModelStatus status = summarizer.modelStatus();

        assertThat(status.getForecastModels()).isEqualTo(1);
        assertThat(status.getTrainedForecastModels()).isEqualTo(1);
        assertThat(status.getAnomalyModels()).isEqualTo(1);
        assertThat(status.getTrainedAnomalyModels()).isZero();
        assertThat(status.getStoredPoints()).isEqualTo(25);
        assertThat(status.getStoreCapacity()).isEqualTo(1_000);
    }
}
