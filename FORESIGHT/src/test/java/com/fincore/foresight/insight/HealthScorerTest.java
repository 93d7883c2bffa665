package com.fincore.foresight.insight;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.exception.NoDataException;
import com.fincore.foresight.domain.model.HealthIssue;
import com.fincore.foresight.domain.model.HealthSignal;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.repository.InMemoryMetricStore;
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
import static com.fincore.foresight.MetricPointFixtures.point;
import static com.fincore.foresight.MetricPointFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link HealthScorer}.
 */
class HealthScorerTest {

    private static final Instant NOW = MONDAY_MIDNIGHT.plus(Duration.ofHours(2));

    private InMemoryMetricStore store;
    private HealthScorer scorer;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetricStore(1_000);
        scorer = new HealthScorer(store, new ForesightProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should return a neutral score when no category matches")
    void neutralWithoutCategories() {
        HealthSignal signal = scorer.assess(
                series("svc-a", "queue_depth", NOW.minusSeconds(600), 5, i -> 3), NOW);

        assertThat(signal.getOverallHealthScore()).isEqualTo(HealthScorer.NEUTRAL_SCORE);
        assertThat(signal.getConfidence()).isZero();
        assertThat(signal.getPredictedIssues()).isEmpty();
        assertThat(signal.getPredictionHorizon()).isEqualTo(60);
        assertThat(signal.getGeneratedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("should raise an error rate issue above 5%")
    void highErrorRate() {
        List<MetricPoint> recent = new ArrayList<>(series("svc-a", "error_rate", NOW.minusSeconds(600), 3, i -> 0.1));
        recent.add(point("svc-b", "http_errors", NOW.minusSeconds(60), 0.1));

        HealthSignal signal = scorer.assess(recent, NOW);

        assertThat(signal.getOverallHealthScore()).isCloseTo(0.0, within(1e-9));
        assertThat(signal.getPredictedIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getType()).isEqualTo("high_error_rate");
            assertThat(issue.getSeverity()).isEqualTo("high");
            assertThat(issue.getDescription()).isEqualTo("Error rate is 10.00%, above 5% threshold");
            assertThat(issue.getAffectedSources()).containsExactly("svc-a", "svc-b");
        });
        assertThat(signal.getRecommendations()).containsExactly(
                "Investigate error logs and recent deployments",
                "System health is degrading - consider immediate intervention");
    }

    @Test
    @DisplayName("should average the categories present")
    void averagesCategories() {
        List<MetricPoint> recent = new ArrayList<>();
        recent.add(point("svc-a", "request_latency_ms", NOW.minusSeconds(60), 200));
        recent.add(point("svc-a", "cpu_percent", NOW.minusSeconds(60), 50));

        HealthSignal signal = scorer.assess(recent, NOW);

        assertThat(signal.getOverallHealthScore()).isCloseTo(0.65, within(1e-9));
        assertThat(signal.getConfidence()).isCloseTo(0.4, within(1e-9));
        assertThat(signal.getPredictedIssues()).isEmpty();
    }

    @Test
    @DisplayName("should match metric names case-insensitively")
    void caseInsensitive() {
        HealthSignal signal = scorer.assess(
                List.of(point("svc-a", "CPU_Usage", NOW.minusSeconds(60), 90)), NOW);

        assertThat(signal.getPredictedIssues()).extracting(HealthIssue::getType).containsExactly("high_cpu_usage");
        assertThat(signal.getPredictedIssues().get(0).getDescription())
                .isEqualTo("CPU usage is 90.0%, above 70% threshold");
    }

    @Test
    @DisplayName("should flag latency above 500ms as a medium issue")
    void highLatency() {
        HealthSignal signal = scorer.assess(
                List.of(point("svc-a", "request_duration", NOW.minusSeconds(60), 800)), NOW);

        assertThat(signal.getPredictedIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getType()).isEqualTo("high_latency");
            assertThat(issue.getSeverity()).isEqualTo("medium");
            assertThat(issue.getDescription()).isEqualTo("Average response time is 800ms, above 500ms threshold");
        });
    }

    @Test
    @DisplayName("should report a healthy system")
    void healthy() {
        HealthSignal signal = scorer.assess(
                List.of(point("svc-a", "latency_ms", NOW.minusSeconds(60), 100)), NOW);

        assertThat(signal.getOverallHealthScore()).isCloseTo(0.9, within(1e-9));
        assertThat(signal.getRecommendations()).containsExactly("System is healthy - maintain current monitoring");
    }

    @Test
    @DisplayName("should fail when the store is empty")
    void emptyStore() {
        assertThatThrownBy(scorer::assess).isInstanceOf(NoDataException.class);
    }

    @Test
    @DisplayName("should only consider the last hour")
    void trailingWindow() {
        store.append(List.of(
                point("svc-a", "cpu_percent", NOW.minus(Duration.ofMinutes(90)), 95),
                point("svc-a", "cpu_percent", NOW.minus(Duration.ofMinutes(10)), 20)));

        HealthSignal signal = scorer.assess();

        assertThat(signal.getOverallHealthScore()).isCloseTo(0.8, within(1e-9));
        assertThat(signal.getPredictedIssues()).isEmpty();
    }
}
