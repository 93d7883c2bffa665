package com.fincore.foresight.domain.service;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.exception.InvalidInputException;
import com.fincore.foresight.domain.exception.ModelNotReadyException;
import com.fincore.foresight.domain.exception.NoDataException;
import com.fincore.foresight.domain.exception.SeriesNotFoundException;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.domain.repository.InMemoryMetricStore;
import com.fincore.foresight.feature.FeatureBuilder;
import com.fincore.foresight.insight.CapacityProjector;
import com.fincore.foresight.insight.HealthScorer;
import com.fincore.foresight.insight.InsightSummarizer;
import com.fincore.foresight.ml.ModelRegistry;
import com.fincore.foresight.observability.ForesightMetrics;
import com.fincore.foresight.observability.ForesightStructuredLogger;
import com.fincore.foresight.training.TrainingOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.fincore.foresight.MetricPointFixtures.MONDAY_MIDNIGHT;
import static com.fincore.foresight.MetricPointFixtures.point;
import static com.fincore.foresight.MetricPointFixtures.series;
import static com.fincore.foresight.MetricPointFixtures.wave;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalyticsService} wired with real collaborators and a fixed clock.
 */
class AnalyticsServiceTest {

    private static final Instant NOW = MONDAY_MIDNIGHT.plus(Duration.ofHours(2));
    private static final Instant HOUR_AGO = NOW.minus(Duration.ofHours(1));

    private InMemoryMetricStore store;
    private ModelRegistry registry;
    private TrainingOrchestrator orchestrator;
    private ForesightMetrics metrics;
    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        ForesightProperties properties = new ForesightProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ForesightStructuredLogger structuredLogger = new ForesightStructuredLogger();

        store = new InMemoryMetricStore(1_000);
        registry = new ModelRegistry(new FeatureBuilder(properties), properties);
        metrics = new ForesightMetrics(new SimpleMeterRegistry());
        orchestrator = new TrainingOrchestrator(store, registry, properties, metrics, structuredLogger, clock);
        service = new AnalyticsService(store, registry, orchestrator,
                new HealthScorer(store, properties, clock),
                new CapacityProjector(store, properties, clock),
                new InsightSummarizer(store, registry, clock),
                properties, metrics, structuredLogger, clock);
    }

    @Nested
    @DisplayName("Ingest")
    class IngestTests {

        @Test
        @DisplayName("should append a valid batch")
        void validBatch() {
            StepVerifier.create(service.ingest(series("svc-a", "latency_ms", HOUR_AGO, 3, i -> 100)))
                    .expectNext(3)
                    .verifyComplete();

            assertThat(store.size()).isEqualTo(3);
            assertThat(metrics.getPointsIngested().count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should reject the whole batch when one value is not finite")
        void nonFiniteValue() {
            List<MetricPoint> batch = new ArrayList<>(series("svc-a", "latency_ms", HOUR_AGO, 3, i -> 100));
            batch.add(point("svc-a", "latency_ms", NOW, Double.NaN));

            StepVerifier.create(service.ingest(batch))
                    .expectError(InvalidInputException.class)
                    .verify();

            assertThat(store.isEmpty()).isTrue();
            assertThat(metrics.getIngestRejected().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject points without a source")
        void missingSource() {
            StepVerifier.create(service.ingest(List.of(point(" ", "latency_ms", NOW, 1))))
                    .expectErrorMatches(e -> e instanceof InvalidInputException
                            && e.getMessage().equals("Metric point 0 has no source"))
                    .verify();
        }

        @Test
        @DisplayName("should accept an empty batch")
        void emptyBatch() {
            StepVerifier.create(service.ingest(List.of()))
                    .expectNext(0)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Forecast")
    class ForecastTests {

        @Test
        @DisplayName("should fail for a series that was never trained")
        void unknownSeries() {
            StepVerifier.create(service.forecast("svc-a", "latency_ms", 5, 0.95))
                    .expectError(SeriesNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report an existing but untrained model as not ready")
        void untrainedModel() {
            registry.getOrCreateForecastModel(SeriesKey.of("svc-a", "latency_ms"));

            StepVerifier.create(service.forecast("svc-a", "latency_ms", 5, 0.95))
                    .expectError(ModelNotReadyException.class)
                    .verify();
        }

        @Test
        @DisplayName("should validate horizon and confidence before anything else")
        void invalidArguments() {
            StepVerifier.create(service.forecast("svc-a", "latency_ms", 0, 0.95))
                    .expectError(InvalidInputException.class)
                    .verify();
            StepVerifier.create(service.forecast("svc-a", "latency_ms", 5, 1.0))
                    .expectError(InvalidInputException.class)
                    .verify();
            StepVerifier.create(service.forecast("", "latency_ms", 5, 0.5))
                    .expectError(InvalidInputException.class)
                    .verify();
        }

        @Test
        @DisplayName("should forecast a trained series and echo the requested confidence")
        void trainedSeries() {
            store.append(series("svc-a", "latency_ms", HOUR_AGO, 25, i -> 100 + i));
            orchestrator.trainAll();

            StepVerifier.create(service.forecast("svc-a", "latency_ms", 5, 0.9))
                    .assertNext(result -> {
                        assertThat(result.getPredictions()).hasSize(5);
                        assertThat(result.getConfidenceIntervals()).hasSize(5);
                        assertThat(result.getConfidenceLevel()).isEqualTo(0.9);
                        assertThat(result.getPredictionHorizon()).isEqualTo(5);
                        assertThat(result.getModelAccuracy()).isBetween(0.0, 1.0);
                        assertThat(result.getGeneratedAt()).isEqualTo(NOW);
                        assertThat(result.getPredictions().get(0).getTimestamp())
                                .isEqualTo(HOUR_AGO.plus(Duration.ofMinutes(25)));
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Anomaly detection")
    class AnomalyTests {

        @Test
        @DisplayName("should fail for a series that was never trained")
        void unknownSeries() {
            StepVerifier.create(service.detectAnomalies("svc-a", "cpu_percent", 24))
                    .expectError(SeriesNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject a lookback below one hour")
        void invalidLookback() {
            StepVerifier.create(service.detectAnomalies("svc-a", "cpu_percent", 0))
                    .expectError(InvalidInputException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report outliers within the lookback window")
        void detects() {
            store.append(series("svc-a", "cpu_percent", HOUR_AGO, 60, i -> wave(i, 50, 5)));
            orchestrator.trainAll();

            StepVerifier.create(service.detectAnomalies("svc-a", "cpu_percent", 24))
                    .assertNext(report -> {
                        assertThat(report.getAnalysisPeriod()).isEqualTo("24 hours");
                        assertThat(report.getThreshold()).isEqualTo(-0.5);
                        assertThat(report.getAnomalyScore()).isBetween(0.0, 1.0);
                        assertThat(report.getDetectedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be not ready when the lookback holds too few points")
        void staleData() {
            store.append(series("svc-a", "cpu_percent", NOW.minus(Duration.ofHours(2)), 60, i -> wave(i, 50, 5)));
            orchestrator.trainAll();

            StepVerifier.create(service.detectAnomalies("svc-a", "cpu_percent", 1))
                    .expectError(ModelNotReadyException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Insights")
    class InsightTests {

        @Test
        @DisplayName("should fail health assessment on an empty store")
        void healthWithoutData() {
            StepVerifier.create(service.assessHealth())
                    .expectError(NoDataException.class)
                    .verify();
        }

        @Test
        @DisplayName("should assess health from recent data")
        void health() {
            store.append(series("svc-a", "cpu_percent", NOW.minus(Duration.ofMinutes(10)), 5, i -> 30));

            StepVerifier.create(service.assessHealth())
                    .assertNext(signal -> assertThat(signal.getOverallHealthScore()).isBetween(0.0, 1.0))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a growth rate of -100% or less")
        void invalidGrowthRate() {
            StepVerifier.create(service.planCapacity("svc-a", -1.0, 30))
                    .expectError(InvalidInputException.class)
                    .verify();
            StepVerifier.create(service.planCapacity("svc-a", 0.1, 0))
                    .expectError(InvalidInputException.class)
                    .verify();
        }

        @Test
        @DisplayName("should plan capacity for a known source")
        void capacity() {
            store.append(series("svc-a", "cpu_percent", NOW.minus(Duration.ofMinutes(10)), 5, i -> 30));

            StepVerifier.create(service.planCapacity("svc-a", 0.1, 30))
                    .assertNext(plan -> assertThat(plan.getCurrentCapacity()).containsOnlyKeys("cpu"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should summarize without data")
        void summary() {
            StepVerifier.create(service.summarize())
                    .assertNext(summary -> assertThat(summary.getModelsStatus().getStoreCapacity()).isEqualTo(1_000))
                    .verifyComplete();
        }
    }
}
