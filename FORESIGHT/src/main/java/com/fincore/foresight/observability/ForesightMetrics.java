package com.fincore.foresight.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for FORESIGHT service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Ingestion volume</li>
 *     <li>Prediction requests by type</li>
 *     <li>Training passes and per-series outcomes</li>
 *     <li>Last held-out accuracy per model type</li>
 * </ul>
 */
@Component
public class ForesightMetrics {

    public static final String MODEL_TYPE_FORECAST = "forecast";
    public static final String MODEL_TYPE_ANOMALY = "anomaly";

    private final MeterRegistry meterRegistry;

    // Ingestion metrics
    @Getter
    private final Counter pointsIngested;
    @Getter
    private final Counter ingestRejected;

    // Training metrics
    @Getter
    private final Counter trainingPasses;
    @Getter
    private final Counter seriesTrained;
    @Getter
    private final Counter seriesFailed;
    @Getter
    private final Counter seriesTimedOut;
    @Getter
    private final Counter seriesSkipped;
    private final Timer trainingDuration;
    private final DistributionSummary forecastAccuracy;

    private final Map<String, Counter> predictionsByType = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<Double>> accuracyByModelType = new ConcurrentHashMap<>();

    public ForesightMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.pointsIngested = Counter.builder("foresight.metrics.ingested")
                .description("Metric points accepted into the store")
                .register(meterRegistry);
        this.ingestRejected = Counter.builder("foresight.metrics.rejected")
                .description("Ingest batches rejected as invalid")
                .register(meterRegistry);

        this.trainingPasses = Counter.builder("foresight.training.passes")
                .description("Training passes completed")
                .register(meterRegistry);
        this.seriesTrained = Counter.builder("foresight.training.series.trained")
                .description("Series whose forecast model fitted successfully")
                .register(meterRegistry);
        this.seriesFailed = Counter.builder("foresight.training.series.failed")
                .description("Series whose fit threw")
                .register(meterRegistry);
        this.seriesTimedOut = Counter.builder("foresight.training.series.timed_out")
                .description("Series fits abandoned after the time budget")
                .register(meterRegistry);
        this.seriesSkipped = Counter.builder("foresight.training.series.skipped")
                .description("Series skipped for lack of data")
                .register(meterRegistry);
        this.trainingDuration = Timer.builder("foresight.training.duration")
                .description("Training pass duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.forecastAccuracy = DistributionSummary.builder("foresight.training.forecast.accuracy")
                .description("Held-out accuracy of forecast fits")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
    }

    // ========== Ingestion Methods ==========

    public void recordIngested(int count) {
        pointsIngested.increment(count);
    }

    public void recordIngestRejected() {
        ingestRejected.increment();
    }

    // ========== Prediction Methods ==========

    public void recordPrediction(String modelType) {
        predictionsByType.computeIfAbsent(modelType, type ->
                Counter.builder("foresight.predictions")
                        .tag("model_type", type)
                        .description("Prediction requests served by model type")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Training Methods ==========

    public Timer.Sample startTrainingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTrainingPass(Timer.Sample sample) {
        sample.stop(trainingDuration);
        trainingPasses.increment();
    }

    public void recordSeriesTrained() {
        seriesTrained.increment();
    }

    public void recordSeriesFailed() {
        seriesFailed.increment();
    }

    public void recordSeriesTimedOut() {
        seriesTimedOut.increment();
    }

    public void recordSeriesSkipped() {
        seriesSkipped.increment();
    }

    /**
     * Publish the latest accuracy for a model type.
     */
    public void recordModelAccuracy(String modelType, double accuracy) {
        if (MODEL_TYPE_FORECAST.equals(modelType)) {
            forecastAccuracy.record(accuracy);
        }
        accuracyByModelType.computeIfAbsent(modelType, type -> {
            AtomicReference<Double> holder = new AtomicReference<>(0.0);
            Gauge.builder("foresight.model.accuracy", holder, AtomicReference::get)
                    .tag("model_type", type)
                    .description("Held-out accuracy of the most recent fit")
                    .register(meterRegistry);
            return holder;
        }).set(accuracy);
    }
}
