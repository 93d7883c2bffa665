package com.fincore.foresight.domain.service;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.exception.InvalidInputException;
import com.fincore.foresight.domain.exception.ModelNotReadyException;
import com.fincore.foresight.domain.exception.SeriesNotFoundException;
import com.fincore.foresight.domain.model.AnomalyDetection;
import com.fincore.foresight.domain.model.AnomalyReport;
import com.fincore.foresight.domain.model.CapacityPlan;
import com.fincore.foresight.domain.model.Forecast;
import com.fincore.foresight.domain.model.ForecastResult;
import com.fincore.foresight.domain.model.HealthSignal;
import com.fincore.foresight.domain.model.InsightSummary;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.ModelStatus;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.domain.repository.MetricStore;
import com.fincore.foresight.feature.FeatureBuilder;
import com.fincore.foresight.insight.CapacityProjector;
import com.fincore.foresight.insight.HealthScorer;
import com.fincore.foresight.insight.InsightSummarizer;
import com.fincore.foresight.ml.AnomalyModel;
import com.fincore.foresight.ml.ForecastModel;
import com.fincore.foresight.ml.ModelRegistry;
import com.fincore.foresight.observability.ForesightMetrics;
import com.fincore.foresight.observability.ForesightStructuredLogger;
import com.fincore.foresight.observability.ForesightStructuredLogger.RequestType;
import com.fincore.foresight.training.TrainingOrchestrator;
import com.fincore.foresight.training.TrainingSummary;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every analytics request.
 * <p>
 * Inputs are validated before any state is touched. Forecast and anomaly requests only
 * read cached models and never train synchronously; training is handed to the
 * {@link TrainingOrchestrator}.
 */
@Service
public class AnalyticsService {

    private final MetricStore metricStore;
    private final ModelRegistry modelRegistry;
    private final TrainingOrchestrator trainingOrchestrator;
    private final HealthScorer healthScorer;
    private final CapacityProjector capacityProjector;
    private final InsightSummarizer insightSummarizer;
    private final ForesightProperties properties;
    private final ForesightMetrics metrics;
    private final ForesightStructuredLogger structuredLogger;
    private final Clock clock;

    public AnalyticsService(MetricStore metricStore,
                            ModelRegistry modelRegistry,
                            TrainingOrchestrator trainingOrchestrator,
                            HealthScorer healthScorer,
                            CapacityProjector capacityProjector,
                            InsightSummarizer insightSummarizer,
                            ForesightProperties properties,
                            ForesightMetrics metrics,
                            ForesightStructuredLogger structuredLogger,
                            Clock clock) {
        this.metricStore = metricStore;
        this.modelRegistry = modelRegistry;
        this.trainingOrchestrator = trainingOrchestrator;
        this.healthScorer = healthScorer;
        this.capacityProjector = capacityProjector;
        this.insightSummarizer = insightSummarizer;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Validate and append a batch. An invalid point rejects the whole batch.
     *
     * @return number of points ingested
     */
    public Mono<Integer> ingest(List<MetricPoint> points) {
        return Mono.fromCallable(() -> {
            if (points == null) {
                throw new InvalidInputException("Request body must be a list of metric points");
            }
            for (int i = 0; i < points.size(); i++) {
                validatePoint(i, points.get(i));
            }
            int ingested = metricStore.append(points);
            metrics.recordIngested(ingested);
            structuredLogger.logRequestEvent(RequestType.INGEST, null, null,
                    "Ingested " + ingested + " metric points",
                    Map.of("ingested", ingested, "stored", metricStore.size()));
            return ingested;
        }).doOnError(InvalidInputException.class, e -> metrics.recordIngestRejected());
    }

    /**
     * Start a background training pass and return at once.
     */
    public Mono<Boolean> triggerTraining() {
        return Mono.fromCallable(trainingOrchestrator::triggerTraining);
    }

    public Mono<ForecastResult> forecast(String source, String metricName, int horizon, double confidenceLevel) {
        return Mono.fromCallable(() -> {
            requireNonBlank(source, "source");
            requireNonBlank(metricName, "metricName");
            ForesightProperties.Forecast settings = properties.getForecast();
            if (horizon < 1 || horizon > settings.getMaxHorizon()) {
                throw new InvalidInputException("predictionHorizon must be between 1 and "
                        + settings.getMaxHorizon() + ": " + horizon);
            }
            if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
                throw new InvalidInputException("confidenceLevel must be strictly between 0 and 1: "
                        + confidenceLevel);
            }

            SeriesKey key = SeriesKey.of(source, metricName);
            ForecastModel model = modelRegistry.findForecastModel(key)
                    .orElseThrow(() -> new SeriesNotFoundException(
                            "Model not found for " + key + ". Please train models first."));
            if (!model.isTrained()) {
                throw new ModelNotReadyException("Model not trained yet for " + key);
            }

            List<MetricPoint> series = FeatureBuilder.sortByTimestamp(
                    metricStore.query(source, metricName, null, null));
            List<MetricPoint> recent = series.subList(
                    Math.max(0, series.size() - settings.getRecentPoints()), series.size());
            if (recent.size() < settings.getMinRecentPoints()) {
                throw new ModelNotReadyException("Insufficient recent data for prediction of " + key);
            }

            Forecast forecast = model.predict(recent, horizon)
                    .orElseThrow(() -> new ModelNotReadyException("Prediction unavailable for " + key));
            metrics.recordPrediction(ForesightMetrics.MODEL_TYPE_FORECAST);
            structuredLogger.logRequestEvent(RequestType.FORECAST, source, metricName, "Forecast served",
                    Map.of("horizon", horizon, "recentPoints", recent.size()));

            return ForecastResult.builder()
                    .source(source)
                    .metricName(metricName)
                    .predictions(forecast.getPredictions())
                    .confidenceIntervals(forecast.getConfidenceIntervals())
                    .modelAccuracy(model.getAccuracy())
                    .predictionHorizon(horizon)
                    .confidenceLevel(confidenceLevel)
                    .generatedAt(clock.instant())
                    .build();
        });
    }

    public Mono<AnomalyReport> detectAnomalies(String source, String metricName, int lookbackHours) {
        return Mono.fromCallable(() -> {
            requireNonBlank(source, "source");
            requireNonBlank(metricName, "metricName");
            if (lookbackHours < 1) {
                throw new InvalidInputException("lookbackHours must be at least 1: " + lookbackHours);
            }

            SeriesKey key = SeriesKey.of(source, metricName);
            AnomalyModel model = modelRegistry.findAnomalyModel(key)
                    .orElseThrow(() -> new SeriesNotFoundException(
                            "Anomaly detector not found for " + key + ". Please train models first."));
            if (!model.isTrained()) {
                throw new ModelNotReadyException("Anomaly detector not trained yet for " + key);
            }

            Instant now = clock.instant();
            List<MetricPoint> recent = metricStore.query(source, metricName,
                    now.minus(Duration.ofHours(lookbackHours)), null);
            if (recent.size() < properties.getAnomaly().getMinRecentPoints()) {
                throw new ModelNotReadyException("Insufficient recent data for anomaly detection of " + key);
            }

            AnomalyDetection detection = model.detect(recent);
            metrics.recordPrediction(ForesightMetrics.MODEL_TYPE_ANOMALY);
            structuredLogger.logRequestEvent(RequestType.ANOMALY_DETECTION, source, metricName,
                    "Anomaly detection served",
                    Map.of("lookbackHours", lookbackHours,
                            "evaluatedRows", detection.getEvaluatedRows(),
                            "anomalies", detection.getEvents().size()));

            return AnomalyReport.builder()
                    .source(source)
                    .metricName(metricName)
                    .anomalies(detection.getEvents())
                    .anomalyScore(detection.anomalyRatio())
                    .threshold(model.getThreshold())
                    .analysisPeriod(lookbackHours + " hours")
                    .detectedAt(now)
                    .build();
        });
    }

    public Mono<HealthSignal> assessHealth() {
        return Mono.fromCallable(() -> {
            HealthSignal signal = healthScorer.assess();
            structuredLogger.logRequestEvent(RequestType.HEALTH, null, null, "Health assessed",
                    Map.of("score", signal.getOverallHealthScore(),
                            "issues", signal.getPredictedIssues().size()));
            return signal;
        });
    }

    public Mono<CapacityPlan> planCapacity(String source, double growthRate, int horizonDays) {
        return Mono.fromCallable(() -> {
            requireNonBlank(source, "source");
            if (!Double.isFinite(growthRate) || growthRate <= -1.0) {
                throw new InvalidInputException("growthRate must be greater than -1: " + growthRate);
            }
            if (horizonDays < 1) {
                throw new InvalidInputException("planningHorizonDays must be at least 1: " + horizonDays);
            }
            CapacityPlan plan = capacityProjector.plan(source, growthRate, horizonDays);
            structuredLogger.logRequestEvent(RequestType.CAPACITY, source, null, "Capacity plan generated",
                    Map.of("growthRate", growthRate, "horizonDays", horizonDays,
                            "categories", plan.getCurrentCapacity().size()));
            return plan;
        });
    }

    public Mono<InsightSummary> summarize() {
        return Mono.fromCallable(() -> {
            InsightSummary summary = insightSummarizer.summarize();
            structuredLogger.logRequestEvent(RequestType.SUMMARY, null, null, "Insight summary generated",
                    Map.of("findings", summary.getKeyFindings().size(),
                            "risk", summary.getRiskAssessment().getOverallRisk().label()));
            return summary;
        });
    }

    public Mono<ModelStatus> modelStatus() {
        return Mono.fromCallable(insightSummarizer::modelStatus);
    }

    public Optional<TrainingSummary> lastTrainingSummary() {
        return trainingOrchestrator.getLastSummary();
    }

    public boolean isTrainingInProgress() {
        return trainingOrchestrator.isTrainingInProgress();
    }

    private static void validatePoint(int index, MetricPoint point) {
        if (point == null) {
            throw new InvalidInputException("Metric point " + index + " is null");
        }
        if (point.getTimestamp() == null) {
            throw new InvalidInputException("Metric point " + index + " has no timestamp");
        }
        if (point.getSource() == null || point.getSource().isBlank()) {
            throw new InvalidInputException("Metric point " + index + " has no source");
        }
        if (point.getMetricName() == null || point.getMetricName().isBlank()) {
            throw new InvalidInputException("Metric point " + index + " has no metric name");
        }
        if (!Double.isFinite(point.getValue())) {
            throw new InvalidInputException("Metric point " + index + " has a non-finite value");
        }
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
    }
}
