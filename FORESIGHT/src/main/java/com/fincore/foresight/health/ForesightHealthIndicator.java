package com.fincore.foresight.health;

import com.fincore.foresight.domain.repository.MetricStore;
import com.fincore.foresight.ml.ModelRegistry;
import com.fincore.foresight.training.TrainingOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for FORESIGHT service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Metric store fill level</li>
 *     <li>Forecast and anomaly models, trained and total</li>
 *     <li>Last training pass</li>
 * </ul>
 */
@Slf4j
@Component
public class ForesightHealthIndicator implements ReactiveHealthIndicator {

    private final MetricStore metricStore;
    private final ModelRegistry modelRegistry;
    private final TrainingOrchestrator trainingOrchestrator;

    public ForesightHealthIndicator(MetricStore metricStore,
                                    ModelRegistry modelRegistry,
                                    TrainingOrchestrator trainingOrchestrator) {
        this.metricStore = metricStore;
        this.modelRegistry = modelRegistry;
        this.trainingOrchestrator = trainingOrchestrator;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down().withException(e).build());
                });
    }

    private Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();

        details.put("storedPoints", metricStore.size());
        details.put("storeCapacity", metricStore.capacity());
        details.put("forecastModels", modelRegistry.forecastModelCount());
        details.put("trainedForecastModels", modelRegistry.trainedForecastModelCount());
        details.put("anomalyModels", modelRegistry.anomalyModelCount());
        details.put("trainedAnomalyModels", modelRegistry.trainedAnomalyModelCount());
        details.put("trainingInProgress", trainingOrchestrator.isTrainingInProgress());

        trainingOrchestrator.getLastSummary().ifPresent(summary -> {
            details.put("lastTrainingCompletedAt", String.valueOf(summary.getCompletedAt()));
            details.put("lastTrainingFailures", summary.getSeriesFailed() + summary.getSeriesTimedOut());
        });

        return Health.up()
                .withDetails(details)
                .build();
    }
}
