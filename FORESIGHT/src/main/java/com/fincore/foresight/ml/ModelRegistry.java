package com.fincore.foresight.ml;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.feature.FeatureBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the per-series forecast and anomaly models.
 * <p>
 * Entries are created lazily on the first training attempt for a series and are never
 * removed except through {@link #clear()}. A missing entry and an untrained entry are
 * distinct conditions.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final FeatureBuilder featureBuilder;
    private final ForesightProperties properties;

    private final Map<SeriesKey, ForecastModel> forecastModels = new ConcurrentHashMap<>();
    private final Map<SeriesKey, AnomalyModel> anomalyModels = new ConcurrentHashMap<>();

    public ModelRegistry(FeatureBuilder featureBuilder, ForesightProperties properties) {
        this.featureBuilder = featureBuilder;
        this.properties = properties;
    }

    public ForecastModel getOrCreateForecastModel(SeriesKey key) {
        return forecastModels.computeIfAbsent(key, k -> {
            log.debug("Creating forecast model for {}", k);
            return new ForecastModel(k, featureBuilder, properties.getForecast());
        });
    }

    public AnomalyModel getOrCreateAnomalyModel(SeriesKey key) {
        return anomalyModels.computeIfAbsent(key, k -> {
            log.debug("Creating anomaly model for {}", k);
            return new AnomalyModel(k, featureBuilder, properties.getAnomaly());
        });
    }

    public Optional<ForecastModel> findForecastModel(SeriesKey key) {
        return Optional.ofNullable(forecastModels.get(key));
    }

    public Optional<AnomalyModel> findAnomalyModel(SeriesKey key) {
        return Optional.ofNullable(anomalyModels.get(key));
    }

    public int forecastModelCount() {
        return forecastModels.size();
    }

    public int anomalyModelCount() {
        return anomalyModels.size();
    }

    public int trainedForecastModelCount() {
        return (int) forecastModels.values().stream().filter(ForecastModel::isTrained).count();
    }

    public int trainedAnomalyModelCount() {
        return (int) anomalyModels.values().stream().filter(AnomalyModel::isTrained).count();
    }

    /**
     * Forget every model. Intended for administration and tests.
     */
    public void clear() {
        forecastModels.clear();
        anomalyModels.clear();
        log.info("Model registry cleared");
    }
}
