package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the model registry and metric store sizes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelStatus {
    private int forecastModels;
    private int trainedForecastModels;
    private int anomalyModels;
    private int trainedAnomalyModels;
    private int storedPoints;
    private int storeCapacity;
}
