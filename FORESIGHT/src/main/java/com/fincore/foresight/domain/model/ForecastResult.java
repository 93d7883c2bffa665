package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Forecast response for one series, echoing the request parameters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResult {
    private String source;
    private String metricName;
    private List<ForecastPoint> predictions;
    private List<ConfidenceInterval> confidenceIntervals;
    private double modelAccuracy;
    private int predictionHorizon;
    private double confidenceLevel;
    private Instant generatedAt;
}
