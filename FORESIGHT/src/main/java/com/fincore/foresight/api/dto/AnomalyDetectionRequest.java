package com.fincore.foresight.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anomaly detection request over a trailing window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetectionRequest {

    @NotBlank(message = "source is required")
    @JsonAlias("service")
    private String source;

    @NotBlank(message = "metricName is required")
    @JsonAlias("metric_name")
    private String metricName;

    /** Hours of history to analyse */
    @Min(value = 1, message = "lookbackHours must be at least 1")
    @JsonAlias("lookback_hours")
    private Integer lookbackHours;
}
