package com.fincore.foresight.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Forecast request. Omitted parameters fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {

    @NotBlank(message = "source is required")
    @JsonAlias("service")
    private String source;

    @NotBlank(message = "metricName is required")
    @JsonAlias("metric_name")
    private String metricName;

    /** Minutes to predict ahead */
    @Min(value = 1, message = "predictionHorizon must be at least 1")
    @JsonAlias("prediction_horizon")
    private Integer predictionHorizon;

    /** Echoed back; the band itself is always the 95% band */
    @DecimalMin(value = "0.0", inclusive = false, message = "confidenceLevel must be above 0")
    @DecimalMax(value = "1.0", inclusive = false, message = "confidenceLevel must be below 1")
    @JsonAlias("confidence_level")
    private Double confidenceLevel;
}
