package com.fincore.foresight.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Capacity planning request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityPlanningRequest {

    @NotBlank(message = "source is required")
    @JsonAlias("service")
    private String source;

    /** Expected monthly growth, 0.1 for 10% */
    @Builder.Default
    @DecimalMin(value = "-1.0", inclusive = false, message = "growthRate must be greater than -1")
    @JsonAlias("growth_rate")
    private double growthRate = 0.1;

    @Builder.Default
    @Min(value = 1, message = "planningHorizonDays must be at least 1")
    @JsonAlias("planning_horizon_days")
    private int planningHorizonDays = 30;
}
