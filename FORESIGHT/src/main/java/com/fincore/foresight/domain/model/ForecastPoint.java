package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One step of a multi-step forecast.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastPoint {

    /** Timestamp the prediction applies to */
    private Instant timestamp;

    /** Point estimate */
    private double predictedValue;

    /** 1-based step beyond the last observed point */
    private int stepAhead;
}
