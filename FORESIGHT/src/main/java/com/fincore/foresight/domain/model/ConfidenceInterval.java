package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Normal-approximation band around one forecast step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfidenceInterval {
    private Instant timestamp;
    private double lowerBound;
    private double upperBound;
    private double confidenceLevel;
}
