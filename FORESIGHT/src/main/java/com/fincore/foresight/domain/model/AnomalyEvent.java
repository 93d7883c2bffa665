package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An observation flagged as an outlier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {

    /** Timestamp of the original observation */
    private Instant timestamp;

    /** Original observed value */
    private double value;

    /** Decision score; negative means outlier, lower is more anomalous */
    private double anomalyScore;

    private AnomalySeverity severity;
}
