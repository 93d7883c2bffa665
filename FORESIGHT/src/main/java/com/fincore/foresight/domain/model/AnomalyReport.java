package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Anomaly detection response for one series over a lookback window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyReport {
    private String source;
    private String metricName;
    private List<AnomalyEvent> anomalies;

    /** Share of evaluated rows flagged as anomalous */
    private double anomalyScore;

    private double threshold;
    private String analysisPeriod;
    private Instant detectedAt;
}
