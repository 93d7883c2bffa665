package com.fincore.foresight.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a detected anomaly, derived from its decision score.
 */
public enum AnomalySeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private static final double HIGH_BELOW = -0.8;
    private static final double MEDIUM_BELOW = -0.5;

    private final String label;

    AnomalySeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Classify a decision score. Lower scores are more anomalous.
     */
    public static AnomalySeverity fromScore(double score) {
        if (score < HIGH_BELOW) {
            return HIGH;
        }
        if (score < MEDIUM_BELOW) {
            return MEDIUM;
        }
        return LOW;
    }
}
