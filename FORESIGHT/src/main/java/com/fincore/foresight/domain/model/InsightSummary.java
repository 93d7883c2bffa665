package com.fincore.foresight.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cross-series findings over the last day of observations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsightSummary {

    private Instant timestamp;

    private ModelStatus modelsStatus;

    @Builder.Default
    private List<String> keyFindings = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private RiskAssessment riskAssessment;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RiskAssessment {
        @Builder.Default
        private RiskLevel overallRisk = RiskLevel.LOW;

        @Builder.Default
        private List<String> riskFactors = new ArrayList<>();
    }

    public enum RiskLevel {
        LOW,
        MEDIUM;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
