package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capacity projection for one source under a compound monthly growth assumption.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityPlan {

    private String source;

    /** Observed usage keyed by capacity category */
    @Builder.Default
    private Map<String, CurrentUsage> currentCapacity = new LinkedHashMap<>();

    /** Projected usage keyed by capacity category */
    @Builder.Default
    private Map<String, ProjectedUsage> predictedCapacityNeeds = new LinkedHashMap<>();

    @Builder.Default
    private List<String> scalingRecommendations = new ArrayList<>();

    private CostEstimate costImplications;

    @Builder.Default
    private List<Milestone> timeline = new ArrayList<>();

    private Instant generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrentUsage {
        private double average;
        private double peak;
        private String unit;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectedUsage {
        private double average;
        private double peak;
        private double growthFactor;
    }

    /**
     * Weekly projection of one category.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Milestone {
        private int week;
        private String metric;
        private double projectedValue;
        private double capacityUtilization;
    }

    /**
     * Simplified monthly cost model.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CostEstimate {
        private double currentMonthlyCost;
        private double projectedMonthlyCost;
        private double additionalCost;
        private double costPerUserGrowth;
    }
}
