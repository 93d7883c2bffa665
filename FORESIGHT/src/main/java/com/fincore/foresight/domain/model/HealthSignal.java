package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate system health derived from recent raw observations. Not stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSignal {

    /** Mean of the category scores present, 0.0 to 1.0 */
    private double overallHealthScore;

    @Builder.Default
    private List<HealthIssue> predictedIssues = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    /** Grows with the number of categories present, 0.0 to 1.0 */
    private double confidence;

    /** Minutes ahead the signal is advertised for */
    private int predictionHorizon;

    private Instant generatedAt;
}
