package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of an anomaly model over one slice of a series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetection {

    @Builder.Default
    private List<AnomalyEvent> events = new ArrayList<>();

    /** Feature rows scored; one less than the number of points in the slice */
    private int evaluatedRows;

    public static AnomalyDetection empty() {
        return AnomalyDetection.builder().build();
    }

    public double anomalyRatio() {
        return evaluatedRows > 0 ? (double) events.size() / evaluatedRows : 0.0;
    }
}
