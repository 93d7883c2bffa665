package com.fincore.foresight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a forecast model: predictions and their bands, index-aligned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Forecast {

    @Builder.Default
    private List<ForecastPoint> predictions = new ArrayList<>();

    @Builder.Default
    private List<ConfidenceInterval> confidenceIntervals = new ArrayList<>();

    public int size() {
        return predictions.size();
    }
}
