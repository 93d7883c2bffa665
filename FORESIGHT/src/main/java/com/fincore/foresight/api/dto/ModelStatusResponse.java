package com.fincore.foresight.api.dto;

import com.fincore.foresight.domain.model.ModelStatus;
import com.fincore.foresight.training.TrainingSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelStatusResponse {
    private ModelStatus models;
    private boolean trainingInProgress;

    /** Null until the first pass completes */
    private TrainingSummary lastTraining;
}
