package com.fincore.foresight.domain.exception;

import com.fincore.foresight.domain.model.SeriesKey;
import lombok.Getter;

/**
 * A single series failed to fit during a training pass. Logged and counted, never
 * propagated to a request caller.
 */
@Getter
public class TrainingFailureException extends ForesightException {

    private final SeriesKey seriesKey;

    public TrainingFailureException(SeriesKey seriesKey, String message, Throwable cause) {
        super("Training failed for " + seriesKey + ": " + message, cause);
        this.seriesKey = seriesKey;
    }

    @Override
    public String getErrorCode() {
        return "training_failure";
    }
}
