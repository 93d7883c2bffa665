package com.fincore.foresight.domain.exception;

/**
 * A model exists but is untrained, or there is not enough recent data to use it.
 */
public class ModelNotReadyException extends ForesightException {

    public ModelNotReadyException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "not_ready";
    }
}
