package com.fincore.foresight.domain.exception;

/**
 * No model exists for the requested series, or the source has no data.
 */
public class SeriesNotFoundException extends ForesightException {

    public SeriesNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "not_found";
    }
}
