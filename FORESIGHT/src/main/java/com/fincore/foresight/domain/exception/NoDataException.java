package com.fincore.foresight.domain.exception;

/**
 * The metric store holds no observations at all.
 */
public class NoDataException extends ForesightException {

    public NoDataException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "no_data";
    }
}
