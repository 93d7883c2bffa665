package com.fincore.foresight.domain.exception;

/**
 * Malformed point or out-of-range parameter. Raised before any state is touched.
 */
public class InvalidInputException extends ForesightException {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_input";
    }
}
