package com.fincore.foresight.domain.exception;

/**
 * Base type for failures surfaced by the analytics engine.
 */
public abstract class ForesightException extends RuntimeException {

    protected ForesightException(String message) {
        super(message);
    }

    protected ForesightException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable error code.
     */
    public abstract String getErrorCode();
}
