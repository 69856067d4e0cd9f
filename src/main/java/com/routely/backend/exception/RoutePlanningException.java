package com.routely.backend.exception;

/**
 * Base of every typed failure the engine reports to its caller.
 */
public abstract class RoutePlanningException extends RuntimeException {

    private final String code;
    private final boolean retryable;

    protected RoutePlanningException(String code, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected RoutePlanningException(String code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
