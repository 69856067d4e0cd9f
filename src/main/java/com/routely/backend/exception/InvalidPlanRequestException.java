package com.routely.backend.exception;

public class InvalidPlanRequestException extends RoutePlanningException {

    public InvalidPlanRequestException(String message) {
        super("INVALID_REQUEST", message, false);
    }

    /**
     * With a more specific code, e.g. {@code INVALID_AVOID_LINE}.
     */
    public InvalidPlanRequestException(String code, String message) {
        super(code, message, false);
    }
}
