package com.routely.backend.exception;

/**
 * Topology or fare data that cannot form a snapshot. The rebuild is rejected and the previous
 * snapshot stays in effect.
 */
public class IntegrityException extends RoutePlanningException {

    public IntegrityException(String message) {
        super("DATA_INTEGRITY", message, false);
    }

    public IntegrityException(String message, Throwable cause) {
        super("DATA_INTEGRITY", message, false, cause);
    }
}
