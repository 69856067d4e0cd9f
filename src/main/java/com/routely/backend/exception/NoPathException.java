package com.routely.backend.exception;

/**
 * No route under the current closures. Retrying only helps once the overlay changes.
 */
public class NoPathException extends RoutePlanningException {

    public NoPathException(String message) {
        super("NO_PATH", message, false);
    }

    public static NoPathException between(String originStationId, String destinationStationId) {
        return new NoPathException("No route from " + originStationId + " to " + destinationStationId);
    }
}
