package com.routely.backend.exception;

public class SnapshotUnavailableException extends RoutePlanningException {

    public SnapshotUnavailableException() {
        super("SNAPSHOT_UNAVAILABLE", "The network has not been built yet", true);
    }
}
