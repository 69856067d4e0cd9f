package com.routely.backend.exception;

public class StationNotFoundException extends RoutePlanningException {

    private final String stationId;

    public StationNotFoundException(String stationId) {
        super("STATION_NOT_FOUND", "Station " + stationId + " does not exist in the current network", false);
        this.stationId = stationId;
    }

    public String getStationId() {
        return stationId;
    }
}
