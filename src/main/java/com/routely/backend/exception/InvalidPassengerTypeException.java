package com.routely.backend.exception;

public class InvalidPassengerTypeException extends RoutePlanningException {

    public InvalidPassengerTypeException(String passengerTypeId) {
        super("INVALID_PASSENGER_TYPE", "Unknown passenger type: " + passengerTypeId, false);
    }
}
