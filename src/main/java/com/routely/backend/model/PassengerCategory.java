package com.routely.backend.model;

public enum PassengerCategory {
    ADULT,
    CHILD,
    SENIOR,
    STUDENT
}
