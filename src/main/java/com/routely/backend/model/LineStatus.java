package com.routely.backend.model;

public enum LineStatus {
    ACTIVE,
    MAINTENANCE,
    CLOSED
}
