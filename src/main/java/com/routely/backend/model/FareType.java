package com.routely.backend.model;

/**
 * How a line turns a ride into fare units.
 */
public enum FareType {
    /** Units are the number of zones between boarding and alighting station. */
    ZONE,
    /** Units are the number of stations travelled. */
    PER_STATION
}
