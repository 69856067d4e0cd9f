package com.routely.backend.exception;

/**
 * Operational data gap: a line/zone pair has no fare rule.
 */
public class FareRuleMissingException extends RoutePlanningException {

    private final String lineId;
    private final int zoneNumber;

    public FareRuleMissingException(String lineId, int zoneNumber) {
        super("FARE_RULE_MISSING", "No fare rule for line " + lineId + " in zone " + zoneNumber, false);
        this.lineId = lineId;
        this.zoneNumber = zoneNumber;
    }

    public String getLineId() {
        return lineId;
    }

    public int getZoneNumber() {
        return zoneNumber;
    }
}
