package com.routely.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One priced line of a {@link FareBreakdown}, matching one itinerary segment.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FareItem {
    EdgeKind kind;
    // Order of the priced itinerary segment
    int segmentOrder;
    String lineId;
    String fromStationId;
    String toStationId;
    FareType fareType;
    int fareUnits;
    BigDecimal baseFare;
    BigDecimal incrementalFare;
    BigDecimal transferFee;
    BigDecimal amount;
}
