package com.routely.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItinerarySegment {
    int order;
    EdgeKind kind;
    String edgeId;

    String fromStationId;
    String fromStationName;
    int fromZone;

    String toStationId;
    String toStationName;
    int toZone;

    // Null on transfers
    String lineId;
    String lineName;
    String lineColor;

    int travelMinutes;
    double distanceKm;
    BigDecimal baseCost;
    BigDecimal transferFee;

    // Only filled when the request carried a departure time
    LocalDateTime departureTime;
    LocalDateTime arrivalTime;

    String instructions;

    public boolean isTransfer() {
        return kind == EdgeKind.TRANSFER;
    }
}
