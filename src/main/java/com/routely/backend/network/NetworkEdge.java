package com.routely.backend.network;

import com.routely.backend.model.EdgeKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Directed edge of a {@link NetworkSnapshot}. Time and cost weights are read straight off the edge,
 * the objective decides how they are combined.
 */
@Value
@Builder(toBuilder = true)
public class NetworkEdge {
    String id;
    String fromStationId;
    String toStationId;
    EdgeKind kind;

    // Set for rides
    String lineId;
    // Set for transfers
    String transferLinkId;

    int travelMinutes;
    double distanceKm;
    BigDecimal baseCost;
    BigDecimal transferFee;

    public boolean isTransfer() {
        return kind == EdgeKind.TRANSFER;
    }

    public double timeWeight() {
        return travelMinutes;
    }

    public double costWeight() {
        return baseCost.doubleValue();
    }

    /**
     * Copy with extra travel minutes. Non-positive delays leave the edge unchanged.
     *
     * @throws ArithmeticException if the delayed time no longer fits an {@code int}
     */
    public NetworkEdge delayedBy(int extraMinutes) {
        if (extraMinutes <= 0) {
            return this;
        }
        return toBuilder().travelMinutes(Math.addExact(travelMinutes, extraMinutes)).build();
    }
}
