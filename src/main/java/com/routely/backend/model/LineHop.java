package com.routely.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-pair override for two consecutive stations of a line. Applies in both directions;
 * null fields fall back to the line defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LineHop {
    private String fromStationId;
    private String toStationId;
    private Integer travelMinutes;
    private Double distanceKm;
    private BigDecimal baseCost;
}
