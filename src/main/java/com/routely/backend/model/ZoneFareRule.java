package com.routely.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ZoneFareRule {
    private String lineId;
    private int zoneNumber;
    private BigDecimal baseFare;
    // Charged per zone crossed on ZONE lines, per station travelled on PER_STATION lines
    private BigDecimal incrementalFare;
}
