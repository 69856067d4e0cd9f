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
public class TransferLink {
    private String id;
    private String stationAId;
    private String stationBId;
    private int walkingMinutes;
    private int walkingDistanceMeters;

    @Builder.Default
    private BigDecimal transferFee = BigDecimal.ZERO;

    @Builder.Default
    private boolean active = true;
}
