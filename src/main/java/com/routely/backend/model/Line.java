package com.routely.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Line {

    public static final int DEFAULT_TRAVEL_MINUTES_PER_HOP = 3;

    private String id;
    private String companyId;
    private String name;
    private String color;

    @Builder.Default
    private LineStatus status = LineStatus.ACTIVE;

    // Stations in running order
    @Builder.Default
    private List<String> stationIds = new ArrayList<>();

    @Builder.Default
    private FareType fareType = FareType.ZONE;

    @Builder.Default
    private int travelMinutesPerHop = DEFAULT_TRAVEL_MINUTES_PER_HOP;

    @Builder.Default
    private BigDecimal costPerHop = BigDecimal.ZERO;

    @Builder.Default
    private List<LineHop> hops = new ArrayList<>();

    @JsonIgnore
    public boolean isActive() {
        return status == null || status == LineStatus.ACTIVE;
    }
}
