package com.routely.backend.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Journey planning request")
public class PlanRequest {

    @Schema(description = "Origin station id", example = "BTS_N8")
    private String originStationId;

    @Schema(description = "Destination station id", example = "MRT_BL22")
    private String destinationStationId;

    @Schema(description = "fastest, cheapest or fewest-transfers", example = "fastest")
    private Preference preference;

    @Schema(description = "Passenger type ids to price for, defaults to adult")
    @Builder.Default
    private List<String> passengerTypes = new ArrayList<>();

    @Schema(description = "Number of itineraries wanted", example = "3")
    @Builder.Default
    private Integer alternatives = 3;

    private boolean group;

    @Builder.Default
    private Integer groupSize = 1;

    private Integer maxTransfers;

    private Integer maxWalkingMinutes;

    @Schema(description = "When set, segments carry departure and arrival times")
    private LocalDateTime departureTime;

    @Builder.Default
    private List<String> avoidLineIds = new ArrayList<>();

    @Schema(description = "Lines to favour: itineraries riding any of them rank first")
    @Builder.Default
    private List<String> preferLineIds = new ArrayList<>();

    @Schema(description = "Closures and delays applied to this request only")
    private NetworkOverlay overlay;

    @Builder.Default
    private boolean useLiveStatus = true;
}
