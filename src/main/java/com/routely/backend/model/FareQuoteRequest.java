package com.routely.backend.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FareQuoteRequest {

    @Schema(description = "Stations in travel order, each adjacent to the next")
    @Builder.Default
    private List<String> stationIds = new ArrayList<>();

    @Builder.Default
    private List<String> passengerTypes = new ArrayList<>();

    private boolean group;

    @Builder.Default
    private Integer groupSize = 1;
}
