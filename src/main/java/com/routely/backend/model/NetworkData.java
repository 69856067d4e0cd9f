package com.routely.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a rebuild needs, as delivered by a {@code NetworkDataSource}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkData {

    @Builder.Default
    private List<Station> stations = new ArrayList<>();

    @Builder.Default
    private List<Line> lines = new ArrayList<>();

    @Builder.Default
    private List<TransferLink> transferLinks = new ArrayList<>();

    @Builder.Default
    private List<ZoneFareRule> fareRules = new ArrayList<>();

    @Builder.Default
    private List<PassengerType> passengerTypes = new ArrayList<>();
}
