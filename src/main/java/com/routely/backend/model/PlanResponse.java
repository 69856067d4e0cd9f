package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PlanResponse {
    long snapshotVersion;
    String originStationId;
    String destinationStationId;
    Preference preference;
    List<PricedItinerary> itineraries;
}
