package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FareQuote {
    long snapshotVersion;
    Itinerary itinerary;
    List<FareBreakdown> fares;
}
