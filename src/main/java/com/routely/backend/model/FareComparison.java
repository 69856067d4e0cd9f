package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Planner alternatives for one passenger type, cheapest first.
 */
@Value
@Builder
public class FareComparison {
    long snapshotVersion;
    String passengerTypeId;
    String currency;
    List<PricedItinerary> options;
}
