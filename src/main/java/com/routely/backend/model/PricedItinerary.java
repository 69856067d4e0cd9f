package com.routely.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class PricedItinerary {
    int rank;
    Itinerary itinerary;
    List<FareBreakdown> fares;

    // Fare comparisons only
    @JsonInclude(JsonInclude.Include.NON_NULL)
    BigDecimal farePerMinute;
}
