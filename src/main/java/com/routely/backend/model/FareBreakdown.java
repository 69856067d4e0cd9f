package com.routely.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class FareBreakdown {
    String passengerTypeId;
    PassengerCategory category;
    String currency;
    List<FareItem> items;

    BigDecimal rideSubtotal;
    BigDecimal passengerDiscountPercentage;
    BigDecimal passengerDiscount;
    BigDecimal transferFees;

    boolean group;
    int groupSize;
    BigDecimal groupDiscountPercentage;
    BigDecimal groupDiscount;

    // Per passenger
    BigDecimal total;
    // total multiplied by the group size, equals total for single travellers
    BigDecimal groupTotal;
}
