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
public class PassengerType {
    private String id;
    private String name;
    private PassengerCategory category;

    @Builder.Default
    private BigDecimal discountPercentage = BigDecimal.ZERO;

    // Eligibility hints for callers, never checked while pricing
    private Integer ageMin;
    private Integer ageMax;
}
