package com.routely.backend.controller;

import com.routely.backend.model.FareComparison;
import com.routely.backend.model.FareQuote;
import com.routely.backend.model.FareQuoteRequest;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.PlanRequest;
import com.routely.backend.service.FareQuoteService;
import com.routely.backend.service.NetworkSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/fares")
@RequiredArgsConstructor
@Tag(name = "Fares", description = "Fare quotes and comparisons")
public class FareController {

    private final FareQuoteService fareQuoteService;
    private final NetworkSnapshotService snapshotService;

    @Operation(summary = "Quote Fare", description = "Prices a journey given as a sequence of adjacent stations.")
    @PostMapping("/quote")
    public FareQuote quote(@RequestBody FareQuoteRequest request) {
        return fareQuoteService.quote(request);
    }

    @Operation(summary = "Compare Fares", description = "Plans alternatives for one passenger type and lists them cheapest first.")
    @PostMapping("/compare")
    public FareComparison compare(@RequestBody PlanRequest request) {
        return fareQuoteService.compare(request);
    }

    @Operation(summary = "Get Passenger Types", description = "Passenger types and their discounts in the current network.")
    @GetMapping("/passenger-types")
    public List<PassengerType> passengerTypes() {
        return new ArrayList<>(snapshotService.current().getFareTable().passengerTypes());
    }
}
