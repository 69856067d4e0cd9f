package com.routely.backend.controller;

import com.routely.backend.exception.InvalidPlanRequestException;
import com.routely.backend.model.ErrorResponse;
import com.routely.backend.model.PlanRequest;
import com.routely.backend.model.PlanResponse;
import com.routely.backend.model.PlanValidation;
import com.routely.backend.model.Preference;
import com.routely.backend.service.RoutePlannerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
@Tag(name = "Routes", description = "Journey planning")
public class RouteController {

    private final RoutePlannerService routePlannerService;

    @Operation(summary = "Plan Journey", description = "Ranked itineraries between two stations, each priced for every requested passenger type.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Itineraries found"),
            @ApiResponse(responseCode = "400", description = "Invalid request or passenger type", content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "Unknown station or no route", content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Network not built yet or search budget exceeded", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/plan")
    public PlanResponse plan(@RequestBody PlanRequest request) {
        return routePlannerService.plan(request);
    }

    @Operation(summary = "Validate Journey Request", description = "Reports every problem with a journey request and whether any route could satisfy it, without planning.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Request checked"),
            @ApiResponse(responseCode = "400", description = "Unknown preference", content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Network not built yet", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/validate")
    public PlanValidation validate(
            @Parameter(description = "Origin station ID") @RequestParam String originStationId,
            @Parameter(description = "Destination station ID") @RequestParam String destinationStationId,
            @Parameter(description = "fastest, cheapest or fewest-transfers") @RequestParam(required = false) String preference,
            @RequestParam(required = false) List<String> passengerTypes,
            @RequestParam(required = false) Integer maxTransfers,
            @RequestParam(required = false) Integer maxWalkingMinutes,
            @RequestParam(required = false) List<String> avoidLineIds,
            @RequestParam(required = false) List<String> preferLineIds,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime departureTime) {
        PlanRequest request = PlanRequest.builder()
                .originStationId(originStationId)
                .destinationStationId(destinationStationId)
                .preference(parsePreference(preference))
                .passengerTypes(copyOf(passengerTypes))
                .maxTransfers(maxTransfers)
                .maxWalkingMinutes(maxWalkingMinutes)
                .avoidLineIds(copyOf(avoidLineIds))
                .preferLineIds(copyOf(preferLineIds))
                .departureTime(departureTime)
                .build();
        return routePlannerService.validate(request);
    }

    private static Preference parsePreference(String raw) {
        try {
            return Preference.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidPlanRequestException("INVALID_OPTIMIZATION", e.getMessage());
        }
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
