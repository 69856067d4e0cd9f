package com.routely.backend.controller;

import com.routely.backend.model.Line;
import com.routely.backend.model.Station;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.service.NetworkSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/network")
@RequiredArgsConstructor
@Tag(name = "Network", description = "Stations and lines of the current network")
public class NetworkController {

    private final NetworkSnapshotService snapshotService;

    @Operation(summary = "Get Stations", description = "All stations, optionally only those of one line.")
    @GetMapping("/stations")
    public List<Station> getStations(
            @Parameter(description = "Line ID (e.g. BTS_SUK)") @RequestParam(required = false) String lineId) {
        NetworkSnapshot network = snapshotService.current().getNetwork();
        if (lineId == null || lineId.isBlank()) {
            return new ArrayList<>(network.stations());
        }
        return network.stations().stream()
                .filter(station -> lineId.equals(station.getLineId()))
                .collect(Collectors.toList());
    }

    @Operation(summary = "Get Lines", description = "All lines with their status and station order.")
    @GetMapping("/lines")
    public List<Line> getLines() {
        return new ArrayList<>(snapshotService.current().getNetwork().lines());
    }
}
