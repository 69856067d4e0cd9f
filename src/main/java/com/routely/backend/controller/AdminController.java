package com.routely.backend.controller;

import com.routely.backend.exception.SnapshotUnavailableException;
import com.routely.backend.model.SnapshotInfo;
import com.routely.backend.service.NetworkSnapshotService;
import com.routely.backend.service.PlannerSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Network rebuilds and snapshot inspection")
public class AdminController {

    private final NetworkSnapshotService snapshotService;

    @Operation(summary = "Trigger Rebuild", description = "Reloads the network data and swaps in a new snapshot. A rejected rebuild keeps the current one.")
    @ApiResponse(responseCode = "200", description = "Rebuild completed")
    @ApiResponse(responseCode = "500", description = "Data failed validation, previous snapshot kept")
    @PostMapping("/rebuild")
    public SnapshotInfo rebuild() {
        log.info("🔄 ADMIN: Manual network rebuild triggered");
        PlannerSnapshot snapshot = snapshotService.rebuild();
        return snapshot.info();
    }

    @Operation(summary = "Get Snapshot", description = "Version, build time and size of the snapshot queries currently use.")
    @GetMapping("/snapshot")
    public SnapshotInfo snapshot() {
        return snapshotService.currentIfPresent()
                .map(PlannerSnapshot::info)
                .orElseThrow(SnapshotUnavailableException::new);
    }
}
