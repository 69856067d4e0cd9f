package com.routely.backend.service;

import com.routely.backend.exception.IntegrityException;
import com.routely.backend.exception.SnapshotUnavailableException;
import com.routely.backend.fare.FareTable;
import com.routely.backend.fare.FareTableBuilder;
import com.routely.backend.model.NetworkData;
import com.routely.backend.network.NetworkModelBuilder;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.repository.NetworkDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot every query plans against.
 *
 * <p>A rebuild builds the network and the fare table completely before publishing them; a failure at
 * any step leaves the previous snapshot in place. Rebuilds never interleave, readers never wait.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NetworkSnapshotService {

    private final NetworkDataSource networkDataSource;
    private final NetworkModelBuilder networkModelBuilder;
    private final FareTableBuilder fareTableBuilder;
    private final MonitoringService monitoringService;

    private final AtomicReference<PlannerSnapshot> current = new AtomicReference<>();

    public PlannerSnapshot current() {
        PlannerSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new SnapshotUnavailableException();
        }
        return snapshot;
    }

    public Optional<PlannerSnapshot> currentIfPresent() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Reloads from the configured data source and rebuilds.
     */
    public synchronized PlannerSnapshot rebuild() {
        log.info("📥 Loading network data from {}", networkDataSource.describe());
        NetworkData data;
        try {
            data = networkDataSource.load();
        } catch (RuntimeException e) {
            monitoringService.recordRebuildDuration(0, "FAILED");
            throw e;
        }
        return rebuild(data);
    }

    public synchronized PlannerSnapshot rebuild(NetworkData data) {
        long startTime = System.currentTimeMillis();
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ 🚀 NETWORK REBUILD STARTED");
        log.info("╚═══════════════════════════════════════════════════════════════════");

        try {
            if (data == null || isEmpty(data.getStations())) {
                throw new IntegrityException("Network data has no stations");
            }

            log.info("🧱 Step 1: Building network from {} stations, {} lines, {} transfer links...",
                    data.getStations().size(), sizeOf(data.getLines()), sizeOf(data.getTransferLinks()));
            NetworkSnapshot network = networkModelBuilder.build(data.getStations(),
                    orEmpty(data.getLines()), orEmpty(data.getTransferLinks()));

            log.info("💰 Step 2: Building fare table from {} rules...", sizeOf(data.getFareRules()));
            FareTable fareTable = fareTableBuilder.build(network, orEmpty(data.getFareRules()),
                    orEmpty(data.getPassengerTypes()));

            PlannerSnapshot previous = current.get();
            long version = previous == null ? 1 : previous.getVersion() + 1;
            PlannerSnapshot next = new PlannerSnapshot(version, LocalDateTime.now(), network, fareTable);
            current.set(next);

            long duration = System.currentTimeMillis() - startTime;
            monitoringService.recordRebuildDuration(duration, "SUCCESS");
            log.info("╔═══════════════════════════════════════════════════════════════════");
            log.info("║ ✅ NETWORK REBUILD COMPLETED - version {} in {}ms", version, duration);
            log.info("╚═══════════════════════════════════════════════════════════════════");
            return next;
        } catch (RuntimeException e) {
            monitoringService.recordRebuildDuration(System.currentTimeMillis() - startTime, "FAILED");
            log.error("❌ Network rebuild rejected, keeping version {}: {}",
                    currentIfPresent().map(PlannerSnapshot::getVersion).orElse(0L), e.getMessage());
            throw e;
        }
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
