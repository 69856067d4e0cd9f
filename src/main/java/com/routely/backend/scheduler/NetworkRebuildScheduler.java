package com.routely.backend.scheduler;

import com.routely.backend.service.NetworkSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NetworkRebuildScheduler {

    private final NetworkSnapshotService snapshotService;

    @EventListener(ApplicationReadyEvent.class)
    public void buildOnStart() {
        log.info("🚀 Building initial network snapshot...");
        performRebuild();
    }

    @Scheduled(cron = "${routely.network.rebuild-cron:0 0 3 * * *}")
    public void scheduleRebuild() {
        log.info("⏰ Triggering scheduled network rebuild...");
        performRebuild();
    }

    // Failures keep the previous snapshot; queries answer 503 until a first build succeeds
    private void performRebuild() {
        try {
            snapshotService.rebuild();
        } catch (Exception e) {
            log.error("💥 Network rebuild failed", e);
        }
    }
}
