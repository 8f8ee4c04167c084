package com.purchasingpower.upmsync.queue;

import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.service.PackageSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Drains {@link SyncRequestQueue} on a fixed delay and syncs each requested package.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueuedSyncWorker {

    private final SyncRequestQueue queue;
    private final PackageSyncService packageSyncService;

    @Scheduled(fixedDelayString = "${app.queue.drain-interval-ms:5000}")
    public void drain() {
        List<SyncRequestQueue.SyncRequest> requests = queue.drain();
        if (requests.isEmpty()) {
            return;
        }

        log.info("Processing {} queued sync requests", requests.size());
        for (SyncRequestQueue.SyncRequest request : requests) {
            try {
                Optional<SyncResult> result = packageSyncService.syncConfigured(request.packageName(), request.force());
                if (result.isEmpty()) {
                    log.warn("Queued package {} is not configured", request.packageName());
                }
            } catch (RuntimeException e) {
                log.error("Queued sync of {} failed", request.packageName(), e);
            }
        }
    }
}
