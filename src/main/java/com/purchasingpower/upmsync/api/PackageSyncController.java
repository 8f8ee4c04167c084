package com.purchasingpower.upmsync.api;

import com.purchasingpower.upmsync.exception.ConfigInvalidException;
import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.model.sync.SyncRunReport;
import com.purchasingpower.upmsync.model.sync.SyncState;
import com.purchasingpower.upmsync.queue.SyncRequestQueue;
import com.purchasingpower.upmsync.service.PackageSyncService;
import com.purchasingpower.upmsync.service.SyncStateStore;
import com.purchasingpower.upmsync.service.config.LoadedPackageConfig;
import com.purchasingpower.upmsync.service.config.PackageConfigLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST controller for triggering package syncs and inspecting their state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/packages")
@RequiredArgsConstructor
public class PackageSyncController {

    private final PackageSyncService packageSyncService;
    private final PackageConfigLoader configLoader;
    private final SyncStateStore stateStore;
    private final SyncRequestQueue syncRequestQueue;

    /**
     * List configured packages with their recorded state.
     *
     * GET /api/v1/packages
     */
    @GetMapping
    public ResponseEntity<List<PackageStatus>> listPackages() {
        try {
            LoadedPackageConfig config = configLoader.load();
            List<PackageStatus> packages = config.entries().stream()
                .map(this::toStatus)
                .collect(Collectors.toList());
            return ResponseEntity.ok(packages);

        } catch (ConfigInvalidException e) {
            log.warn("Cannot list packages: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Failed to list packages", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Sync every configured package.
     *
     * POST /api/v1/packages/sync?force=false
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncResponse> syncAll(@RequestParam(defaultValue = "false") boolean force) {
        try {
            SyncRunReport report = packageSyncService.syncConfigured(force);
            return ResponseEntity.ok(SyncResponse.of(report.results(), report.summary(), report.durationMs()));

        } catch (ConfigInvalidException e) {
            return ResponseEntity.badRequest().body(SyncResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Sync run failed", e);
            return ResponseEntity.internalServerError()
                .body(SyncResponse.error("Sync failed: " + e.getMessage()));
        }
    }

    /**
     * Sync one configured package.
     *
     * POST /api/v1/packages/{name}/sync?force=false
     */
    @PostMapping("/{name}/sync")
    public ResponseEntity<SyncResponse> syncPackage(@PathVariable String name,
                                                    @RequestParam(defaultValue = "false") boolean force) {
        try {
            Optional<SyncResult> result = packageSyncService.syncConfigured(name, force);
            if (result.isEmpty()) {
                return ResponseEntity.notFound().build();
            }
            SyncResult syncResult = result.get();
            return ResponseEntity.ok(SyncResponse.of(List.of(syncResult), syncResult.summary(), syncResult.getDurationMs()));

        } catch (ConfigInvalidException e) {
            return ResponseEntity.badRequest().body(SyncResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Sync of {} failed", name, e);
            return ResponseEntity.internalServerError()
                .body(SyncResponse.error("Sync failed: " + e.getMessage()));
        }
    }

    /**
     * Queue a package for the background worker.
     *
     * POST /api/v1/packages/{name}/enqueue?force=false
     */
    @PostMapping("/{name}/enqueue")
    public ResponseEntity<Map<String, Object>> enqueue(@PathVariable String name,
                                                       @RequestParam(defaultValue = "false") boolean force) {
        boolean queued = syncRequestQueue.enqueue(name, force);
        return ResponseEntity.accepted().body(Map.of(
            "packageName", name,
            "queued", queued,
            "pending", syncRequestQueue.size()
        ));
    }

    /**
     * Recorded state of one package.
     *
     * GET /api/v1/packages/{name}/state
     */
    @GetMapping("/{name}/state")
    public ResponseEntity<SyncState> getState(@PathVariable String name) {
        return stateStore.get(name)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private PackageStatus toStatus(LoadedPackageConfig.Entry entry) {
        PackageStatus.PackageStatusBuilder status = PackageStatus.builder()
            .name(entry.name())
            .valid(entry.isValid())
            .error(entry.error())
            .state(stateStore.get(entry.name()).orElse(null))
            .lastResult(packageSyncService.lastResult(entry.name()).orElse(null));

        if (entry.isValid()) {
            status.sourceUrl(entry.spec().getSource().url())
                .requestedRef(entry.spec().getSource().ref());
        }
        return status.build();
    }
}
