package com.purchasingpower.upmsync;

import com.purchasingpower.upmsync.exception.ConfigInvalidException;
import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.model.sync.SyncRunReport;
import com.purchasingpower.upmsync.service.PackageSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Syncs every configured package once at startup when {@code app.sync-on-startup=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app", name = "sync-on-startup", havingValue = "true")
public class StartupSyncRunner implements ApplicationRunner {

    private final PackageSyncService packageSyncService;

    @Override
    public void run(ApplicationArguments args) {
        boolean force = args.containsOption("force");
        SyncRunReport report;
        try {
            report = packageSyncService.syncConfigured(force);
        } catch (ConfigInvalidException e) {
            log.error("❌ Startup sync skipped: {}", e.getMessage());
            return;
        }

        for (SyncResult result : report.results()) {
            log.info("  {}", result.summary());
        }
        log.info("Startup sync: {}", report.summary());
    }
}
