package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.SyncOptions;
import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.model.sync.SyncRunReport;

import java.util.List;
import java.util.Optional;

/**
 * Drives one package, or a whole config set, through resolve, extract,
 * synthesize, stage and commit.
 *
 * <p>Failures never escape as exceptions: each package reports its own
 * {@link SyncResult}, and one failed package never affects another.
 */
public interface PackageSyncService {

    SyncResult sync(PackageSpec spec);

    /**
     * Syncs one package. Concurrent calls for the same package are serialized.
     */
    SyncResult sync(PackageSpec spec, SyncOptions options);

    /**
     * Syncs packages concurrently; results keep the order of {@code specs}.
     */
    SyncRunReport syncAll(List<PackageSpec> specs, boolean force);

    /**
     * Syncs every package of the configured packages file. Invalid entries are
     * reported as CONFIG_INVALID failures.
     */
    SyncRunReport syncConfigured(boolean force);

    /**
     * Syncs one package of the configured packages file.
     *
     * @return empty when no entry has that name
     */
    Optional<SyncResult> syncConfigured(String packageName, boolean force);

    /**
     * Outcome of the last attempt for a package since startup, skips and failures included.
     */
    Optional<SyncResult> lastResult(String packageName);
}
