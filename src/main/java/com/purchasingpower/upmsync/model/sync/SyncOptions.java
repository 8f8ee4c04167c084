package com.purchasingpower.upmsync.model.sync;

/**
 * Per-call options of a package sync.
 *
 * @param force        rebuild even when the resolved ref is unchanged
 * @param cancellation checked between steps; never inside the commit
 */
public record SyncOptions(
        boolean force,
        CancellationSignal cancellation
) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, CancellationSignal.none());
    }

    public static SyncOptions forced() {
        return new SyncOptions(true, CancellationSignal.none());
    }

    public static SyncOptions of(boolean force) {
        return new SyncOptions(force, CancellationSignal.none());
    }
}
