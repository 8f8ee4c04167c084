package com.purchasingpower.upmsync.model.sync;

public enum SyncOutcome {

    /** Resolved ref equals the last synced ref; nothing was written */
    SKIPPED,

    /** Package tree regenerated and committed */
    BUILT,

    /** Sync failed; previous package tree and state are untouched */
    FAILED
}
