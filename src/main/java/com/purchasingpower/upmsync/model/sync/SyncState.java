package com.purchasingpower.upmsync.model.sync;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Last successful sync of one package.
 *
 * Only written after the package tree was committed, so a recorded
 * {@code lastRef} always matches what is on disk.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SyncState {

    String packageName;

    /** Resolved commit id of the last committed tree */
    String lastRef;

    /** Ref as requested at that time (branch, tag, commit) */
    String requestedRef;

    Instant lastSyncAt;

    SyncOutcome lastOutcome;
}
