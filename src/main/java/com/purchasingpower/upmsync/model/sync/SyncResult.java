package com.purchasingpower.upmsync.model.sync;

import com.purchasingpower.upmsync.exception.PackageSyncException;
import com.purchasingpower.upmsync.exception.SyncErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of syncing one package.
 */
@Value
@Builder
public class SyncResult {

    String packageName;
    SyncOutcome outcome;
    String requestedRef;

    /** Resolved commit id; null when resolution failed */
    String resolvedRef;

    SyncErrorKind errorKind;
    String errorMessage;

    String outputPath;
    int filesStaged;
    int directoriesStaged;
    int entriesRemoved;
    long durationMs;

    public static SyncResult skipped(String packageName, ResolvedRef ref, long durationMs) {
        return SyncResult.builder()
                .packageName(packageName)
                .outcome(SyncOutcome.SKIPPED)
                .requestedRef(ref.requestedRef())
                .resolvedRef(ref.commitId())
                .durationMs(durationMs)
                .build();
    }

    public static SyncResult failed(String packageName, String requestedRef, PackageSyncException e, long durationMs) {
        return failed(packageName, requestedRef, e.getKind(), e.getMessage(), durationMs);
    }

    public static SyncResult failed(String packageName, String requestedRef, SyncErrorKind kind,
                                    String message, long durationMs) {
        return SyncResult.builder()
                .packageName(packageName)
                .outcome(SyncOutcome.FAILED)
                .requestedRef(requestedRef)
                .errorKind(kind)
                .errorMessage(message)
                .durationMs(durationMs)
                .build();
    }

    public boolean isSuccess() {
        return outcome != SyncOutcome.FAILED;
    }

    /**
     * Human-readable one-liner for logs and CLI-style reports.
     */
    public String summary() {
        return switch (outcome) {
            case SKIPPED -> String.format("[SKIPPED] %s already at %s", packageName, shortRef());
            case BUILT -> String.format("[BUILT] %s @ %s: %d files, %d dirs, %d removed in %dms",
                    packageName, shortRef(), filesStaged, directoriesStaged, entriesRemoved, durationMs);
            case FAILED -> String.format("[FAILED] %s (%s): %s", packageName, errorKind, errorMessage);
        };
    }

    private String shortRef() {
        if (resolvedRef == null) {
            return requestedRef;
        }
        return resolvedRef.length() > 8 ? resolvedRef.substring(0, 8) : resolvedRef;
    }
}
