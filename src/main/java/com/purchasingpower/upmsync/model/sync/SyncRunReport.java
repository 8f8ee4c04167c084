package com.purchasingpower.upmsync.model.sync;

import java.util.List;

/**
 * Per-package outcomes of one run over a config set, in config order.
 * Partial success is normal; callers decide how to report failures.
 */
public record SyncRunReport(
        List<SyncResult> results,
        long durationMs
) {

    public SyncRunReport {
        results = List.copyOf(results);
    }

    public long builtCount() {
        return count(SyncOutcome.BUILT);
    }

    public long skippedCount() {
        return count(SyncOutcome.SKIPPED);
    }

    public long failedCount() {
        return count(SyncOutcome.FAILED);
    }

    public boolean hasFailures() {
        return failedCount() > 0;
    }

    public String summary() {
        return String.format("%d packages: %d built, %d skipped, %d failed in %dms",
                results.size(), builtCount(), skippedCount(), failedCount(), durationMs);
    }

    private long count(SyncOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
