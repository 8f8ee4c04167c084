package com.purchasingpower.upmsync.model.sync;

/**
 * Verdict of the reference tracker for one package.
 */
public record SyncDecision(
        Action action,
        ResolvedRef resolvedRef,
        String reason
) {

    public enum Action {
        SKIP,
        PROCEED
    }

    public static SyncDecision skip(ResolvedRef ref) {
        return new SyncDecision(Action.SKIP, ref, "already synced at " + ref.shortId());
    }

    public static SyncDecision proceed(ResolvedRef ref, String reason) {
        return new SyncDecision(Action.PROCEED, ref, reason);
    }

    public boolean shouldSkip() {
        return action == Action.SKIP;
    }
}
