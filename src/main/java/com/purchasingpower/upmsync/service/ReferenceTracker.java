package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.SyncDecision;
import com.purchasingpower.upmsync.model.sync.SyncState;

import java.util.Optional;

/**
 * Decides whether a package needs rebuilding.
 */
public interface ReferenceTracker {

    /** Ref used when a package definition names none */
    String DEFAULT_REF = "HEAD";

    /**
     * Resolves the package's ref and compares it with the last committed one.
     * Skips only when the resolved commit equals {@code previous.lastRef} and
     * {@code force} is false; no previous state always proceeds.
     *
     * @throws com.purchasingpower.upmsync.exception.SourceUnavailableException repository unreachable
     * @throws com.purchasingpower.upmsync.exception.RefNotFoundException       ref unknown
     */
    SyncDecision needsSync(PackageSpec spec, Optional<SyncState> previous, boolean force);
}
