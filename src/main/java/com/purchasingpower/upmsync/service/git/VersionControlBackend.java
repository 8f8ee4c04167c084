package com.purchasingpower.upmsync.service.git;

import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;

import java.nio.file.Path;

/**
 * Access to the repositories packages are mirrored from.
 */
public interface VersionControlBackend {

    /**
     * Resolves a branch, tag, full ref name, {@code HEAD} or commit id to an immutable commit.
     *
     * @throws com.purchasingpower.upmsync.exception.SourceUnavailableException repository unreachable
     * @throws com.purchasingpower.upmsync.exception.RefNotFoundException       no such ref
     */
    ResolvedRef resolveRef(SourceLocator source, String ref);

    /**
     * Writes exactly the blobs of {@code subtreePath} at the resolved commit into a fresh
     * directory, together with the repository's top-level LICENSE and README.
     * The caller owns the returned workspace and must {@link #release(Path)} it.
     */
    MaterializedSource materialize(SourceLocator source, ResolvedRef ref, String subtreePath);

    /**
     * Deletes a workspace returned by {@link #materialize}. Never throws.
     */
    void release(Path workspaceRoot);
}
