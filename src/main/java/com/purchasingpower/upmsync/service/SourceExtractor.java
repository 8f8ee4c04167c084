package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;
import com.purchasingpower.upmsync.model.sync.WorkspaceTree;

/**
 * Produces an isolated snapshot of one repository subtree at one resolved commit.
 */
public interface SourceExtractor {

    /**
     * The returned workspace holds only committed content of {@code subtreePath};
     * close it to delete the workspace.
     *
     * @throws com.purchasingpower.upmsync.exception.SourceUnavailableException repository unreachable
     * @throws com.purchasingpower.upmsync.exception.RefNotFoundException       commit absent
     * @throws com.purchasingpower.upmsync.exception.SubtreeMissingException    path absent at that commit
     */
    WorkspaceTree extract(SourceLocator source, ResolvedRef ref, String subtreePath);
}
