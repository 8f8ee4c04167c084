package com.purchasingpower.upmsync.service.git;

import java.nio.file.Path;

/**
 * Files written by {@link VersionControlBackend#materialize}.
 *
 * @param licenseFile null when the repository root has no license file
 * @param readmeFile  null when the repository root has no readme
 */
public record MaterializedSource(
        Path workspaceRoot,
        Path subtreeRoot,
        Path licenseFile,
        Path readmeFile
) {
}
