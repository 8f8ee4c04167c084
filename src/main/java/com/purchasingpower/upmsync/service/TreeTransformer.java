package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.WorkspaceTree;
import com.purchasingpower.upmsync.model.unity.GeneratedFile;
import com.purchasingpower.upmsync.model.unity.PackageLayout;
import com.purchasingpower.upmsync.model.unity.StagedOutputTree;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the complete package tree in a staging directory.
 */
public interface TreeTransformer {

    /**
     * Mirrors the workspace subtree into {@code stagingRoot}, writes the generated files
     * over it, attaches an identity record to every file and directory (the root
     * included) and reconciles the result against the previous output.
     *
     * <p>The previous output is only read. On failure the staging directory is removed.
     *
     * @param previousOutput committed tree of the last build, or null when there is none
     * @throws com.purchasingpower.upmsync.exception.StagingIOException on any I/O failure
     */
    StagedOutputTree transform(WorkspaceTree workspace,
                               PackageLayout layout,
                               PackageSpec spec,
                               List<GeneratedFile> generatedFiles,
                               Path previousOutput,
                               Path stagingRoot);
}
