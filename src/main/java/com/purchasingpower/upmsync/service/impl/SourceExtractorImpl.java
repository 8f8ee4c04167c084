package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;
import com.purchasingpower.upmsync.model.sync.WorkspaceTree;
import com.purchasingpower.upmsync.service.SourceExtractor;
import com.purchasingpower.upmsync.service.git.MaterializedSource;
import com.purchasingpower.upmsync.service.git.VersionControlBackend;
import com.purchasingpower.upmsync.util.PackagePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SourceExtractorImpl implements SourceExtractor {

    private final VersionControlBackend backend;

    @Override
    public WorkspaceTree extract(SourceLocator source, ResolvedRef ref, String subtreePath) {
        String normalized = PackagePaths.normalize(subtreePath);
        log.info("📦 Extracting '{}' from {} @ {}", normalized.isEmpty() ? "." : normalized, source.url(), ref.shortId());

        MaterializedSource materialized = backend.materialize(source, ref, normalized);

        return new WorkspaceTree(
                materialized.workspaceRoot(),
                materialized.subtreeRoot(),
                materialized.licenseFile(),
                materialized.readmeFile(),
                ref,
                backend::release);
    }
}
