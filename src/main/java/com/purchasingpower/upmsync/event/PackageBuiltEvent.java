package com.purchasingpower.upmsync.event;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;
import com.purchasingpower.upmsync.model.unity.ManifestArtifact;

import java.nio.file.Path;

/**
 * Published after a package tree was committed and its state recorded.
 * Registry publishers listen for it; the output tree is complete and stable.
 */
public record PackageBuiltEvent(
        PackageSpec spec,
        Path outputPath,
        ManifestArtifact manifest,
        ResolvedRef resolvedRef
) {
}
