package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.unity.PackageLayout;
import com.purchasingpower.upmsync.model.unity.SynthesizedArtifacts;

/**
 * Computes the package manifest and the module definition of a package.
 *
 * Pure: the result depends only on the arguments and the configured defaults.
 * Explicit {@code packageJsonExtra} / {@code asmdefExtra} fields always win over
 * computed ones.
 */
public interface ManifestSynthesizer {

    /**
     * @param discoveredNamespace namespace found in the sources; null when none was found.
     *                            An explicit {@code spec.namespace} takes precedence.
     */
    SynthesizedArtifacts synthesize(PackageSpec spec, String discoveredNamespace, PackageLayout layout);
}
