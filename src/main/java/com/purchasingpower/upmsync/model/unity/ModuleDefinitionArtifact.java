package com.purchasingpower.upmsync.model.unity;

import java.util.Map;

/**
 * The .asmdef of a package, as an ordered field map.
 */
public record ModuleDefinitionArtifact(
        String relativePath,
        Map<String, Object> content
) {
}
