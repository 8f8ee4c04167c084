package com.purchasingpower.upmsync.model.unity;

import java.util.Map;

/**
 * The package.json of a package, as an ordered field map.
 */
public record ManifestArtifact(
        String relativePath,
        Map<String, Object> content
) {

    public static final String FILE_NAME = "package.json";
}
