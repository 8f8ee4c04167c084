package com.purchasingpower.upmsync.model.unity;

import java.nio.charset.StandardCharsets;

/**
 * A file produced by the engine (manifest, assembly definition, README, LICENSE)
 * rather than mirrored from the source.
 */
public record GeneratedFile(
        String relativePath,
        byte[] content
) {

    public static GeneratedFile utf8(String relativePath, String text) {
        return new GeneratedFile(relativePath, text.getBytes(StandardCharsets.UTF_8));
    }
}
