package com.purchasingpower.upmsync.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Platform-independent handling of package-relative paths.
 *
 * Package-relative paths always use forward slashes, never start or end with a
 * slash, and the package root is the empty string.
 */
public final class PackagePaths {

    public static final String META_SUFFIX = ".meta";

    private PackagePaths() {
    }

    /**
     * Normalizes a relative path: backslashes become slashes, empty and "." segments
     * are dropped, case is preserved. Never fails.
     */
    public static String normalize(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            return "";
        }
        String[] segments = relativePath.replace('\\', '/').split("/");
        List<String> kept = new ArrayList<>(segments.length);
        for (String segment : segments) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                kept.add(segment);
            }
        }
        return String.join("/", kept);
    }

    /**
     * Package-relative form of {@code path} under {@code root}.
     */
    public static String relativize(Path root, Path path) {
        return normalize(root.relativize(path).toString());
    }

    /**
     * Sidecar path of an entry; the root's sidecar is {@code .meta} inside the root.
     */
    public static String sidecarOf(String relativePath) {
        return normalize(relativePath) + META_SUFFIX;
    }

    public static boolean isSidecar(String fileName) {
        return fileName.endsWith(META_SUFFIX);
    }

    /**
     * Resolves a package-relative path against a root directory.
     */
    public static Path resolve(Path root, String relativePath) {
        String normalized = normalize(relativePath);
        return normalized.isEmpty() ? root : root.resolve(normalized);
    }
}
