package com.purchasingpower.upmsync.model.unity;

import com.purchasingpower.upmsync.model.spec.BuildPolicy;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps source-relative paths to package-relative paths.
 *
 * @param sourcePrefix prefix put in front of every mirrored source path ("" for none)
 * @param contentRoot  directory holding the code and the assembly definition ("" for the package root)
 */
public record PackageLayout(
        String sourcePrefix,
        String contentRoot
) {

    public static final String RUNTIME_DIR = "Runtime";

    /**
     * Decides the layout for one extracted subtree. A subtree that already has a
     * top-level Runtime folder is mirrored unchanged.
     */
    public static PackageLayout resolve(Path subtreeRoot, BuildPolicy policy) {
        if (!policy.nestUnderRuntime()) {
            return new PackageLayout("", "");
        }
        if (Files.isDirectory(subtreeRoot.resolve(RUNTIME_DIR))) {
            return new PackageLayout("", RUNTIME_DIR);
        }
        return new PackageLayout(RUNTIME_DIR, RUNTIME_DIR);
    }

    public String toOutputPath(String sourceRelativePath) {
        return join(sourcePrefix, sourceRelativePath);
    }

    public String moduleDefinitionPath(String asmdefName) {
        return join(contentRoot, asmdefName + ".asmdef");
    }

    private static String join(String prefix, String path) {
        return prefix.isEmpty() ? path : prefix + "/" + path;
    }
}
