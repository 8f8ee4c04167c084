package com.purchasingpower.upmsync.service.unity;

import java.util.List;
import java.util.Set;

/**
 * Recognizes IDE, build-system and repository housekeeping files that have no
 * place inside a Unity package.
 */
public final class ProjectFileFilter {

    private static final List<String> PROJECT_FILE_SUFFIXES = List.of(
            ".csproj",
            ".sln",
            ".vcxproj",
            ".vcxproj.filters",
            ".vcxproj.user",
            ".suo",
            ".user"
    );

    private static final Set<String> PROJECT_DIRECTORIES = Set.of(
            ".vs",
            ".vscode",
            ".idea"
    );

    private static final Set<String> PROJECT_FILE_NAMES = Set.of(
            "packages.config",
            "app.config",
            "web.config",
            "AssemblyInfo.cs",
            "GlobalAssemblyInfo.cs",
            "Directory.Build.props",
            "Directory.Build.targets",
            ".editorconfig",
            ".gitignore",
            ".gitattributes",
            "README.md",
            "LICENSE",
            "CHANGELOG.md",
            "CONTRIBUTING.md"
    );

    private ProjectFileFilter() {
    }

    /**
     * @param relativePath source-relative path with forward slashes
     * @return true when the file, or any directory above it, is project housekeeping
     */
    public static boolean isProjectFile(String relativePath) {
        String[] segments = relativePath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (PROJECT_DIRECTORIES.contains(segments[i])) {
                return true;
            }
        }
        String fileName = segments[segments.length - 1];
        if (PROJECT_FILE_NAMES.contains(fileName)) {
            return true;
        }
        return PROJECT_FILE_SUFFIXES.stream().anyMatch(fileName::endsWith);
    }
}
