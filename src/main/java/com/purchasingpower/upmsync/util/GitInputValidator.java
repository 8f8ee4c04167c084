package com.purchasingpower.upmsync.util;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates git-related values of a package definition before they reach JGit
 * or the filesystem.
 *
 * Safe patterns enforced:
 * - Refs: alphanumeric, dash, underscore, slash, dot (git check-ref-format subset)
 * - URLs: https://, ssh://, git@host:path, file:// or a plain local path
 * - Extract paths: relative, no ".." segments
 */
@Slf4j
public final class GitInputValidator {

    private GitInputValidator() {
    }

    /**
     * Validates a branch, tag, full ref name or commit id.
     *
     * Examples of valid refs:
     * - main
     * - v31.1
     * - refs/tags/2.5.10
     * - 3f2a9c0e... (40 hex)
     *
     * @throws IllegalArgumentException if the ref is invalid
     */
    public static void validateRef(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Ref cannot be null or blank");
        }

        if (ref.length() > 200) {
            throw new IllegalArgumentException("Ref too long (max 200 characters): " + ref.length());
        }

        if (!ref.matches("^[a-zA-Z0-9/_.+-]+$")) {
            log.warn("⚠️ Rejected ref with invalid characters: {}", sanitizeForLogging(ref));
            throw new IllegalArgumentException(
                    "Invalid ref. Only alphanumeric characters, dash, underscore, plus, slash, and dot are allowed. " +
                    "Received: " + sanitizeForLogging(ref));
        }

        if (ref.startsWith("/") || ref.endsWith("/")) {
            throw new IllegalArgumentException("Ref cannot start or end with '/': " + ref);
        }

        if (ref.startsWith(".") || ref.endsWith(".")) {
            throw new IllegalArgumentException("Ref cannot start or end with '.': " + ref);
        }

        if (ref.contains("//") || ref.contains("..")) {
            throw new IllegalArgumentException("Ref cannot contain '//' or '..': " + ref);
        }

        if (ref.endsWith(".lock")) {
            throw new IllegalArgumentException("Ref cannot end with '.lock': " + ref);
        }
    }

    /**
     * Validates a repository URL.
     *
     * Allowed formats:
     * - https://github.com/user/repo.git
     * - ssh://git@host/user/repo.git
     * - git@github.com:user/repo.git
     * - file:///srv/git/repo.git and plain local paths
     *
     * @throws IllegalArgumentException if the URL is invalid
     */
    public static void validateRepoUrl(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("Repository URL cannot be null or blank");
        }

        if (repoUrl.length() > 500) {
            throw new IllegalArgumentException("Repository URL too long (max 500 characters): " + repoUrl.length());
        }

        String lowerUrl = repoUrl.toLowerCase();
        if (lowerUrl.startsWith("javascript:") || lowerUrl.startsWith("data:") || lowerUrl.startsWith("http://")) {
            log.warn("⚠️ Rejected unsupported protocol in URL: {}", sanitizeForLogging(repoUrl));
            throw new IllegalArgumentException("Unsupported protocol in repository URL: " + sanitizeForLogging(repoUrl));
        }

        boolean remote = repoUrl.startsWith("https://") || repoUrl.startsWith("ssh://") || repoUrl.startsWith("git@");
        boolean local = repoUrl.startsWith("file://") || repoUrl.startsWith("/") || repoUrl.matches("^[A-Za-z]:[\\\\/].*");
        if (!remote && !local) {
            throw new IllegalArgumentException(
                    "Repository URL must start with https://, ssh://, git@, file:// or be an absolute path. Received: "
                            + sanitizeForLogging(repoUrl));
        }

        // Block: ; | & $ ` < > ( ) { } [ ] " '
        if (repoUrl.matches(".*[;|&$`<>(){}\\[\\]\"'\\s].*")) {
            log.warn("⚠️ Rejected URL with invalid characters: {}", sanitizeForLogging(repoUrl));
            throw new IllegalArgumentException("Repository URL contains invalid characters");
        }
    }

    /**
     * Validates the repository subtree to extract. Empty or "." selects the repository root.
     *
     * @throws IllegalArgumentException if the path is absolute or escapes the repository
     */
    public static void validateExtractPath(String extractPath) {
        if (extractPath == null || extractPath.isEmpty()) {
            return;
        }

        String unified = extractPath.replace('\\', '/');
        if (unified.startsWith("/") || unified.matches("^[A-Za-z]:/.*")) {
            throw new IllegalArgumentException("Extract path must be relative: " + sanitizeForLogging(extractPath));
        }

        for (String segment : unified.split("/")) {
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Extract path cannot contain '..': " + sanitizeForLogging(extractPath));
            }
        }

        if (unified.matches(".*[\\x00-\\x1f].*")) {
            throw new IllegalArgumentException("Extract path contains control characters");
        }
    }

    /**
     * Sanitize potentially malicious input for safe logging.
     */
    private static String sanitizeForLogging(String input) {
        if (input == null) return "null";

        String sanitized = input.length() > 100 ? input.substring(0, 100) + "..." : input;

        return sanitized
                .replaceAll("[\\r\\n]", " ")
                .replaceAll("[;|&$`<>(){}\\[\\]\\\\]", "?");
    }
}
