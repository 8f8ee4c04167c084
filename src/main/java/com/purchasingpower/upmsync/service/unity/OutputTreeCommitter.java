package com.purchasingpower.upmsync.service.unity;

import com.purchasingpower.upmsync.exception.CommitIOException;
import com.purchasingpower.upmsync.model.unity.StagedOutputTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Swaps a staged package tree into its durable location.
 *
 * <p>Committed trees live under {@code <outputDir>/.versions/<package>@<id>} and
 * {@code <outputDir>/<package>} is a relative symbolic link to the current one. A
 * commit moves the staged tree into a new version, then replaces the link with a
 * single atomic rename, so readers see either the old or the new tree and the
 * package path never disappears. The previous version is deleted afterwards.
 *
 * <p>Where symbolic links cannot be created, and once for a package directory
 * written before links were used, the directory itself is swapped: the old tree is
 * renamed aside, the new one renamed in, and the old one renamed back if that
 * fails. The package path is then briefly absent.
 *
 * <p>Staging directories, backups and versions are named {@code <package>@...} and
 * stay on the same filesystem as the target.
 */
@Slf4j
@Component
public class OutputTreeCommitter {

    public static final String STAGING_DIR = ".staging";
    public static final String VERSIONS_DIR = ".versions";

    private static final char NAME_SEPARATOR = '@';

    /**
     * Fresh, not yet existing staging path for one build of {@code packageName}.
     */
    public Path newStagingPath(Path outputDir, String packageName) {
        return outputDir.resolve(STAGING_DIR).resolve(packageName + NAME_SEPARATOR + UUID.randomUUID());
    }

    /**
     * @param staged tree built under {@link #newStagingPath}
     * @param target {@code <outputDir>/<packageName>}
     * @throws CommitIOException when the swap fails; the previous tree is then still in place
     */
    public void commit(StagedOutputTree staged, Path target) {
        Path outputDir = target.toAbsolutePath().getParent();
        String packageName = target.getFileName().toString();
        Path stagingRoot = staged.getRoot();

        Path version = outputDir.resolve(VERSIONS_DIR).resolve(packageName + NAME_SEPARATOR + UUID.randomUUID());
        try {
            Files.createDirectories(version.getParent());
            Files.move(stagingRoot, version, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(stagingRoot);
            throw new CommitIOException("Cannot move staged tree of " + packageName + " into "
                    + VERSIONS_DIR + ": " + e.getMessage(), e);
        }

        Path link;
        try {
            link = createLink(outputDir, packageName, version);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Symbolic links unavailable for {} ({}); swapping directories", packageName, e.getMessage());
            swapDirectory(version, target);
            log.debug("Committed {} into {}", version.getFileName(), target);
            return;
        }

        Path previousVersion = currentVersion(target);
        try {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS) && !Files.isSymbolicLink(target)) {
                // Package directory from before links were used
                swapDirectory(link, target);
            } else {
                Files.move(link, target, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException | CommitIOException e) {
            deleteLink(link);
            discard(version);
            if (e instanceof CommitIOException) {
                throw (CommitIOException) e;
            }
            throw new CommitIOException("Cannot switch " + target + " to the new tree: " + e.getMessage(), e);
        }

        if (previousVersion != null && !previousVersion.equals(version)) {
            discard(previousVersion);
        }
        log.debug("Committed {} into {}", version.getFileName(), target);
    }

    /**
     * Removes staging directories, backups and unreferenced versions a crashed run
     * left behind for one package.
     */
    public void removeLeftovers(Path outputDir, String packageName) {
        removeMatching(outputDir.resolve(STAGING_DIR), packageName, null);
        removeMatching(outputDir.resolve(VERSIONS_DIR), packageName, currentVersion(outputDir.resolve(packageName)));
    }

    // ================================================================
    // HELPER METHODS
    // ================================================================

    private Path createLink(Path outputDir, String packageName, Path version) throws IOException {
        Path link = outputDir.resolve(STAGING_DIR)
                .resolve(packageName + NAME_SEPARATOR + "link-" + UUID.randomUUID());
        Files.createDirectories(link.getParent());
        // Resolved relative to the directory the link ends up in
        return Files.createSymbolicLink(link, Paths.get(VERSIONS_DIR, version.getFileName().toString()));
    }

    /**
     * Version directory the package link points at, or null when the target is not a link.
     */
    private Path currentVersion(Path target) {
        if (!Files.isSymbolicLink(target)) {
            return null;
        }
        try {
            return target.toAbsolutePath().getParent().resolve(Files.readSymbolicLink(target)).normalize();
        } catch (IOException e) {
            log.warn("Cannot read link {}: {}", target, e.getMessage());
            return null;
        }
    }

    /**
     * Renames the previous entry at {@code target} aside, renames {@code source} in,
     * and restores the previous entry if that fails.
     */
    private void swapDirectory(Path source, Path target) {
        Path backup = null;
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                backup = target.toAbsolutePath().getParent().resolve(STAGING_DIR)
                        .resolve(target.getFileName().toString() + NAME_SEPARATOR + "backup-" + UUID.randomUUID());
                Files.createDirectories(backup.getParent());
                Files.move(target, backup, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException e) {
            discard(source);
            throw new CommitIOException("Cannot move previous tree of " + target.getFileName() + " aside: "
                    + e.getMessage(), e);
        }

        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (backup != null) {
                try {
                    Files.move(backup, target, StandardCopyOption.ATOMIC_MOVE);
                    log.info("Restored previous tree of {}", target.getFileName());
                } catch (IOException rollback) {
                    e.addSuppressed(rollback);
                    log.error("Rollback of {} failed; previous tree kept at {}", target.getFileName(), backup, rollback);
                }
            }
            discard(source);
            throw new CommitIOException("Cannot move staged tree into " + target + ": " + e.getMessage(), e);
        }

        if (backup != null) {
            discard(backup);
        }
    }

    private void removeMatching(Path directory, String packageName, Path keep) {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(directory, packageName + NAME_SEPARATOR + "*")) {
            for (Path leftover : leftovers) {
                if (keep != null && leftover.toAbsolutePath().normalize().equals(keep)) {
                    continue;
                }
                log.warn("Removing leftover {} from an interrupted sync", leftover.getFileName());
                discard(leftover);
            }
        } catch (IOException e) {
            log.warn("Could not scan {} for leftovers of {}: {}", directory, packageName, e.getMessage());
        }
    }

    private void discard(Path path) {
        if (Files.isSymbolicLink(path)) {
            deleteLink(path);
            return;
        }
        if (Files.exists(path) && !FileSystemUtils.deleteRecursively(path.toFile())) {
            log.warn("Could not delete {}", path);
        }
    }

    private void deleteLink(Path link) {
        try {
            Files.deleteIfExists(link);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", link, e.getMessage());
        }
    }
}
