package com.purchasingpower.upmsync.model.sync;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Ephemeral extraction of one subtree at one resolved commit.
 *
 * <p>Owned by a single sync. Closing it deletes the whole workspace, so use it in
 * try-with-resources.
 */
public final class WorkspaceTree implements AutoCloseable {

    private final Path root;
    private final Path subtreeRoot;
    private final Path licenseFile;
    private final Path readmeFile;
    private final ResolvedRef resolvedRef;
    private final Consumer<Path> releaser;
    private boolean released;

    public WorkspaceTree(Path root, Path subtreeRoot, Path licenseFile, Path readmeFile,
                         ResolvedRef resolvedRef, Consumer<Path> releaser) {
        this.root = root;
        this.subtreeRoot = subtreeRoot;
        this.licenseFile = licenseFile;
        this.readmeFile = readmeFile;
        this.resolvedRef = resolvedRef;
        this.releaser = releaser;
    }

    public Path root() {
        return root;
    }

    public Path subtreeRoot() {
        return subtreeRoot;
    }

    /** LICENSE-like file found at the repository root */
    public Optional<Path> licenseFile() {
        return Optional.ofNullable(licenseFile);
    }

    /** README-like file found at the repository root */
    public Optional<Path> readmeFile() {
        return Optional.ofNullable(readmeFile);
    }

    public ResolvedRef resolvedRef() {
        return resolvedRef;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            releaser.accept(root);
        }
    }
}
