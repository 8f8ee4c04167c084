package com.purchasingpower.upmsync.service.git;

import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.exception.ConfigInvalidException;
import com.purchasingpower.upmsync.exception.PackageSyncException;
import com.purchasingpower.upmsync.exception.RefNotFoundException;
import com.purchasingpower.upmsync.exception.SourceUnavailableException;
import com.purchasingpower.upmsync.exception.StagingIOException;
import com.purchasingpower.upmsync.exception.SubtreeMissingException;
import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;
import com.purchasingpower.upmsync.util.PackagePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.errors.IncorrectObjectTypeException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link VersionControlBackend} over JGit.
 *
 * Every materialization bare-clones into its own temporary directory under
 * {@code app.workspace-dir}; no working tree is ever checked out, so nothing
 * outside the requested subtree (and no uncommitted content) reaches the package.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JGitVersionControlBackend implements VersionControlBackend {

    static final List<String> LICENSE_CANDIDATES = List.of(
            "LICENSE", "LICENSE.txt", "LICENSE.md",
            "License", "License.txt", "License.md",
            "license", "license.txt", "license.md",
            "COPYING", "COPYING.txt",
            "COPYRIGHT", "COPYRIGHT.txt");

    static final List<String> README_CANDIDATES = List.of(
            "README.md", "README.MD", "Readme.md", "readme.md",
            "README.txt", "README.rst", "README", "readme");

    private static final Pattern COMMIT_ID = Pattern.compile("^[0-9a-fA-F]{40}([0-9a-fA-F]{24})?$");

    private static final String REPOSITORY_DIR = "repo.git";
    private static final String SUBTREE_DIR = "subtree";
    private static final String ROOT_FILES_DIR = "root-files";

    private final AppProperties appProperties;

    @Override
    public ResolvedRef resolveRef(SourceLocator source, String ref) {
        if (COMMIT_ID.matcher(ref).matches()) {
            // Existence is verified when the commit is materialized
            return new ResolvedRef(ref, null, ref.toLowerCase());
        }

        Map<String, Ref> advertised;
        try {
            advertised = Git.lsRemoteRepository()
                    .setRemote(source.url())
                    .setTimeout(appProperties.getGit().getTimeoutSeconds())
                    .callAsMap();
        } catch (GitAPIException | JGitInternalException e) {
            throw new SourceUnavailableException(
                    "Cannot list refs of " + source.url() + ": " + e.getMessage(), e);
        }

        for (String candidate : candidateRefNames(ref)) {
            Ref match = advertised.get(candidate);
            if (match == null) {
                continue;
            }
            ObjectId commit = match.getPeeledObjectId() != null ? match.getPeeledObjectId() : match.getObjectId();
            if (commit == null) {
                continue;
            }
            log.debug("Resolved {} @ {} to {} ({})", source.url(), ref, commit.name(), candidate);
            return new ResolvedRef(ref, candidate, commit.name());
        }

        throw new RefNotFoundException("Ref '" + ref + "' not found in " + source.url());
    }

    @Override
    public MaterializedSource materialize(SourceLocator source, ResolvedRef ref, String subtreePath) {
        Path workspaceRoot = createWorkspace();
        try {
            MaterializedSource materialized = cloneAndWrite(source, ref, subtreePath, workspaceRoot);
            log.info("Materialized {} @ {} path '{}' into {}",
                    source.url(), ref.shortId(), subtreePath, workspaceRoot.getFileName());
            return materialized;
        } catch (RuntimeException e) {
            release(workspaceRoot);
            throw e;
        }
    }

    @Override
    public void release(Path workspaceRoot) {
        if (workspaceRoot == null || !Files.exists(workspaceRoot)) {
            return;
        }
        boolean deleted = FileSystemUtils.deleteRecursively(workspaceRoot.toFile());
        if (!deleted || Files.exists(workspaceRoot)) {
            log.warn("Could not fully delete workspace {}", workspaceRoot);
        } else {
            log.debug("Released workspace {}", workspaceRoot);
        }
    }

    // ================================================================
    // HELPER METHODS
    // ================================================================

    private List<String> candidateRefNames(String ref) {
        if (ref.startsWith(Constants.R_REFS) || ref.equals(Constants.HEAD)) {
            return List.of(ref);
        }
        return List.of(Constants.R_HEADS + ref, Constants.R_TAGS + ref);
    }

    private Path createWorkspace() {
        try {
            Path base = Paths.get(appProperties.getWorkspaceDir());
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "ws-");
        } catch (IOException e) {
            throw new StagingIOException("Cannot create workspace under " + appProperties.getWorkspaceDir(), e);
        }
    }

    private MaterializedSource cloneAndWrite(SourceLocator source, ResolvedRef ref, String subtreePath,
                                             Path workspaceRoot) {
        Path repositoryDir = workspaceRoot.resolve(REPOSITORY_DIR);
        int timeout = appProperties.getGit().getTimeoutSeconds();

        try (Git git = Git.cloneRepository()
                .setURI(source.url())
                .setDirectory(repositoryDir.toFile())
                .setBare(true)
                .setCloneAllBranches(true)
                .setTimeout(timeout)
                .call()) {

            git.fetch()
                    .setRefSpecs(new RefSpec("+refs/tags/*:refs/tags/*"))
                    .setTimeout(timeout)
                    .call();

            Repository repository = git.getRepository();
            RevCommit commit = parseCommit(repository, ref);

            String normalized = PackagePaths.normalize(subtreePath);
            ObjectId subtreeId = locateSubtree(repository, commit.getTree(), normalized);

            Path subtreeRoot = workspaceRoot.resolve(SUBTREE_DIR);
            Files.createDirectories(subtreeRoot);
            int written = writeTree(repository, subtreeId, subtreeRoot);
            log.debug("Wrote {} files of '{}' at {}", written, normalized, ref.shortId());

            Path rootFiles = workspaceRoot.resolve(ROOT_FILES_DIR);
            Files.createDirectories(rootFiles);
            Set<String> rootBlobs = rootBlobNames(repository, commit.getTree());
            Path license = writeFirstCandidate(repository, commit.getTree(), rootBlobs, LICENSE_CANDIDATES, rootFiles);
            Path readme = writeFirstCandidate(repository, commit.getTree(), rootBlobs, README_CANDIDATES, rootFiles);

            return new MaterializedSource(workspaceRoot, subtreeRoot, license, readme);

        } catch (PackageSyncException e) {
            throw e;
        } catch (GitAPIException | JGitInternalException e) {
            throw new SourceUnavailableException("Cannot fetch " + source.url() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StagingIOException("Failed to write workspace for " + source.url() + ": " + e.getMessage(), e);
        }
    }

    private RevCommit parseCommit(Repository repository, ResolvedRef ref) throws IOException {
        ObjectId id;
        try {
            id = repository.resolve(ref.commitId() + "^{commit}");
        } catch (IOException | RuntimeException e) {
            throw new RefNotFoundException("Commit " + ref.commitId() + " cannot be resolved", e);
        }
        if (id == null) {
            throw new RefNotFoundException("Commit " + ref.commitId() + " not found (ref '" + ref.requestedRef() + "')");
        }
        try (RevWalk walk = new RevWalk(repository)) {
            return walk.parseCommit(id);
        } catch (MissingObjectException | IncorrectObjectTypeException e) {
            throw new RefNotFoundException("Commit " + ref.commitId() + " not found", e);
        }
    }

    private ObjectId locateSubtree(Repository repository, RevTree tree, String subtreePath) throws IOException {
        if (subtreePath.isEmpty()) {
            return tree.getId();
        }

        try (TreeWalk walk = TreeWalk.forPath(repository, subtreePath, tree)) {
            if (walk != null) {
                if (walk.getFileMode(0) != FileMode.TREE) {
                    throw new SubtreeMissingException("Extract path '" + subtreePath + "' is not a directory");
                }
                return walk.getObjectId(0);
            }
        }

        String caseVariant = findCaseVariant(repository, tree, subtreePath);
        if (caseVariant != null) {
            throw new ConfigInvalidException("Extract path '" + subtreePath
                    + "' only exists with different letter case: '" + caseVariant + "'");
        }
        throw new SubtreeMissingException("Extract path '" + subtreePath + "' does not exist");
    }

    /**
     * Walks the path one segment at a time, matching names case-insensitively.
     */
    private String findCaseVariant(Repository repository, RevTree tree, String subtreePath) throws IOException {
        ObjectId current = tree.getId();
        List<String> actual = new ArrayList<>();

        for (String segment : subtreePath.split("/")) {
            ObjectId next = null;
            try (TreeWalk walk = new TreeWalk(repository)) {
                walk.addTree(current);
                walk.setRecursive(false);
                while (walk.next()) {
                    if (walk.getNameString().equalsIgnoreCase(segment) && walk.getFileMode(0) == FileMode.TREE) {
                        next = walk.getObjectId(0);
                        actual.add(walk.getNameString());
                        break;
                    }
                }
            }
            if (next == null) {
                return null;
            }
            current = next;
        }
        return String.join("/", actual);
    }

    private int writeTree(Repository repository, ObjectId treeId, Path target) throws IOException {
        int written = 0;
        try (TreeWalk walk = new TreeWalk(repository)) {
            walk.addTree(treeId);
            walk.setRecursive(true);

            while (walk.next()) {
                FileMode mode = walk.getFileMode(0);
                if (mode == FileMode.GITLINK || mode == FileMode.SYMLINK) {
                    log.debug("Skipping {} entry {}", mode == FileMode.GITLINK ? "submodule" : "symlink",
                            walk.getPathString());
                    continue;
                }
                Path file = target.resolve(walk.getPathString());
                Files.createDirectories(file.getParent());
                try (OutputStream out = Files.newOutputStream(file)) {
                    repository.open(walk.getObjectId(0)).copyTo(out);
                }
                written++;
            }
        }
        return written;
    }

    private Set<String> rootBlobNames(Repository repository, RevTree tree) throws IOException {
        Set<String> names = new HashSet<>();
        try (TreeWalk walk = new TreeWalk(repository)) {
            walk.addTree(tree);
            walk.setRecursive(false);
            while (walk.next()) {
                FileMode mode = walk.getFileMode(0);
                if (mode == FileMode.REGULAR_FILE || mode == FileMode.EXECUTABLE_FILE) {
                    names.add(walk.getNameString());
                }
            }
        }
        return names;
    }

    private Path writeFirstCandidate(Repository repository, RevTree tree, Set<String> rootBlobs,
                                     List<String> candidates, Path targetDir) throws IOException {
        for (String candidate : candidates) {
            if (!rootBlobs.contains(candidate)) {
                continue;
            }
            try (TreeWalk walk = TreeWalk.forPath(repository, candidate, tree)) {
                Path file = targetDir.resolve(candidate);
                try (OutputStream out = Files.newOutputStream(file)) {
                    repository.open(walk.getObjectId(0)).copyTo(out);
                }
                return file;
            }
        }
        return null;
    }
}
