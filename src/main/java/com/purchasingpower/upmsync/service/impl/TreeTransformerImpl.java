package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.exception.StagingIOException;
import com.purchasingpower.upmsync.model.spec.BuildPolicy;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.ReconciledEntry;
import com.purchasingpower.upmsync.model.sync.ReconciledEntry.ChangeType;
import com.purchasingpower.upmsync.model.sync.WorkspaceTree;
import com.purchasingpower.upmsync.model.unity.GeneratedFile;
import com.purchasingpower.upmsync.model.unity.IdentityToken;
import com.purchasingpower.upmsync.model.unity.PackageLayout;
import com.purchasingpower.upmsync.model.unity.StagedOutputTree;
import com.purchasingpower.upmsync.service.IdentityDeriver;
import com.purchasingpower.upmsync.service.TreeTransformer;
import com.purchasingpower.upmsync.service.unity.MetaFileRenderer;
import com.purchasingpower.upmsync.service.unity.ProjectFileFilter;
import com.purchasingpower.upmsync.util.PackagePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class TreeTransformerImpl implements TreeTransformer {

    private final IdentityDeriver identityDeriver;
    private final MetaFileRenderer metaFileRenderer;

    @Override
    public StagedOutputTree transform(WorkspaceTree workspace,
                                      PackageLayout layout,
                                      PackageSpec spec,
                                      List<GeneratedFile> generatedFiles,
                                      Path previousOutput,
                                      Path stagingRoot) {
        try {
            return stage(workspace, layout, spec, generatedFiles, previousOutput, stagingRoot);
        } catch (IOException | UncheckedIOException e) {
            FileSystemUtils.deleteRecursively(stagingRoot.toFile());
            throw new StagingIOException("Failed to stage " + spec.getName() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            FileSystemUtils.deleteRecursively(stagingRoot.toFile());
            throw e;
        }
    }

    private StagedOutputTree stage(WorkspaceTree workspace,
                                   PackageLayout layout,
                                   PackageSpec spec,
                                   List<GeneratedFile> generatedFiles,
                                   Path previousOutput,
                                   Path stagingRoot) throws IOException {
        BuildPolicy policy = spec.getPolicy();
        Files.createDirectories(stagingRoot);

        int mirrored = mirrorSources(workspace.subtreeRoot(), layout, policy, stagingRoot);
        for (GeneratedFile generated : generatedFiles) {
            Path target = PackagePaths.resolve(stagingRoot, generated.relativePath());
            Files.createDirectories(target.getParent());
            Files.write(target, generated.content());
        }

        // path -> isDirectory, sorted; the root is ""
        Map<String, Boolean> staged = listEntries(stagingRoot);

        StagedOutputTree.StagedOutputTreeBuilder tree = StagedOutputTree.builder().root(stagingRoot);
        String rootToken = spec.identityRootToken();
        int files = 0;
        int directories = 0;

        for (Map.Entry<String, Boolean> entry : staged.entrySet()) {
            String path = entry.getKey();
            boolean directory = entry.getValue();
            IdentityToken token = identityDeriver.derive(rootToken, path);
            tree.identity(path, token);

            if (policy.generateIdentityRecords()) {
                String record = directory
                        ? metaFileRenderer.renderDirectory(token)
                        : metaFileRenderer.renderFile(token, fileName(path));
                Files.writeString(PackagePaths.resolve(stagingRoot, PackagePaths.sidecarOf(path)),
                        record, StandardCharsets.UTF_8);
            }

            if (path.isEmpty()) {
                continue;
            }
            if (directory) {
                directories++;
            } else {
                files++;
            }
        }

        List<ReconciledEntry> entries = reconcile(staged, stagingRoot, previousOutput);
        entries.forEach(tree::entry);

        StagedOutputTree result = tree.fileCount(files).directoryCount(directories).build();
        log.info("{}: staged {} files ({} mirrored), {} dirs; {} added, {} modified, {} removed",
                spec.getName(), files, mirrored, directories,
                result.count(ChangeType.ADD), result.count(ChangeType.MODIFY), result.count(ChangeType.DELETE));
        return result;
    }

    private int mirrorSources(Path sourceRoot, PackageLayout layout, BuildPolicy policy, Path stagingRoot)
            throws IOException {
        List<Path> sources;
        try (Stream<Path> walk = Files.walk(sourceRoot)) {
            sources = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        int copied = 0;
        for (Path source : sources) {
            String relative = PackagePaths.relativize(sourceRoot, source);

            // Identity records are always regenerated, never mirrored
            if (PackagePaths.isSidecar(fileName(relative))) {
                continue;
            }
            if (policy.removeProjectFiles() && ProjectFileFilter.isProjectFile(relative)) {
                log.debug("Dropping project file {}", relative);
                continue;
            }

            Path target = PackagePaths.resolve(stagingRoot, layout.toOutputPath(relative));
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            copied++;
        }
        return copied;
    }

    /**
     * Every entry below {@code root} except sidecar files, keyed by package-relative path.
     * A directory whose name ends in .meta is a regular entry.
     */
    private Map<String, Boolean> listEntries(Path root) throws IOException {
        Map<String, Boolean> entries = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.forEach(path -> {
                String relative = PackagePaths.relativize(root, path);
                boolean directory = Files.isDirectory(path);
                if (!directory && PackagePaths.isSidecar(fileName(relative))) {
                    return;
                }
                entries.put(relative, directory);
            });
        }
        return entries;
    }

    private List<ReconciledEntry> reconcile(Map<String, Boolean> staged, Path stagingRoot, Path previousOutput)
            throws IOException {
        // The committed output is usually a symbolic link to its current version
        Path previousRoot = previousOutput != null && Files.isDirectory(previousOutput)
                ? previousOutput.toRealPath()
                : null;
        Map<String, Boolean> previous = previousRoot != null ? listEntries(previousRoot) : Map.of();

        List<ReconciledEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : staged.entrySet()) {
            String path = entry.getKey();
            if (path.isEmpty()) {
                continue;
            }
            boolean directory = entry.getValue();
            Boolean previousDirectory = previous.get(path);

            ChangeType change;
            if (previousDirectory == null) {
                change = ChangeType.ADD;
            } else if (directory || previousDirectory) {
                change = directory == previousDirectory ? ChangeType.UNCHANGED : ChangeType.MODIFY;
            } else {
                long mismatch = Files.mismatch(
                        PackagePaths.resolve(stagingRoot, path), PackagePaths.resolve(previousRoot, path));
                change = mismatch == -1L ? ChangeType.UNCHANGED : ChangeType.MODIFY;
            }
            entries.add(new ReconciledEntry(path, directory, change));
        }

        for (Map.Entry<String, Boolean> entry : previous.entrySet()) {
            String path = entry.getKey();
            if (!path.isEmpty() && !staged.containsKey(path)) {
                entries.add(new ReconciledEntry(path, entry.getValue(), ChangeType.DELETE));
                log.debug("Removing {} and its identity record", path);
            }
        }
        return entries;
    }

    private static String fileName(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }
}
