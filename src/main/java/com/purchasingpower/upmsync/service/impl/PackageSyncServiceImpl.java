package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.event.PackageBuiltEvent;
import com.purchasingpower.upmsync.exception.CommitIOException;
import com.purchasingpower.upmsync.exception.PackageSyncException;
import com.purchasingpower.upmsync.exception.StagingIOException;
import com.purchasingpower.upmsync.exception.SyncCancelledException;
import com.purchasingpower.upmsync.exception.SyncErrorKind;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;
import com.purchasingpower.upmsync.model.sync.SyncDecision;
import com.purchasingpower.upmsync.model.sync.SyncOptions;
import com.purchasingpower.upmsync.model.sync.SyncOutcome;
import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.model.sync.SyncRunReport;
import com.purchasingpower.upmsync.model.sync.SyncState;
import com.purchasingpower.upmsync.model.sync.WorkspaceTree;
import com.purchasingpower.upmsync.model.sync.ReconciledEntry.ChangeType;
import com.purchasingpower.upmsync.model.unity.GeneratedFile;
import com.purchasingpower.upmsync.model.unity.PackageLayout;
import com.purchasingpower.upmsync.model.unity.StagedOutputTree;
import com.purchasingpower.upmsync.model.unity.SynthesizedArtifacts;
import com.purchasingpower.upmsync.service.ManifestSynthesizer;
import com.purchasingpower.upmsync.service.PackageSyncService;
import com.purchasingpower.upmsync.service.ReferenceTracker;
import com.purchasingpower.upmsync.service.SourceExtractor;
import com.purchasingpower.upmsync.service.SyncStateStore;
import com.purchasingpower.upmsync.service.TreeTransformer;
import com.purchasingpower.upmsync.service.config.LoadedPackageConfig;
import com.purchasingpower.upmsync.service.config.PackageConfigLoader;
import com.purchasingpower.upmsync.service.unity.NamespaceDetector;
import com.purchasingpower.upmsync.service.unity.OutputTreeCommitter;
import com.purchasingpower.upmsync.service.unity.PackageDocsGenerator;
import com.purchasingpower.upmsync.service.unity.UnityJsonWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Package orchestrator.
 *
 * <p>Per package: resolve the ref, skip when unchanged, extract the subtree,
 * synthesize manifest and docs, stage the tree, swap it into place, and only then
 * record the new state. Any failure before the swap leaves the committed tree and
 * the recorded state exactly as they were.
 *
 * <p>Each package has its own lock; different packages run in parallel on the
 * {@code packageSyncExecutor}.
 */
@Slf4j
@Service
public class PackageSyncServiceImpl implements PackageSyncService {

    private final ReferenceTracker referenceTracker;
    private final SourceExtractor sourceExtractor;
    private final NamespaceDetector namespaceDetector;
    private final ManifestSynthesizer manifestSynthesizer;
    private final PackageDocsGenerator docsGenerator;
    private final UnityJsonWriter jsonWriter;
    private final TreeTransformer treeTransformer;
    private final OutputTreeCommitter committer;
    private final SyncStateStore stateStore;
    private final PackageConfigLoader configLoader;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final Executor executor;

    static final String UNNAMED_PACKAGE = "<unnamed>";

    private final Map<String, ReentrantLock> packageLocks = new ConcurrentHashMap<>();
    private final Map<String, SyncResult> lastResults = new ConcurrentHashMap<>();

    public PackageSyncServiceImpl(ReferenceTracker referenceTracker,
                                  SourceExtractor sourceExtractor,
                                  NamespaceDetector namespaceDetector,
                                  ManifestSynthesizer manifestSynthesizer,
                                  PackageDocsGenerator docsGenerator,
                                  UnityJsonWriter jsonWriter,
                                  TreeTransformer treeTransformer,
                                  OutputTreeCommitter committer,
                                  SyncStateStore stateStore,
                                  PackageConfigLoader configLoader,
                                  ApplicationEventPublisher eventPublisher,
                                  AppProperties appProperties,
                                  @Qualifier("packageSyncExecutor") Executor executor) {
        this.referenceTracker = referenceTracker;
        this.sourceExtractor = sourceExtractor;
        this.namespaceDetector = namespaceDetector;
        this.manifestSynthesizer = manifestSynthesizer;
        this.docsGenerator = docsGenerator;
        this.jsonWriter = jsonWriter;
        this.treeTransformer = treeTransformer;
        this.committer = committer;
        this.stateStore = stateStore;
        this.configLoader = configLoader;
        this.eventPublisher = eventPublisher;
        this.appProperties = appProperties;
        this.executor = executor;
    }

    @Override
    public SyncResult sync(PackageSpec spec) {
        return sync(spec, SyncOptions.defaults());
    }

    @Override
    public SyncResult sync(PackageSpec spec, SyncOptions options) {
        long startTime = System.currentTimeMillis();
        String problem = missingRequiredField(spec);
        if (problem != null) {
            String name = spec != null && spec.getName() != null ? spec.getName() : UNNAMED_PACKAGE;
            log.error("❌ {} rejected: {}", name, problem);
            SyncResult result = SyncResult.failed(name, null, SyncErrorKind.CONFIG_INVALID, problem, elapsed(startTime));
            lastResults.put(name, result);
            return result;
        }
        String requestedRef = spec.getSource().ref();

        ReentrantLock lock = packageLocks.computeIfAbsent(spec.getName(), name -> new ReentrantLock());
        lock.lock();
        SyncResult result;
        try {
            result = doSync(spec, options, startTime);
        } catch (PackageSyncException e) {
            log.error("❌ {} failed ({}): {}", spec.getName(), e.getKind(), e.getMessage());
            result = SyncResult.failed(spec.getName(), requestedRef, e, elapsed(startTime));
        } catch (RuntimeException e) {
            log.error("❌ {} failed unexpectedly", spec.getName(), e);
            result = SyncResult.failed(spec.getName(), requestedRef, SyncErrorKind.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), elapsed(startTime));
        } finally {
            lock.unlock();
        }

        lastResults.put(spec.getName(), result);
        log.info(result.summary());
        return result;
    }

    @Override
    public SyncRunReport syncAll(List<PackageSpec> specs, boolean force) {
        long startTime = System.currentTimeMillis();
        log.info("🚀 Syncing {} packages (force={})", specs.size(), force);

        List<CompletableFuture<SyncResult>> futures = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            PackageSpec spec = specs.get(i);
            String name = spec != null && spec.getName() != null ? spec.getName() : "#" + i;
            futures.add(submit(name, () -> sync(spec, SyncOptions.of(force))));
        }

        List<SyncResult> results = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        return report(results, startTime);
    }

    @Override
    public SyncRunReport syncConfigured(boolean force) {
        long startTime = System.currentTimeMillis();
        LoadedPackageConfig config = configLoader.load();
        log.info("🚀 Syncing {} configured packages (force={})", config.entries().size(), force);

        List<CompletableFuture<SyncResult>> futures = new ArrayList<>();
        for (LoadedPackageConfig.Entry entry : config.entries()) {
            if (entry.isValid()) {
                futures.add(submit(entry.name(), () -> sync(entry.spec(), SyncOptions.of(force))));
            } else {
                futures.add(CompletableFuture.completedFuture(invalidEntry(entry)));
            }
        }

        List<SyncResult> results = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        return report(results, startTime);
    }

    @Override
    public Optional<SyncResult> syncConfigured(String packageName, boolean force) {
        return configLoader.load().find(packageName)
                .map(entry -> entry.isValid() ? sync(entry.spec(), SyncOptions.of(force)) : invalidEntry(entry));
    }

    @Override
    public Optional<SyncResult> lastResult(String packageName) {
        return Optional.ofNullable(lastResults.get(packageName));
    }

    // ================================================================
    // HELPER METHODS
    // ================================================================

    /**
     * Runs one package on the executor. Whatever escapes the sync, including a
     * rejected submission, becomes that package's result row.
     */
    private CompletableFuture<SyncResult> submit(String packageName, Supplier<SyncResult> task) {
        CompletableFuture<SyncResult> future;
        try {
            future = CompletableFuture.supplyAsync(task, executor);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("❌ {} failed unexpectedly", packageName, cause);
            SyncResult result = SyncResult.failed(packageName, null, SyncErrorKind.INTERNAL_ERROR,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), 0);
            lastResults.put(packageName, result);
            return result;
        });
    }

    private static String missingRequiredField(PackageSpec spec) {
        if (spec == null) {
            return "Package definition is missing";
        }
        if (spec.getName() == null || spec.getName().isBlank()) {
            return "Package name is required";
        }
        if (spec.getSource() == null || spec.getSource().url() == null || spec.getSource().url().isBlank()) {
            return "Package " + spec.getName() + " has no source URL";
        }
        return null;
    }

    private SyncResult doSync(PackageSpec spec, SyncOptions options, long startTime) {
        String name = spec.getName();
        Path outputDir = Paths.get(appProperties.getOutputDir());
        Path target = outputDir.resolve(name);

        checkCancelled(options, name, "resolve");

        // State without a tree on disk is stale
        Optional<SyncState> previous = Files.isDirectory(target) ? stateStore.get(name) : Optional.empty();
        SyncDecision decision = referenceTracker.needsSync(spec, previous, options.force());
        ResolvedRef ref = decision.resolvedRef();

        if (decision.shouldSkip()) {
            return SyncResult.skipped(name, ref, elapsed(startTime));
        }

        checkCancelled(options, name, "extract");
        committer.removeLeftovers(outputDir, name);

        try (WorkspaceTree workspace = sourceExtractor.extract(spec.getSource(), ref, spec.effectiveExtractPath())) {
            checkCancelled(options, name, "synthesize");

            PackageLayout layout = PackageLayout.resolve(workspace.subtreeRoot(), spec.getPolicy());
            String namespace = resolveNamespace(spec, workspace);
            SynthesizedArtifacts artifacts = manifestSynthesizer.synthesize(spec, namespace, layout);
            List<GeneratedFile> generated = generatedFiles(spec, workspace, namespace, artifacts);

            checkCancelled(options, name, "transform");

            Path stagingRoot = committer.newStagingPath(outputDir, name);
            StagedOutputTree staged = treeTransformer.transform(
                    workspace, layout, spec, generated, Files.isDirectory(target) ? target : null, stagingRoot);

            if (options.cancellation().isCancelled()) {
                FileSystemUtils.deleteRecursively(stagingRoot.toFile());
                throw new SyncCancelledException(name, "commit");
            }

            // No cancellation point from here on
            committer.commit(staged, target);
            recordState(spec, ref);

            log.info("✅ {} committed at {}", name, ref.shortId());
            eventPublisher.publishEvent(new PackageBuiltEvent(spec, target, artifacts.manifest(), ref));

            return SyncResult.builder()
                    .packageName(name)
                    .outcome(SyncOutcome.BUILT)
                    .requestedRef(ref.requestedRef())
                    .resolvedRef(ref.commitId())
                    .outputPath(target.toString())
                    .filesStaged(staged.getFileCount())
                    .directoriesStaged(staged.getDirectoryCount())
                    .entriesRemoved((int) staged.count(ChangeType.DELETE))
                    .durationMs(elapsed(startTime))
                    .build();
        }
    }

    private String resolveNamespace(PackageSpec spec, WorkspaceTree workspace) {
        if (spec.getNamespace() != null && !spec.getNamespace().isBlank()) {
            return spec.getNamespace();
        }
        try {
            return namespaceDetector.detect(workspace.subtreeRoot()).orElse(null);
        } catch (UncheckedIOException e) {
            throw new StagingIOException("Namespace discovery failed: " + e.getMessage(), e);
        }
    }

    private List<GeneratedFile> generatedFiles(PackageSpec spec, WorkspaceTree workspace, String namespace,
                                               SynthesizedArtifacts artifacts) {
        List<GeneratedFile> generated = new ArrayList<>();
        generated.add(GeneratedFile.utf8(artifacts.manifest().relativePath(),
                jsonWriter.write(artifacts.manifest().content())));
        generated.add(GeneratedFile.utf8(artifacts.moduleDefinition().relativePath(),
                jsonWriter.write(artifacts.moduleDefinition().content())));
        try {
            generated.addAll(docsGenerator.generate(spec, workspace, namespace));
        } catch (UncheckedIOException e) {
            throw new StagingIOException("Package docs generation failed: " + e.getMessage(), e);
        }
        return generated;
    }

    private void recordState(PackageSpec spec, ResolvedRef ref) {
        SyncState state = SyncState.builder()
                .packageName(spec.getName())
                .lastRef(ref.commitId())
                .requestedRef(ref.requestedRef())
                .lastSyncAt(Instant.now())
                .lastOutcome(SyncOutcome.BUILT)
                .build();
        try {
            stateStore.put(spec.getName(), state);
        } catch (UncheckedIOException e) {
            // The tree is in place; the next run rebuilds the same content
            throw new CommitIOException("Tree committed but state not recorded: " + e.getMessage(), e);
        }
    }

    private SyncResult invalidEntry(LoadedPackageConfig.Entry entry) {
        SyncResult result = SyncResult.failed(entry.name(), null, SyncErrorKind.CONFIG_INVALID, entry.error(), 0);
        lastResults.put(entry.name(), result);
        return result;
    }

    private void checkCancelled(SyncOptions options, String packageName, String step) {
        if (options.cancellation().isCancelled()) {
            throw new SyncCancelledException(packageName, step);
        }
    }

    private SyncRunReport report(List<SyncResult> results, long startTime) {
        SyncRunReport report = new SyncRunReport(results, elapsed(startTime));
        if (report.hasFailures()) {
            log.warn("⚠️ {}", report.summary());
        } else {
            log.info("✅ {}", report.summary());
        }
        return report;
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
