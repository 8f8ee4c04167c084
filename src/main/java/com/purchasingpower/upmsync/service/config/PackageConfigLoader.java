package com.purchasingpower.upmsync.service.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.configuration.BuildProperties;
import com.purchasingpower.upmsync.exception.ConfigInvalidException;
import com.purchasingpower.upmsync.model.spec.BuildPolicy;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.util.GitInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads package definitions from {@code packages.yaml}.
 *
 * <p>Entries are validated one by one; a broken entry only invalidates itself. A
 * file that cannot be read or parsed at all fails the whole load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackageConfigLoader {

    static final Pattern PACKAGE_NAME = Pattern.compile("^[a-z0-9_-]+(\\.[a-z0-9_-]+)+$");
    static final String GIT_SOURCE = "git";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final AppProperties appProperties;

    public LoadedPackageConfig load() {
        return load(Paths.get(appProperties.getPackagesFile()));
    }

    public LoadedPackageConfig load(Path packagesFile) {
        if (!Files.isRegularFile(packagesFile)) {
            throw new ConfigInvalidException("Packages file not found: " + packagesFile);
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(packagesFile.toFile());
        } catch (IOException e) {
            throw new ConfigInvalidException("Cannot parse " + packagesFile + ": " + e.getMessage(), e);
        }

        JsonNode packages = root == null ? null : root.get("packages");
        if (packages == null || packages.isNull()) {
            log.warn("No packages defined in {}", packagesFile);
            return new LoadedPackageConfig(List.of());
        }
        if (!packages.isArray()) {
            throw new ConfigInvalidException("'packages' in " + packagesFile + " must be a list");
        }

        List<LoadedPackageConfig.Entry> entries = new ArrayList<>();
        for (int i = 0; i < packages.size(); i++) {
            entries.add(toEntry(packages.get(i), i));
        }
        entries = rejectDuplicates(entries);

        LoadedPackageConfig config = new LoadedPackageConfig(entries);
        log.info("Loaded {} package definitions from {} ({} invalid)",
                entries.size(), packagesFile, config.invalid().size());
        config.invalid().forEach((name, error) -> log.warn("❌ Invalid package definition {}: {}", name, error));
        return config;
    }

    private LoadedPackageConfig.Entry toEntry(JsonNode node, int index) {
        String fallbackName = "#" + index;
        if (node.hasNonNull("name") && node.get("name").isTextual()) {
            fallbackName = node.get("name").asText();
        }

        try {
            PackageDefinition definition = yamlMapper.treeToValue(node, PackageDefinition.class);
            return LoadedPackageConfig.Entry.valid(toSpec(definition));
        } catch (IOException | IllegalArgumentException e) {
            return LoadedPackageConfig.Entry.invalid(fallbackName, e.getMessage());
        }
    }

    /**
     * Validates one definition and converts it.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    PackageSpec toSpec(PackageDefinition definition) {
        String name = definition.getName();
        if (name == null || !PACKAGE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Package name must be lowercase reverse-domain notation (e.g. com.example.tool): " + name);
        }

        PackageDefinition.Source source = definition.getSource();
        if (source == null) {
            throw new IllegalArgumentException("Package " + name + " has no source");
        }
        if (source.getType() != null && !GIT_SOURCE.equalsIgnoreCase(source.getType())) {
            throw new IllegalArgumentException("Unsupported source type '" + source.getType() + "'; only git is supported");
        }
        GitInputValidator.validateRepoUrl(source.getUrl());
        if (source.getRef() != null) {
            GitInputValidator.validateRef(source.getRef());
        }
        GitInputValidator.validateExtractPath(definition.getExtractPath());

        PackageSpec.PackageSpecBuilder spec = PackageSpec.builder()
                .name(name)
                .displayName(definition.getDisplayName())
                .description(definition.getDescription())
                .version(definition.getVersion())
                .source(new SourceLocator(source.getUrl(), source.getRef()))
                .extractPath(definition.getExtractPath())
                .namespace(definition.getNamespace())
                .asmdefName(definition.getAsmdefName())
                .dependencies(orEmpty(definition.getDependencies()))
                .keywords(orEmpty(definition.getKeywords()))
                .assemblyReferences(orEmpty(definition.getAssemblyReferences()))
                .defineConstraints(orEmpty(definition.getDefineConstraints()))
                .versionDefines(orEmpty(definition.getVersionDefines()))
                .includePlatforms(orEmpty(definition.getPlatforms()))
                .identitySeed(definition.getIdentitySeed())
                .policy(toPolicy(definition.getBuild()));

        Object author = definition.getAuthor();
        if (author instanceof String) {
            spec.author((String) author);
        } else if (author != null) {
            spec.packageJsonField("author", author);
        }
        spec.packageJsonExtra(orEmpty(definition.getPackageJsonExtra()));
        spec.asmdefExtra(orEmpty(definition.getAsmdefExtra()));

        return spec.build();
    }

    private BuildPolicy toPolicy(PackageDefinition.Build build) {
        BuildProperties defaults = appProperties.getBuild();
        if (build == null) {
            return new BuildPolicy(defaults.isRemoveProjectFiles(), defaults.isNestUnderRuntime(),
                    defaults.isGenerateIdentityRecords());
        }
        return new BuildPolicy(
                build.getRemoveProjectFiles() != null ? build.getRemoveProjectFiles() : defaults.isRemoveProjectFiles(),
                build.getNestUnderRuntime() != null ? build.getNestUnderRuntime() : defaults.isNestUnderRuntime(),
                build.getGenerateIdentityRecords() != null
                        ? build.getGenerateIdentityRecords() : defaults.isGenerateIdentityRecords());
    }

    /**
     * A name defined more than once invalidates every entry carrying it.
     */
    private List<LoadedPackageConfig.Entry> rejectDuplicates(List<LoadedPackageConfig.Entry> entries) {
        Map<String, Integer> counts = new HashMap<>();
        entries.forEach(e -> counts.merge(e.name(), 1, Integer::sum));

        List<LoadedPackageConfig.Entry> checked = new ArrayList<>(entries.size());
        for (LoadedPackageConfig.Entry entry : entries) {
            if (counts.get(entry.name()) > 1) {
                checked.add(LoadedPackageConfig.Entry.invalid(entry.name(),
                        "Package name " + entry.name() + " is defined " + counts.get(entry.name()) + " times"));
            } else {
                checked.add(entry);
            }
        }
        return checked;
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> values) {
        return values != null ? values : Map.of();
    }
}
