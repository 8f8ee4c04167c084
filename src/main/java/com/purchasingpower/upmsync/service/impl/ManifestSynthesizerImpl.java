package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.configuration.PackageDefaultsProperties;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.unity.ManifestArtifact;
import com.purchasingpower.upmsync.model.unity.ModuleDefinitionArtifact;
import com.purchasingpower.upmsync.model.unity.PackageLayout;
import com.purchasingpower.upmsync.model.unity.SynthesizedArtifacts;
import com.purchasingpower.upmsync.service.ManifestSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestSynthesizerImpl implements ManifestSynthesizer {

    static final String REGISTRY_URL_PREFIX = "https://npm.pkg.github.com/@";

    private final AppProperties appProperties;

    @Override
    public SynthesizedArtifacts synthesize(PackageSpec spec, String discoveredNamespace, PackageLayout layout) {
        String namespace = effectiveNamespace(spec, discoveredNamespace);

        ManifestArtifact manifest = new ManifestArtifact(ManifestArtifact.FILE_NAME, buildManifest(spec, namespace));
        ModuleDefinitionArtifact moduleDefinition = new ModuleDefinitionArtifact(
                layout.moduleDefinitionPath(spec.effectiveAsmdefName()),
                buildModuleDefinition(spec, namespace));

        log.debug("{}: synthesized manifest ({} fields) and {}",
                spec.getName(), manifest.content().size(), moduleDefinition.relativePath());

        return new SynthesizedArtifacts(manifest, moduleDefinition);
    }

    private String effectiveNamespace(PackageSpec spec, String discoveredNamespace) {
        if (spec.getNamespace() != null && !spec.getNamespace().isBlank()) {
            return spec.getNamespace();
        }
        return discoveredNamespace;
    }

    private Map<String, Object> buildManifest(PackageSpec spec, String namespace) {
        PackageDefaultsProperties defaults = appProperties.getDefaults();

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("name", spec.getName());
        manifest.put("displayName", spec.effectiveDisplayName());
        manifest.put("version", spec.effectiveVersion());
        manifest.put("description", spec.getDescription() != null ? spec.getDescription() : "");
        manifest.put("author", spec.getAuthor() != null ? spec.getAuthor() : defaults.getAuthor());
        manifest.put("unity", defaults.getUnity());
        manifest.put("unityRelease", defaults.getUnityRelease());
        manifest.put("keywords", new ArrayList<>(spec.getKeywords()));
        manifest.put("dependencies", new LinkedHashMap<>(spec.getDependencies()));
        manifest.put("type", "library");

        if (namespace != null) {
            manifest.put("namespace", namespace);
        }

        if (appProperties.getRegistry().isConfigured()) {
            manifest.put("publishConfig",
                    Map.of("registry", REGISTRY_URL_PREFIX + appProperties.getRegistry().getOwner()));
        }

        manifest.putAll(spec.getPackageJsonExtra());
        return manifest;
    }

    private Map<String, Object> buildModuleDefinition(PackageSpec spec, String namespace) {
        Map<String, Object> asmdef = new LinkedHashMap<>();
        asmdef.put("name", spec.effectiveAsmdefName());
        if (namespace != null) {
            asmdef.put("rootNamespace", namespace);
        }
        asmdef.put("references", new ArrayList<>(spec.getAssemblyReferences()));
        asmdef.put("includePlatforms", new ArrayList<>(spec.getIncludePlatforms()));
        asmdef.put("excludePlatforms", List.of());
        asmdef.put("allowUnsafeCode", false);
        asmdef.put("overrideReferences", false);
        asmdef.put("precompiledReferences", List.of());
        asmdef.put("autoReferenced", true);
        asmdef.put("defineConstraints", new ArrayList<>(spec.getDefineConstraints()));
        asmdef.put("versionDefines", new ArrayList<>(spec.getVersionDefines()));
        asmdef.put("noEngineReferences", false);

        asmdef.putAll(spec.getAsmdefExtra());
        return asmdef;
    }
}
