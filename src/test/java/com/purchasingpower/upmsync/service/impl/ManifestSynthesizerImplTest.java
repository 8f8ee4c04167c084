package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.model.unity.PackageLayout;
import com.purchasingpower.upmsync.model.unity.SynthesizedArtifacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Manifest Synthesizer Tests")
class ManifestSynthesizerImplTest {

    private static final PackageLayout RUNTIME = new PackageLayout("Runtime", "Runtime");

    private AppProperties properties;
    private ManifestSynthesizerImpl synthesizer;
    private PackageSpec spec;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        synthesizer = new ManifestSynthesizerImpl(properties);
        spec = PackageSpec.builder()
                .name("com.example.wrapper.unitask")
                .displayName("UniTask for Unity")
                .description("Async for Unity")
                .version("2.5.10")
                .source(new SourceLocator("https://github.com/Cysharp/UniTask.git", "2.5.10"))
                .keyword("async")
                .dependency("com.unity.modules.jsonserialize", "1.0.0")
                .build();
    }

    @Test
    @DisplayName("Should compute manifest defaults in Unity field order")
    void synthesize_manifestDefaults() {
        // When
        SynthesizedArtifacts artifacts = synthesizer.synthesize(spec, null, RUNTIME);

        // Then
        Map<String, Object> manifest = artifacts.manifest().content();
        assertThat(artifacts.manifest().relativePath()).isEqualTo("package.json");
        assertThat(manifest.keySet()).containsExactly("name", "displayName", "version", "description", "author",
                "unity", "unityRelease", "keywords", "dependencies", "type");
        assertThat(manifest.get("unity")).isEqualTo("2019.4");
        assertThat(manifest.get("unityRelease")).isEqualTo("0f1");
        assertThat(manifest.get("type")).isEqualTo("library");
        assertThat(manifest.get("keywords")).isEqualTo(List.of("async"));
        assertThat(manifest.get("dependencies")).isEqualTo(Map.of("com.unity.modules.jsonserialize", "1.0.0"));
    }

    @Test
    @DisplayName("Should place the module definition under the content root with a derived name")
    void synthesize_moduleDefinition() {
        SynthesizedArtifacts artifacts = synthesizer.synthesize(spec, "Cysharp.Threading.Tasks", RUNTIME);

        Map<String, Object> asmdef = artifacts.moduleDefinition().content();
        assertThat(artifacts.moduleDefinition().relativePath())
                .isEqualTo("Runtime/com_example_wrapper_unitask.asmdef");
        assertThat(asmdef.get("name")).isEqualTo("com_example_wrapper_unitask");
        assertThat(asmdef.get("rootNamespace")).isEqualTo("Cysharp.Threading.Tasks");
        assertThat(asmdef.get("autoReferenced")).isEqualTo(true);
        assertThat(asmdef.get("allowUnsafeCode")).isEqualTo(false);
    }

    @Test
    @DisplayName("Should omit the namespace when none is known")
    void synthesize_noNamespace() {
        SynthesizedArtifacts artifacts = synthesizer.synthesize(spec, null, new PackageLayout("", ""));

        assertThat(artifacts.manifest().content()).doesNotContainKey("namespace");
        assertThat(artifacts.moduleDefinition().content()).doesNotContainKey("rootNamespace");
        assertThat(artifacts.moduleDefinition().relativePath()).isEqualTo("com_example_wrapper_unitask.asmdef");
    }

    @Test
    @DisplayName("Should prefer an explicit namespace over a discovered one")
    void synthesize_explicitNamespaceWins() {
        PackageSpec explicit = spec.toBuilder().namespace("Acme.Explicit").build();

        SynthesizedArtifacts artifacts = synthesizer.synthesize(explicit, "Acme.Discovered", RUNTIME);

        assertThat(artifacts.manifest().content().get("namespace")).isEqualTo("Acme.Explicit");
        assertThat(artifacts.moduleDefinition().content().get("rootNamespace")).isEqualTo("Acme.Explicit");
    }

    @Test
    @DisplayName("Should add publishConfig for a configured registry owner and let extras override it")
    void synthesize_registryAndExtras() {
        // Given
        properties.getRegistry().setOwner("klumhru");
        PackageSpec withExtras = spec.toBuilder()
                .packageJsonField("license", "MIT")
                .packageJsonField("unity", "2021.3")
                .asmdefField("allowUnsafeCode", true)
                .build();

        // When
        SynthesizedArtifacts artifacts = synthesizer.synthesize(withExtras, null, RUNTIME);

        // Then
        Map<String, Object> manifest = artifacts.manifest().content();
        assertThat(manifest.get("publishConfig")).isEqualTo(Map.of("registry", "https://npm.pkg.github.com/@klumhru"));
        assertThat(manifest.get("license")).isEqualTo("MIT");
        assertThat(manifest.get("unity")).isEqualTo("2021.3");
        assertThat(artifacts.moduleDefinition().content().get("allowUnsafeCode")).isEqualTo(true);
    }

    @Test
    @DisplayName("Should return equal artifacts for equal inputs")
    void synthesize_pure() {
        assertThat(synthesizer.synthesize(spec, "Acme", RUNTIME)).isEqualTo(synthesizer.synthesize(spec, "Acme", RUNTIME));
    }
}
