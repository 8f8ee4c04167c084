package com.purchasingpower.upmsync.service.config;

import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.exception.ConfigInvalidException;
import com.purchasingpower.upmsync.model.spec.BuildPolicy;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Package Config Loader Tests")
class PackageConfigLoaderTest {

    @TempDir
    Path tempDir;

    private AppProperties properties;
    private PackageConfigLoader loader;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        loader = new PackageConfigLoader(properties);
    }

    @Test
    @DisplayName("Should load a complete package definition")
    void load_completeDefinition() throws IOException {
        // Given
        Path file = write("""
                packages:
                  - name: "com.example.wrapper.unitask"
                    display_name: "UniTask for Unity"
                    description: "Async for Unity"
                    version: "2.5.10"
                    source:
                      type: git
                      url: "https://github.com/Cysharp/UniTask.git"
                      ref: "2.5.10"
                    extract_path: "src/UniTask/Assets/Plugins/UniTask"
                    namespace: "Cysharp.Threading.Tasks"
                    asmdef_name: "UniTask"
                    keywords: ["async", "unity"]
                    dependencies:
                      "com.unity.modules.jsonserialize": "1.0.0"
                    define_constraints: ["UNITY_2019_4_OR_NEWER"]
                    package_json_extra:
                      license: "MIT"
                    asmdef_extra:
                      allowUnsafeCode: true
                    some_future_key: ignored
                """);

        // When
        LoadedPackageConfig config = loader.load(file);

        // Then
        assertThat(config.invalid()).isEmpty();
        PackageSpec spec = config.specs().get(0);
        assertThat(spec.getName()).isEqualTo("com.example.wrapper.unitask");
        assertThat(spec.getDisplayName()).isEqualTo("UniTask for Unity");
        assertThat(spec.getSource().url()).isEqualTo("https://github.com/Cysharp/UniTask.git");
        assertThat(spec.getSource().ref()).isEqualTo("2.5.10");
        assertThat(spec.getExtractPath()).isEqualTo("src/UniTask/Assets/Plugins/UniTask");
        assertThat(spec.effectiveAsmdefName()).isEqualTo("UniTask");
        assertThat(spec.getKeywords()).containsExactly("async", "unity");
        assertThat(spec.getDependencies()).containsEntry("com.unity.modules.jsonserialize", "1.0.0");
        assertThat(spec.getDefineConstraints()).containsExactly("UNITY_2019_4_OR_NEWER");
        assertThat(spec.getPackageJsonExtra()).containsEntry("license", "MIT");
        assertThat(spec.getAsmdefExtra()).containsEntry("allowUnsafeCode", true);
        assertThat(spec.getPolicy()).isEqualTo(BuildPolicy.defaults());
    }

    @Test
    @DisplayName("Should isolate an invalid entry from the valid ones")
    void load_invalidEntryIsolated() throws IOException {
        Path file = write("""
                packages:
                  - name: "com.example.good"
                    source:
                      url: "https://github.com/acme/good.git"
                  - name: "NotReverseDomain"
                    source:
                      url: "https://github.com/acme/bad.git"
                  - display_name: "nameless"
                    source:
                      url: "https://github.com/acme/nameless.git"
                  - name: "com.example.insecure"
                    source:
                      url: "http://github.com/acme/insecure.git"
                """);

        LoadedPackageConfig config = loader.load(file);

        assertThat(config.specs()).extracting(PackageSpec::getName).containsExactly("com.example.good");
        assertThat(config.invalid().keySet()).containsExactly("NotReverseDomain", "#2", "com.example.insecure");
        assertThat(config.invalid().get("com.example.insecure")).contains("Unsupported protocol");
    }

    @Test
    @DisplayName("Should reject source types other than git")
    void load_nonGitSource() throws IOException {
        Path file = write("""
                packages:
                  - name: "com.example.nuget"
                    source:
                      type: nuget
                      url: "https://www.nuget.org/api/v2/package/Foo"
                """);

        LoadedPackageConfig config = loader.load(file);

        assertThat(config.specs()).isEmpty();
        assertThat(config.invalid().get("com.example.nuget")).contains("only git is supported");
    }

    @Test
    @DisplayName("Should reject path traversal in the extract path")
    void load_extractPathTraversal() throws IOException {
        Path file = write("""
                packages:
                  - name: "com.example.escape"
                    source:
                      url: "https://github.com/acme/lib.git"
                    extract_path: "../outside"
                """);

        assertThat(loader.load(file).invalid()).containsKey("com.example.escape");
    }

    @Test
    @DisplayName("Should invalidate every entry of a duplicated name")
    void load_duplicates() throws IOException {
        Path file = write("""
                packages:
                  - name: "com.example.twice"
                    source:
                      url: "https://github.com/acme/one.git"
                  - name: "com.example.once"
                    source:
                      url: "https://github.com/acme/once.git"
                  - name: "com.example.twice"
                    source:
                      url: "https://github.com/acme/two.git"
                """);

        LoadedPackageConfig config = loader.load(file);

        assertThat(config.entries()).hasSize(3);
        assertThat(config.specs()).extracting(PackageSpec::getName).containsExactly("com.example.once");
        assertThat(config.invalid().get("com.example.twice")).contains("defined 2 times");
    }

    @Test
    @DisplayName("Should overlay per-package build switches on the global defaults")
    void load_buildPolicyOverrides() throws IOException {
        // Given
        properties.getBuild().setRemoveProjectFiles(false);
        Path file = write("""
                packages:
                  - name: "com.example.flat"
                    source:
                      url: "https://github.com/acme/flat.git"
                    build:
                      nest_under_runtime: false
                  - name: "com.example.plain"
                    source:
                      url: "https://github.com/acme/plain.git"
                """);

        // When
        List<PackageSpec> specs = loader.load(file).specs();

        // Then
        assertThat(specs.get(0).getPolicy()).isEqualTo(new BuildPolicy(false, false, true));
        assertThat(specs.get(1).getPolicy()).isEqualTo(new BuildPolicy(false, true, true));
    }

    @Test
    @DisplayName("Should pass a structured author through to package.json")
    void load_structuredAuthor() throws IOException {
        Path file = write("""
                packages:
                  - name: "com.example.authored"
                    author:
                      name: "Acme"
                      email: "dev@acme.test"
                    source:
                      url: "git@github.com:acme/authored.git"
                """);

        PackageSpec spec = loader.load(file).specs().get(0);

        assertThat(spec.getAuthor()).isNull();
        assertThat(spec.getPackageJsonExtra().get("author"))
                .isEqualTo(Map.of("name", "Acme", "email", "dev@acme.test"));
    }

    @Test
    @DisplayName("Should return an empty config when no packages are listed")
    void load_noPackages() throws IOException {
        assertThat(loader.load(write("packages:\n")).entries()).isEmpty();
    }

    @Test
    @DisplayName("Should fail the whole load for a missing or malformed file")
    void load_unreadableFile() throws IOException {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yaml")))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("not found");

        Path notAList = write("packages:\n  name: com.example.x\n");
        assertThatThrownBy(() -> loader.load(notAList))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("must be a list");

        Path broken = write("packages: [unclosed\n");
        assertThatThrownBy(() -> loader.load(broken)).isInstanceOf(ConfigInvalidException.class);
    }

    @Test
    @DisplayName("Should load the shipped packages file")
    void load_shippedConfig() {
        LoadedPackageConfig config = loader.load(Path.of("config", "packages.yaml"));

        assertThat(config.invalid()).isEmpty();
        assertThat(config.specs()).extracting(PackageSpec::getName)
                .containsExactly("com.klumhru.wrapper.google-protobuf", "com.klumhru.wrapper.unitask");
    }

    private Path write(String yaml) throws IOException {
        Path file = Files.createTempFile(tempDir, "packages", ".yaml");
        return Files.writeString(file, yaml);
    }
}
