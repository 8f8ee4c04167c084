package com.purchasingpower.upmsync.service.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of {@code packages.yaml}, as written by hand.
 *
 * Example:
 * <pre>
 * - name: "com.klumhru.wrapper.unitask"
 *   display_name: "UniTask for Unity"
 *   version: "2.5.10-1"
 *   source:
 *     type: git
 *     url: "https://github.com/Cysharp/UniTask.git"
 *     ref: "2.5.10"
 *   extract_path: "src/UniTask/Assets/Plugins/UniTask"
 *   namespace: "Cysharp.Threading.Tasks"
 * </pre>
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PackageDefinition {

    private String name;
    private String displayName;
    private String description;
    private String version;

    /** A plain string, or an object copied verbatim into package.json */
    private Object author;

    private Source source;
    private String extractPath;
    private String namespace;
    private String asmdefName;

    private Map<String, String> dependencies = new LinkedHashMap<>();
    private List<String> keywords = new ArrayList<>();
    private List<String> assemblyReferences = new ArrayList<>();
    private List<String> defineConstraints = new ArrayList<>();
    private List<Map<String, String>> versionDefines = new ArrayList<>();
    private List<String> platforms = new ArrayList<>();

    private Map<String, Object> packageJsonExtra = new LinkedHashMap<>();
    private Map<String, Object> asmdefExtra = new LinkedHashMap<>();

    private String identitySeed;

    private Build build;

    @Data
    @NoArgsConstructor
    public static class Source {
        private String type;
        private String url;
        private String ref;
    }

    /**
     * Per-package overrides of {@code app.build.*}; null keeps the global value.
     */
    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Build {
        private Boolean removeProjectFiles;
        private Boolean nestUnderRuntime;
        private Boolean generateIdentityRecords;
    }
}
