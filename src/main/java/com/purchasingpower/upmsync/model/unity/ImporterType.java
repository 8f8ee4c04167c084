package com.purchasingpower.upmsync.model.unity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Map;

/**
 * Unity asset importer written into a .meta file, chosen by file extension.
 */
@Getter
@RequiredArgsConstructor
public enum ImporterType {

    MONO("MonoImporter"),
    ASSEMBLY_DEFINITION("AssemblyDefinitionImporter"),
    ASSEMBLY_DEFINITION_REFERENCE("AssemblyDefinitionReferenceImporter"),
    TEXT_SCRIPT("TextScriptImporter"),
    DEFAULT("DefaultImporter");

    private static final Map<String, ImporterType> BY_EXTENSION = Map.ofEntries(
            Map.entry(".cs", MONO),
            Map.entry(".asmdef", ASSEMBLY_DEFINITION),
            Map.entry(".asmref", ASSEMBLY_DEFINITION_REFERENCE),
            Map.entry(".json", TEXT_SCRIPT),
            Map.entry(".txt", TEXT_SCRIPT),
            Map.entry(".md", TEXT_SCRIPT),
            Map.entry(".xml", TEXT_SCRIPT),
            Map.entry(".yaml", TEXT_SCRIPT),
            Map.entry(".yml", TEXT_SCRIPT),
            Map.entry(".bytes", TEXT_SCRIPT),
            Map.entry(".html", TEXT_SCRIPT),
            Map.entry(".csv", TEXT_SCRIPT)
    );

    private final String unityName;

    public static ImporterType forFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT;
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, DEFAULT);
    }
}
