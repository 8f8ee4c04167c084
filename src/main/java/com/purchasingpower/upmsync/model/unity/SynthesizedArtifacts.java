package com.purchasingpower.upmsync.model.unity;

public record SynthesizedArtifacts(
        ManifestArtifact manifest,
        ModuleDefinitionArtifact moduleDefinition
) {
}
