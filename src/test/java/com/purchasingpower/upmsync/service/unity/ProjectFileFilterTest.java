package com.purchasingpower.upmsync.service.unity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Project File Filter Tests")
class ProjectFileFilterTest {

    @ParameterizedTest
    @ValueSource(strings = {"Lib.csproj", "Lib.sln", "native/Lib.vcxproj.filters", ".vs/config.json",
            "sub/.idea/workspace.xml", "Properties/AssemblyInfo.cs", ".gitignore", "Directory.Build.props",
            "README.md", "LICENSE", "app.config"})
    @DisplayName("Should recognize project housekeeping files")
    void projectFiles(String path) {
        assertTrue(ProjectFileFilter.isProjectFile(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Foo.cs", "Sub/Bar.cs", "data.json", "docs/Guide.md", "Runtime/Acme.asmdef"})
    @DisplayName("Should keep package content")
    void contentFiles(String path) {
        assertFalse(ProjectFileFilter.isProjectFile(path));
    }
}
