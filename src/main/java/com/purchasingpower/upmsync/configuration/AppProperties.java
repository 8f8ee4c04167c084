package com.purchasingpower.upmsync.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /**
     * Directory holding one committed package tree per package name.
     */
    @NotBlank(message = "Output directory path is required")
    private String outputDir;

    /**
     * Base directory for ephemeral extraction workspaces.
     */
    @NotBlank(message = "Workspace directory path is required")
    private String workspaceDir;

    @NotBlank(message = "Sync state file path is required")
    private String stateFile;

    @NotBlank(message = "Packages file path is required")
    private String packagesFile;

    private boolean syncOnStartup = false;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PackageDefaultsProperties defaults = new PackageDefaultsProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RegistryProperties registry = new RegistryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private BuildProperties build = new BuildProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitProperties git = new GitProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private QueueProperties queue = new QueueProperties();
}
