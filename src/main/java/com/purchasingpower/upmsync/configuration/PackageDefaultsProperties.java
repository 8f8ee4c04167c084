package com.purchasingpower.upmsync.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Values used in package.json when a package definition leaves them out.
 */
@Data
public class PackageDefaultsProperties {

    private String author = "";

    @NotBlank
    private String unity = "2019.4";

    @NotBlank
    private String unityRelease = "0f1";
}
