package com.purchasingpower.upmsync.configuration;

import lombok.Data;

@Data
public class RegistryProperties {

    /**
     * GitHub Packages owner. When set, every manifest gets a
     * {@code publishConfig.registry} pointing at {@code https://npm.pkg.github.com/@owner}.
     */
    private String owner;

    public boolean isConfigured() {
        return owner != null && !owner.isBlank();
    }
}
