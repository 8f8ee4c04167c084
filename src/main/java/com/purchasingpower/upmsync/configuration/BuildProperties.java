package com.purchasingpower.upmsync.configuration;

import lombok.Data;

/**
 * Global build policy defaults. Each package definition may override any of them.
 */
@Data
public class BuildProperties {

    private boolean removeProjectFiles = true;

    private boolean nestUnderRuntime = true;

    private boolean generateIdentityRecords = true;
}
