package com.purchasingpower.upmsync.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class GitProperties {

    /**
     * Transport timeout for ls-remote, clone and fetch.
     */
    @Min(1)
    private int timeoutSeconds = 60;
}
