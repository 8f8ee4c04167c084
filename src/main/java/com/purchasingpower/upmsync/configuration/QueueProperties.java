package com.purchasingpower.upmsync.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class QueueProperties {

    @Min(100)
    private long drainIntervalMs = 5000;
}
