package com.purchasingpower.upmsync.api;

import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.model.sync.SyncState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One configured package with what is known about it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageStatus {

    private String name;
    private boolean valid;
    private String error;
    private String sourceUrl;
    private String requestedRef;

    /** Last committed state; null when never built */
    private SyncState state;

    /** Last attempt since startup; null when none */
    private SyncResult lastResult;
}
