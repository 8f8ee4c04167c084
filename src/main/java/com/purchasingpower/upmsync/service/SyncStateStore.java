package com.purchasingpower.upmsync.service;

import com.purchasingpower.upmsync.model.sync.SyncState;

import java.util.Map;
import java.util.Optional;

/**
 * Durable record of the last successful sync per package.
 */
public interface SyncStateStore {

    Optional<SyncState> get(String packageName);

    /**
     * Records the state of a package. Durable when this returns.
     */
    void put(String packageName, SyncState state);

    /**
     * Snapshot of every recorded package.
     */
    Map<String, SyncState> all();
}
