package com.purchasingpower.upmsync.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending sync requests by package name, in arrival order.
 *
 * Requesting a package that is already pending does not queue it twice; a
 * forced request upgrades a pending unforced one.
 */
@Slf4j
@Component
public class SyncRequestQueue {

    public record SyncRequest(String packageName, boolean force) {
    }

    private final Map<String, Boolean> pending = new LinkedHashMap<>();

    /**
     * @return true when the package was not pending yet
     */
    public synchronized boolean enqueue(String packageName, boolean force) {
        Boolean existing = pending.get(packageName);
        if (existing != null) {
            if (force && !existing) {
                pending.put(packageName, true);
            }
            log.debug("{} already pending", packageName);
            return false;
        }
        pending.put(packageName, force);
        log.info("Queued sync of {} (force={})", packageName, force);
        return true;
    }

    /**
     * Removes and returns everything pending.
     */
    public synchronized List<SyncRequest> drain() {
        List<SyncRequest> requests = new ArrayList<>(pending.size());
        pending.forEach((name, force) -> requests.add(new SyncRequest(name, force)));
        pending.clear();
        return requests;
    }

    public synchronized int size() {
        return pending.size();
    }
}
