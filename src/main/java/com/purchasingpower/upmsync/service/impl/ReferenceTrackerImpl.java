package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.ResolvedRef;
import com.purchasingpower.upmsync.model.sync.SyncDecision;
import com.purchasingpower.upmsync.model.sync.SyncState;
import com.purchasingpower.upmsync.service.ReferenceTracker;
import com.purchasingpower.upmsync.service.git.VersionControlBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceTrackerImpl implements ReferenceTracker {

    private final VersionControlBackend backend;

    @Override
    public SyncDecision needsSync(PackageSpec spec, Optional<SyncState> previous, boolean force) {
        String requested = spec.getSource().ref();
        if (requested == null || requested.isBlank()) {
            requested = DEFAULT_REF;
        }

        ResolvedRef resolved = backend.resolveRef(spec.getSource(), requested);
        String lastRef = previous.map(SyncState::getLastRef).orElse(null);

        if (force) {
            log.info("{}: forced rebuild at {}", spec.getName(), resolved.shortId());
            return SyncDecision.proceed(resolved, "forced");
        }
        if (lastRef == null) {
            log.info("{}: no previous sync, building {}", spec.getName(), resolved.shortId());
            return SyncDecision.proceed(resolved, "never synced");
        }
        if (lastRef.equalsIgnoreCase(resolved.commitId())) {
            log.info("{}: unchanged at {}, skipping", spec.getName(), resolved.shortId());
            return SyncDecision.skip(resolved);
        }

        log.info("{}: ref moved {} -> {}", spec.getName(),
                lastRef.length() > 8 ? lastRef.substring(0, 8) : lastRef, resolved.shortId());
        return SyncDecision.proceed(resolved, "ref changed from " + lastRef);
    }
}
