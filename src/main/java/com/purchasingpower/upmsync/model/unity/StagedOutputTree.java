package com.purchasingpower.upmsync.model.unity;

import com.purchasingpower.upmsync.model.sync.ReconciledEntry;
import com.purchasingpower.upmsync.model.sync.ReconciledEntry.ChangeType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A fully built package tree waiting to be committed.
 */
@Value
@Builder
public class StagedOutputTree {

    /** Root of the staged tree, on the same filesystem as the durable output */
    Path root;

    @Singular
    List<ReconciledEntry> entries;

    /** Identity per package-relative path; the root is keyed by "" */
    @Singular
    Map<String, IdentityToken> identities;

    int fileCount;

    int directoryCount;

    public long count(ChangeType changeType) {
        return entries.stream().filter(e -> e.changeType() == changeType).count();
    }
}
