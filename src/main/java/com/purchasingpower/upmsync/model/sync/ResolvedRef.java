package com.purchasingpower.upmsync.model.sync;

/**
 * A ref resolved to an immutable commit id.
 *
 * @param requestedRef ref as written in the package definition
 * @param refName      full ref name it matched (e.g. {@code refs/tags/v1.0}), null for a raw commit id
 * @param commitId     full hex commit id
 */
public record ResolvedRef(
        String requestedRef,
        String refName,
        String commitId
) {

    public String shortId() {
        return commitId.length() > 8 ? commitId.substring(0, 8) : commitId;
    }
}
