package com.purchasingpower.upmsync.model.sync;

/**
 * One package-relative entry compared between the previous and the staged tree.
 * Identity sidecars are implied: a DELETE removes the entry together with its .meta.
 */
public record ReconciledEntry(
        String path,
        boolean directory,
        ChangeType changeType
) {

    public enum ChangeType {
        /** Not present in the previous tree */
        ADD,

        /** File content differs from the previous tree */
        MODIFY,

        /** Present in both with identical content */
        UNCHANGED,

        /** Present only in the previous tree */
        DELETE
    }
}
