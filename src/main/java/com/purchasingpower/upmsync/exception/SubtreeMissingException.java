package com.purchasingpower.upmsync.exception;

public class SubtreeMissingException extends PackageSyncException {

    public SubtreeMissingException(String message) {
        super(SyncErrorKind.SUBTREE_MISSING, message);
    }

    public SubtreeMissingException(String message, Throwable cause) {
        super(SyncErrorKind.SUBTREE_MISSING, message, cause);
    }
}
