package com.purchasingpower.upmsync.exception;

public class CommitIOException extends PackageSyncException {

    public CommitIOException(String message) {
        super(SyncErrorKind.COMMIT_IO_ERROR, message);
    }

    public CommitIOException(String message, Throwable cause) {
        super(SyncErrorKind.COMMIT_IO_ERROR, message, cause);
    }
}
