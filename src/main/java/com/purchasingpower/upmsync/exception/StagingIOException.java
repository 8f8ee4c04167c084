package com.purchasingpower.upmsync.exception;

public class StagingIOException extends PackageSyncException {

    public StagingIOException(String message) {
        super(SyncErrorKind.STAGING_IO_ERROR, message);
    }

    public StagingIOException(String message, Throwable cause) {
        super(SyncErrorKind.STAGING_IO_ERROR, message, cause);
    }
}
