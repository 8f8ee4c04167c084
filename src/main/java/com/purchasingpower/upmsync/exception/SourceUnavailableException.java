package com.purchasingpower.upmsync.exception;

public class SourceUnavailableException extends PackageSyncException {

    public SourceUnavailableException(String message) {
        super(SyncErrorKind.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(SyncErrorKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
