package com.purchasingpower.upmsync.exception;

public class RefNotFoundException extends PackageSyncException {

    public RefNotFoundException(String message) {
        super(SyncErrorKind.REF_NOT_FOUND, message);
    }

    public RefNotFoundException(String message, Throwable cause) {
        super(SyncErrorKind.REF_NOT_FOUND, message, cause);
    }
}
