package com.purchasingpower.upmsync.exception;

public class ConfigInvalidException extends PackageSyncException {

    public ConfigInvalidException(String message) {
        super(SyncErrorKind.CONFIG_INVALID, message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(SyncErrorKind.CONFIG_INVALID, message, cause);
    }
}
