package com.purchasingpower.upmsync.exception;

import lombok.Getter;

/**
 * Base class of every classified sync failure.
 */
@Getter
public class PackageSyncException extends RuntimeException {

    private final SyncErrorKind kind;

    public PackageSyncException(SyncErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PackageSyncException(SyncErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
