package com.purchasingpower.upmsync.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of a failed package sync.
 *
 * Every kind is scoped to one package. Nothing is retried inside the engine;
 * {@link #isRetryable()} only tells the caller whether rerunning later can help
 * without changing the package definition.
 */
@Getter
@RequiredArgsConstructor
public enum SyncErrorKind {

    /** Repository unreachable, transport failure or timeout */
    SOURCE_UNAVAILABLE(true),

    /** Requested ref or commit does not exist in the repository */
    REF_NOT_FOUND(true),

    /** Extract path does not exist (or is not a directory) at the resolved commit */
    SUBTREE_MISSING(true),

    /** I/O failure while building the staged package tree */
    STAGING_IO_ERROR(true),

    /** I/O failure while swapping the staged tree into place */
    COMMIT_IO_ERROR(true),

    /** Package definition is invalid; must be fixed before rerunning */
    CONFIG_INVALID(false),

    /** Sync was cancelled between steps */
    CANCELLED(true),

    /** Unexpected runtime failure */
    INTERNAL_ERROR(false);

    private final boolean retryable;
}
