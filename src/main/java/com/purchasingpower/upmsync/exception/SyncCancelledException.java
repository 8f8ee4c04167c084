package com.purchasingpower.upmsync.exception;

public class SyncCancelledException extends PackageSyncException {

    public SyncCancelledException(String packageName, String step) {
        super(SyncErrorKind.CANCELLED, "Sync of '" + packageName + "' cancelled before " + step);
    }
}
