package com.contractbridge.core.sync;

import java.util.Locale;

/**
 * Progress states reported for a dependency during a batch sync.
 */
public enum SyncStatus {
    STARTING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
