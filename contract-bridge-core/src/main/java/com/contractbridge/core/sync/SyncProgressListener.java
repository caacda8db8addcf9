package com.contractbridge.core.sync;

/**
 * Receives progress events while dependencies are synced.
 *
 * <p>For every dependency exactly one {@link SyncStatus#STARTING} event is followed by
 * exactly one {@link SyncStatus#COMPLETED} or {@link SyncStatus#FAILED} event. Events for
 * different dependencies may arrive concurrently from worker threads.
 */
@FunctionalInterface
public interface SyncProgressListener {

    SyncProgressListener NONE = (dependencyName, status) -> { };

    void onProgress(String dependencyName, SyncStatus status);
}
