package com.devflow.syncclient.sync;

import java.time.Instant;

/**
 * Snapshot of the synchronization state.
 *
 * @param lastSyncTime null until {@link SyncCoordinator#updateLastSyncTime()} is called
 */
public record ConnectionStatus(boolean isConnected, boolean isOnline, int queueSize,
                               int subscriptionCount, Instant lastSyncTime) {
}
