package com.purchasingpower.upmsync.queue;

import com.purchasingpower.upmsync.model.sync.SyncOutcome;
import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.service.PackageSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Queued Sync Worker Tests")
class QueuedSyncWorkerTest {

    @Mock
    private PackageSyncService packageSyncService;

    @Test
    @DisplayName("Should sync every drained request and keep going after a failure")
    void drain_syncsEachRequest() {
        // Given
        SyncRequestQueue queue = new SyncRequestQueue();
        queue.enqueue("com.example.broken", false);
        queue.enqueue("com.example.lib", true);
        when(packageSyncService.syncConfigured("com.example.broken", false))
                .thenThrow(new IllegalStateException("boom"));
        when(packageSyncService.syncConfigured("com.example.lib", true)).thenReturn(Optional.of(
                SyncResult.builder().packageName("com.example.lib").outcome(SyncOutcome.BUILT).build()));

        // When
        new QueuedSyncWorker(queue, packageSyncService).drain();

        // Then
        verify(packageSyncService).syncConfigured("com.example.lib", true);
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Should do nothing when the queue is empty")
    void drain_empty() {
        new QueuedSyncWorker(new SyncRequestQueue(), packageSyncService).drain();

        verify(packageSyncService, never()).syncConfigured(anyString(), anyBoolean());
    }
}
