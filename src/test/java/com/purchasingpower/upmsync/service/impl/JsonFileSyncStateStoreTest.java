package com.purchasingpower.upmsync.service.impl;

import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.model.sync.SyncOutcome;
import com.purchasingpower.upmsync.model.sync.SyncState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JSON File Sync State Store Tests")
class JsonFileSyncStateStoreTest {

    @TempDir
    Path tempDir;

    private AppProperties properties;
    private Path stateFile;

    @BeforeEach
    void setUp() {
        stateFile = tempDir.resolve("state").resolve("sync-state.json");
        properties = new AppProperties();
        properties.setStateFile(stateFile.toString());
    }

    @Test
    @DisplayName("Should report no state before anything was recorded")
    void get_empty() {
        JsonFileSyncStateStore store = new JsonFileSyncStateStore(properties);

        assertThat(store.get("com.example.pkg")).isEmpty();
        assertThat(store.all()).isEmpty();
        assertThat(stateFile).doesNotExist();
    }

    @Test
    @DisplayName("Should persist state across store instances")
    void put_survivesReload() {
        // Given
        SyncState state = state("com.example.pkg", "0123456789abcdef0123456789abcdef01234567");
        new JsonFileSyncStateStore(properties).put("com.example.pkg", state);

        // When
        JsonFileSyncStateStore reloaded = new JsonFileSyncStateStore(properties);

        // Then
        assertThat(reloaded.get("com.example.pkg")).contains(state);
        assertThat(stateFile).exists();
    }

    @Test
    @DisplayName("Should keep other packages when one is updated")
    void put_keepsOthers() {
        JsonFileSyncStateStore store = new JsonFileSyncStateStore(properties);
        store.put("com.example.b", state("com.example.b", "b".repeat(40)));
        store.put("com.example.a", state("com.example.a", "a".repeat(40)));
        store.put("com.example.b", state("com.example.b", "c".repeat(40)));

        assertThat(store.all().keySet()).containsExactly("com.example.a", "com.example.b");
        assertThat(store.get("com.example.b").orElseThrow().getLastRef()).isEqualTo("c".repeat(40));
        assertThat(tempDir.resolve("state").toFile().list()).containsExactly("sync-state.json");
    }

    @Test
    @DisplayName("Should fail loudly on a corrupt state file")
    void get_corruptFile() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, "{ not json");

        JsonFileSyncStateStore store = new JsonFileSyncStateStore(properties);

        assertThatThrownBy(() -> store.get("com.example.pkg")).isInstanceOf(UncheckedIOException.class);
    }

    private static SyncState state(String name, String ref) {
        return SyncState.builder()
                .packageName(name)
                .lastRef(ref)
                .requestedRef("v1.0")
                .lastSyncAt(Instant.parse("2026-01-15T10:00:00Z"))
                .lastOutcome(SyncOutcome.BUILT)
                .build();
    }
}
