package com.purchasingpower.upmsync.api;

import com.purchasingpower.upmsync.exception.ConfigInvalidException;
import com.purchasingpower.upmsync.exception.SyncErrorKind;
import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.spec.SourceLocator;
import com.purchasingpower.upmsync.model.sync.SyncOutcome;
import com.purchasingpower.upmsync.model.sync.SyncResult;
import com.purchasingpower.upmsync.model.sync.SyncRunReport;
import com.purchasingpower.upmsync.model.sync.SyncState;
import com.purchasingpower.upmsync.queue.SyncRequestQueue;
import com.purchasingpower.upmsync.service.PackageSyncService;
import com.purchasingpower.upmsync.service.SyncStateStore;
import com.purchasingpower.upmsync.service.config.LoadedPackageConfig;
import com.purchasingpower.upmsync.service.config.PackageConfigLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PackageSyncController.class)
@DisplayName("Package Sync Controller Tests")
class PackageSyncControllerTest {

    private static final String COMMIT = "0123456789abcdef0123456789abcdef01234567";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PackageSyncService packageSyncService;

    @MockBean
    private PackageConfigLoader configLoader;

    @MockBean
    private SyncStateStore stateStore;

    @MockBean
    private SyncRequestQueue syncRequestQueue;

    @Test
    @DisplayName("Should list valid and invalid packages with their state")
    void listPackages() throws Exception {
        // Given
        PackageSpec spec = PackageSpec.builder()
                .name("com.example.lib")
                .source(new SourceLocator("https://github.com/acme/lib.git", "v1.0"))
                .build();
        when(configLoader.load()).thenReturn(new LoadedPackageConfig(List.of(
                LoadedPackageConfig.Entry.valid(spec),
                LoadedPackageConfig.Entry.invalid("#1", "Package name must be lowercase"))));
        when(stateStore.get("com.example.lib")).thenReturn(Optional.of(state()));

        // When / Then
        mockMvc.perform(get("/api/v1/packages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("com.example.lib"))
                .andExpect(jsonPath("$[0].valid").value(true))
                .andExpect(jsonPath("$[0].requestedRef").value("v1.0"))
                .andExpect(jsonPath("$[0].state.lastRef").value(COMMIT))
                .andExpect(jsonPath("$[1].name").value("#1"))
                .andExpect(jsonPath("$[1].valid").value(false));
    }

    @Test
    @DisplayName("Should answer 400 when the packages file is unusable")
    void listPackages_configInvalid() throws Exception {
        when(configLoader.load()).thenThrow(new ConfigInvalidException("Packages file not found: x"));

        mockMvc.perform(get("/api/v1/packages"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should report partial success of a full run")
    void syncAll() throws Exception {
        // Given
        SyncResult built = SyncResult.builder()
                .packageName("com.example.lib")
                .outcome(SyncOutcome.BUILT)
                .resolvedRef(COMMIT)
                .build();
        SyncResult failed = SyncResult.failed("com.example.bad", "v9", SyncErrorKind.REF_NOT_FOUND, "no such ref", 3);
        when(packageSyncService.syncConfigured(true)).thenReturn(new SyncRunReport(List.of(built, failed), 42));

        // When / Then
        mockMvc.perform(post("/api/v1/packages/sync").param("force", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.results.length()").value(2))
                .andExpect(jsonPath("$.results[1].errorKind").value("REF_NOT_FOUND"))
                .andExpect(jsonPath("$.durationMs").value(42));
    }

    @Test
    @DisplayName("Should sync one package and answer 404 for unknown names")
    void syncPackage() throws Exception {
        SyncResult skipped = SyncResult.builder()
                .packageName("com.example.lib")
                .outcome(SyncOutcome.SKIPPED)
                .resolvedRef(COMMIT)
                .build();
        when(packageSyncService.syncConfigured("com.example.lib", false)).thenReturn(Optional.of(skipped));
        when(packageSyncService.syncConfigured("com.example.unknown", false)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/packages/com.example.lib/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.results[0].outcome").value("SKIPPED"));

        mockMvc.perform(post("/api/v1/packages/com.example.unknown/sync"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should accept queued sync requests")
    void enqueue() throws Exception {
        when(syncRequestQueue.enqueue("com.example.lib", true)).thenReturn(true);
        when(syncRequestQueue.size()).thenReturn(1);

        mockMvc.perform(post("/api/v1/packages/com.example.lib/enqueue").param("force", "true"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.queued").value(true))
                .andExpect(jsonPath("$.pending").value(1));

        verify(syncRequestQueue).enqueue("com.example.lib", true);
    }

    @Test
    @DisplayName("Should return recorded state or 404")
    void getState() throws Exception {
        when(stateStore.get("com.example.lib")).thenReturn(Optional.of(state()));
        when(stateStore.get("com.example.none")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/packages/com.example.lib/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastRef").value(COMMIT))
                .andExpect(jsonPath("$.lastOutcome").value("BUILT"));

        mockMvc.perform(get("/api/v1/packages/com.example.none/state"))
                .andExpect(status().isNotFound());
    }

    private static SyncState state() {
        return SyncState.builder()
                .packageName("com.example.lib")
                .lastRef(COMMIT)
                .requestedRef("v1.0")
                .lastSyncAt(Instant.parse("2026-01-15T10:00:00Z"))
                .lastOutcome(SyncOutcome.BUILT)
                .build();
    }
}
