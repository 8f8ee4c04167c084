package com.purchasingpower.upmsync.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.upmsync.configuration.AppProperties;
import com.purchasingpower.upmsync.model.sync.SyncState;
import com.purchasingpower.upmsync.service.SyncStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link SyncStateStore} backed by one JSON file, rewritten through a temp file
 * and an atomic rename on every update.
 */
@Slf4j
@Service
public class JsonFileSyncStateStore implements SyncStateStore {

    private static final TypeReference<TreeMap<String, SyncState>> STATE_TYPE = new TypeReference<>() {
    };

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private TreeMap<String, SyncState> states;

    public JsonFileSyncStateStore(AppProperties appProperties) {
        this.stateFile = Paths.get(appProperties.getStateFile());
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized Optional<SyncState> get(String packageName) {
        return Optional.ofNullable(load().get(packageName));
    }

    @Override
    public synchronized void put(String packageName, SyncState state) {
        TreeMap<String, SyncState> updated = new TreeMap<>(load());
        updated.put(packageName, state);

        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, stateFile.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), updated);
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write sync state " + stateFile, e);
        }

        states = updated;
        log.debug("Recorded state of {}: {}", packageName, state.getLastRef());
    }

    @Override
    public synchronized Map<String, SyncState> all() {
        return Collections.unmodifiableMap(new TreeMap<>(load()));
    }

    private TreeMap<String, SyncState> load() {
        if (states != null) {
            return states;
        }
        if (!Files.exists(stateFile)) {
            states = new TreeMap<>();
            return states;
        }
        try {
            TreeMap<String, SyncState> loaded = objectMapper.readValue(stateFile.toFile(), STATE_TYPE);
            states = loaded != null ? loaded : new TreeMap<>();
            log.info("Loaded sync state of {} packages from {}", states.size(), stateFile);
            return states;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sync state " + stateFile, e);
        }
    }
}
