package com.example.hostmonitor.persistence;

import com.example.hostmonitor.config.MonitorProperties;
import com.example.hostmonitor.domain.AlertRule;
import com.example.hostmonitor.domain.Baseline;
import com.example.hostmonitor.domain.Incident;
import com.example.hostmonitor.error.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;

/**
 * Whole-file JSON snapshots of rules, incidents and baselines.
 * <p>
 * Each collection lives in its own file under the data directory, keyed by id
 * (or metric name for baselines). Writes go to a temporary sibling first and
 * are renamed over the target, so a crash mid-write leaves the previous
 * snapshot intact.
 */
@Slf4j
@Repository
public class SnapshotRepository {

    static final String RULES_FILE = "rules.json";
    static final String INCIDENTS_FILE = "incidents.json";
    static final String BASELINES_FILE = "baselines.json";

    private final ObjectMapper objectMapper;
    private final Path dataDir;

    @Autowired
    public SnapshotRepository(ObjectMapper objectMapper, MonitorProperties properties) {
        this(objectMapper, Paths.get(properties.getPersistence().getDataDir()));
    }

    public SnapshotRepository(ObjectMapper objectMapper, Path dataDir) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
    }

    public Map<String, AlertRule> loadRules() {
        return read(RULES_FILE, new TypeReference<Map<String, AlertRule>>() {});
    }

    public void saveRules(Map<String, AlertRule> rules) {
        write(RULES_FILE, rules);
    }

    public Map<String, Incident> loadIncidents() {
        return read(INCIDENTS_FILE, new TypeReference<Map<String, Incident>>() {});
    }

    public void saveIncidents(Map<String, Incident> incidents) {
        write(INCIDENTS_FILE, incidents);
    }

    public Map<String, Baseline> loadBaselines() {
        return read(BASELINES_FILE, new TypeReference<Map<String, Baseline>>() {});
    }

    public void saveBaselines(Map<String, Baseline> baselines) {
        write(BASELINES_FILE, baselines);
    }

    public Path getDataDir() {
        return dataDir;
    }

    private <T> Map<String, T> read(String fileName, TypeReference<Map<String, T>> type) {
        Path file = dataDir.resolve(fileName);
        if (!Files.exists(file)) {
            log.debug("No snapshot at {}", file);
            return Collections.emptyMap();
        }
        try {
            Map<String, T> loaded = objectMapper.readValue(file.toFile(), type);
            return loaded != null ? loaded : Collections.emptyMap();
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }

    private void write(String fileName, Object value) {
        Path file = dataDir.resolve(fileName);
        Path tmp = dataDir.resolve(fileName + ".tmp");
        try {
            Files.createDirectories(dataDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote snapshot {}", file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + file, e);
        }
    }
}
