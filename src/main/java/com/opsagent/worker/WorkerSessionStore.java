package com.opsagent.worker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsagent.config.DispatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Incident sessions known to this worker, persisted as a JSON file after every change. Write
 * failures are logged; the in-memory view stays authoritative.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "dispatch.worker", name = "enabled", havingValue = "true")
public class WorkerSessionStore {

    private static final TypeReference<List<WorkerSession>> SESSION_LIST = new TypeReference<>() {
    };

    private final Path storePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, WorkerSession> sessions = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public WorkerSessionStore(DispatchProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(properties.getWorker().getSessionsFile()), objectMapper, clock);
    }

    WorkerSessionStore(Path storePath, ObjectMapper objectMapper, Clock clock) {
        this.storePath = storePath.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
        load();
    }

    public Optional<WorkerSession> get(String incidentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(incidentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public WorkerSession create(String incidentId) {
        WorkerSession session = WorkerSession.pending(incidentId, clock.instant());
        lock.writeLock().lock();
        try {
            sessions.put(incidentId, session);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        return session;
    }

    public void setRunning(String incidentId, String sessionId) {
        update(incidentId, session -> session.running(sessionId, clock.instant()));
    }

    public void setCompleted(String incidentId, String sessionId, String response, String fullLog) {
        update(incidentId, session -> session.completed(sessionId, response, fullLog, clock.instant()));
    }

    public void setFailed(String incidentId, String error) {
        update(incidentId, session -> session.failed(error, clock.instant()));
    }

    public void delete(String incidentId) {
        lock.writeLock().lock();
        try {
            if (sessions.remove(incidentId) != null) {
                persist();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<WorkerSession> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(sessions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void update(String incidentId, UnaryOperator<WorkerSession> change) {
        lock.writeLock().lock();
        try {
            WorkerSession current = sessions.get(incidentId);
            if (current == null) {
                current = WorkerSession.pending(incidentId, clock.instant());
            }
            sessions.put(incidentId, change.apply(current));
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void load() {
        if (!Files.exists(storePath)) {
            return;
        }
        try {
            List<WorkerSession> stored = objectMapper.readValue(storePath.toFile(), SESSION_LIST);
            stored.forEach(session -> sessions.put(session.incidentId(), session));
            log.info("Loaded {} worker sessions from {}", sessions.size(), storePath);
        } catch (IOException ex) {
            log.warn("Failed to load worker sessions from {}: {}", storePath, ex.getMessage());
        }
    }

    // caller holds the write lock
    private void persist() {
        try {
            Path parent = storePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(temp.toFile(), new ArrayList<>(sessions.values()));
            Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            log.warn("Failed to persist worker sessions to {}: {}", storePath, ex.getMessage());
        }
    }
}
