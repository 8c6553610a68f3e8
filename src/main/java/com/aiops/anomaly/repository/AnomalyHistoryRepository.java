package com.aiops.anomaly.repository;

import com.aiops.anomaly.config.DetectionConfig;
import com.aiops.anomaly.config.MetricsConfig;
import com.aiops.anomaly.model.AnomalyRecord;
import com.aiops.anomaly.model.AnomalyStats;
import com.aiops.anomaly.model.ServiceStats;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded in-memory anomaly history, mirrored to a JSON snapshot file.
 *
 * Appends evict the oldest records once capacity is reached and rewrite the whole snapshot
 * under the write lock. Readers copy under the read lock and work on the copy.
 * Snapshot IO failures are logged; the in-memory history stays authoritative.
 */
@Repository
public class AnomalyHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyHistoryRepository.class);

    private static final Duration RECENT_WINDOW = Duration.ofHours(1);

    private static final Comparator<AnomalyRecord> MOST_ANOMALOUS_FIRST =
            Comparator.comparingDouble(AnomalyRecord::getAnomalyScore)
                    .thenComparing(AnomalyRecord::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Deque<AnomalyRecord> history = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final int capacity;
    private final Path storagePath;
    private final ObjectMapper objectMapper;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyHistoryRepository(DetectionConfig detectionConfig, MetricsConfig metricsConfig, Clock clock) {
        DetectionConfig.History config = detectionConfig.getHistory();
        if (config.getCapacity() <= 0) {
            throw new IllegalArgumentException("History capacity must be positive, got " + config.getCapacity());
        }
        this.capacity = config.getCapacity();
        this.storagePath = Paths.get(config.getStoragePath());
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        loadSnapshot();
    }

    /**
     * Append records in order, evicting the oldest beyond capacity, then persist.
     */
    public void appendAll(List<AnomalyRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            for (AnomalyRecord record : records) {
                history.addLast(record);
                if (history.size() > capacity) {
                    history.removeFirst();
                }
            }
            metricsConfig.updateHistorySize(history.size());
            writeSnapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Up to {@code limit} records, lowest score first; ties broken by earlier timestamp.
     */
    public List<AnomalyRecord> findMostAnomalous(int limit) {
        List<AnomalyRecord> copy = findAll();
        copy.sort(MOST_ANOMALOUS_FIRST);
        return copy.size() > limit ? new ArrayList<>(copy.subList(0, Math.max(limit, 0))) : copy;
    }

    /**
     * Insertion-ordered copy of the history.
     */
    public List<AnomalyRecord> findAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(history);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return history.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public AnomalyStats getStats() {
        List<AnomalyRecord> copy = findAll();
        if (copy.isEmpty()) {
            return new AnomalyStats(0, 0.0);
        }
        double sum = 0.0;
        for (AnomalyRecord record : copy) {
            sum += record.getAnomalyScore();
        }
        return new AnomalyStats(copy.size(), sum / copy.size());
    }

    public Optional<ServiceStats> getServiceStats(String service) {
        List<AnomalyRecord> forService = findAll().stream()
                .filter(r -> service.equals(r.getService()))
                .toList();
        if (forService.isEmpty()) {
            return Optional.empty();
        }

        Instant recentCutoff = clock.instant().minus(RECENT_WINDOW);
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        int recent = 0;
        for (AnomalyRecord record : forService) {
            double score = record.getAnomalyScore();
            sum += score;
            max = Math.max(max, score);
            min = Math.min(min, score);
            if (record.getTimestamp() != null && !record.getTimestamp().isBefore(recentCutoff)) {
                recent++;
            }
        }

        return Optional.of(ServiceStats.builder()
                .service(service)
                .totalAnomalies(forService.size())
                .avgScore(sum / forService.size())
                .recentAnomalies(recent)
                .maxScore(max)
                .minScore(min)
                .build());
    }

    /**
     * Drop every record and delete the snapshot file.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            history.clear();
            metricsConfig.updateHistorySize(0);
            Files.deleteIfExists(storagePath);
            log.info("Cleared anomaly history and snapshot {}", storagePath);
        } catch (IOException e) {
            log.error("Failed to delete anomaly snapshot {}", storagePath, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void writeSnapshot() {
        try {
            Path dir = storagePath.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, storagePath.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), history);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            log.error("Failed to persist {} anomalies to {}", history.size(), storagePath, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, storagePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", storagePath);
            Files.move(tmp, storagePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void loadSnapshot() {
        if (!Files.exists(storagePath)) {
            log.info("No anomaly snapshot at {}, starting with empty history", storagePath);
            return;
        }
        try {
            List<AnomalyRecord> loaded = objectMapper.readValue(storagePath.toFile(),
                    new TypeReference<List<AnomalyRecord>>() {});
            if (loaded == null) {
                throw new IOException("snapshot is empty");
            }
            for (AnomalyRecord record : loaded) {
                if (record == null || record.getTimestamp() == null
                        || record.getService() == null || record.getRawLog() == null) {
                    throw new IOException("snapshot contains an incomplete record");
                }
            }

            int skip = Math.max(0, loaded.size() - capacity);
            history.addAll(loaded.subList(skip, loaded.size()));
            metricsConfig.updateHistorySize(history.size());
            log.info("Loaded {} anomalies from {}", history.size(), storagePath);
        } catch (IOException e) {
            history.clear();
            log.error("Failed to load anomaly snapshot {}, starting with empty history", storagePath, e);
        }
    }
}
