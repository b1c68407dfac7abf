package agora.market.service;

import agora.market.exception.InvalidQueryException;
import agora.market.exception.InvalidWorkerException;
import agora.market.exception.WorkerNotFoundException;
import agora.market.metrics.MarketMetrics;
import agora.market.model.DiscoveryQuery;
import agora.market.model.DiscoveryResult;
import agora.market.model.WorkerRecord;
import agora.market.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Inverted index from capability tag to worker ids, plus the worker records themselves.
 *
 * Queries take the read lock and never block each other; registration and record
 * updates take the write lock. Records are immutable and swapped whole.
 */
public class CapabilityIndex {

    private static final Logger log = LoggerFactory.getLogger(CapabilityIndex.class);

    static final double WEIGHT_REPUTATION = 0.30;
    static final double WEIGHT_QUALITY = 0.25;
    static final double WEIGHT_AVAILABILITY = 0.20;
    static final double WEIGHT_RESPONSE = 0.15;
    static final double WEIGHT_REGION = 0.10;

    private static final Comparator<DiscoveryResult> RANKING = Comparator
            .comparingDouble(DiscoveryResult::score).reversed()
            .thenComparing(r -> responseMillis(r.worker()))
            .thenComparing(r -> r.worker().id());

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, WorkerRecord> workers = new HashMap<>();
    private final Map<String, Set<String>> byCapability = new HashMap<>();
    private final MarketMetrics metrics;

    public CapabilityIndex(MarketMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Register a worker, replacing any previous record with the same id.
     */
    public WorkerRecord register(WorkerRecord record) {
        if (record.id().isBlank()) {
            throw new InvalidWorkerException("worker id is required");
        }
        if (record.capabilities().isEmpty()) {
            throw new InvalidWorkerException("worker " + record.id() + " must declare at least one capability");
        }
        if (record.capacity() <= 0) {
            throw new InvalidWorkerException("worker " + record.id() + " capacity must be positive");
        }

        WorkerRecord stored = record.registeredAt() != null ? record
                : record.toBuilder().registeredAt(Instant.now()).lastSeen(Instant.now()).build();

        lock.writeLock().lock();
        try {
            WorkerRecord previous = workers.put(stored.id(), stored);
            if (previous != null) {
                unindex(previous);
            }
            index(stored);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Worker registered: {} capabilities={} region={}", stored.id(), stored.capabilities(),
                stored.region());
        return stored;
    }

    /**
     * Remove a worker from the index.
     *
     * @return true if the worker was registered
     */
    public boolean unregister(String workerId) {
        lock.writeLock().lock();
        try {
            WorkerRecord removed = workers.remove(workerId);
            if (removed == null) {
                return false;
            }
            unindex(removed);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Worker unregistered: {}", workerId);
        return true;
    }

    public WorkerRecord updateStatus(String workerId, WorkerStatus status) {
        WorkerRecord updated = update(workerId, w -> w.toBuilder().status(status).build())
                .orElseThrow(() -> new WorkerNotFoundException("Worker not found: " + workerId));
        log.info("Worker {} status -> {}", workerId, status);
        return updated;
    }

    /**
     * Adjust a worker's load. Load never drops below zero; an online worker at full
     * capacity becomes busy and a busy worker with spare capacity becomes online again.
     */
    public WorkerRecord updateLoad(String workerId, int delta) {
        return update(workerId, w -> {
            int load = Math.max(0, w.load() + delta);
            WorkerStatus status = w.status();
            if (status == WorkerStatus.ONLINE && load >= w.capacity()) {
                status = WorkerStatus.BUSY;
            } else if (status == WorkerStatus.BUSY && load < w.capacity()) {
                status = WorkerStatus.ONLINE;
            }
            return w.toBuilder().load(load).status(status).build();
        }).orElseThrow(() -> new WorkerNotFoundException("Worker not found: " + workerId));
    }

    /** Refresh the reputation snapshot held for a worker */
    public Optional<WorkerRecord> updateReputation(String workerId, double reputation) {
        return update(workerId, w -> w.toBuilder().reputation(reputation).build());
    }

    /**
     * Atomically replace a worker record.
     *
     * @return the new record, or empty if the worker is not registered
     */
    public Optional<WorkerRecord> update(String workerId, UnaryOperator<WorkerRecord> updater) {
        lock.writeLock().lock();
        try {
            WorkerRecord current = workers.get(workerId);
            if (current == null) {
                return Optional.empty();
            }
            WorkerRecord next = updater.apply(current);
            workers.put(workerId, next);
            if (!next.capabilities().equals(current.capabilities())) {
                unindex(current);
                index(next);
            }
            return Optional.of(next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Find workers that carry every requested capability and pass the query filters,
     * ranked by match score.
     *
     * @throws InvalidQueryException if the query names no capability
     */
    public List<DiscoveryResult> query(DiscoveryQuery query) {
        if (query.capabilities().isEmpty()) {
            throw new InvalidQueryException("at least one capability is required");
        }
        if (query.limit() <= 0) {
            throw new InvalidQueryException("limit must be positive");
        }

        long started = System.nanoTime();
        List<DiscoveryResult> results = new ArrayList<>();

        lock.readLock().lock();
        try {
            List<Set<String>> candidateSets = new ArrayList<>();
            for (String capability : query.capabilities()) {
                Set<String> ids = byCapability.get(capability);
                if (ids == null || ids.isEmpty()) {
                    candidateSets = null;
                    break;
                }
                candidateSets.add(ids);
            }

            if (candidateSets != null) {
                candidateSets.sort(Comparator.comparingInt(Set::size));
                Set<String> smallest = candidateSets.get(0);
                List<Set<String>> others = candidateSets.subList(1, candidateSets.size());

                for (String id : smallest) {
                    if (!containedInAll(id, others)) {
                        continue;
                    }
                    WorkerRecord worker = workers.get(id);
                    if (worker != null && passesFilters(worker, query)) {
                        results.add(new DiscoveryResult(worker, matchScore(worker, query)));
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        results.sort(RANKING);
        List<DiscoveryResult> top = results.size() > query.limit()
                ? List.copyOf(results.subList(0, query.limit()))
                : List.copyOf(results);

        metrics.discoveryQuery(System.nanoTime() - started, top.size());
        log.debug("Discovery {} -> {} of {} matches", query, top.size(), results.size());
        return top;
    }

    public Optional<WorkerRecord> find(String workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(workers.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of all registered workers */
    public List<WorkerRecord> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(workers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<WorkerStatus, Long> countByStatus() {
        Map<WorkerStatus, Long> counts = new EnumMap<>(WorkerStatus.class);
        for (WorkerStatus status : WorkerStatus.values()) {
            counts.put(status, 0L);
        }
        lock.readLock().lock();
        try {
            for (WorkerRecord worker : workers.values()) {
                counts.merge(worker.status(), 1L, Long::sum);
            }
        } finally {
            lock.readLock().unlock();
        }
        return counts;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return workers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * MatchScore in [0, 1]: weighted reputation, quality, spare capacity, responsiveness
     * and region preference.
     */
    public static double matchScore(WorkerRecord worker, DiscoveryQuery query) {
        double reputation = clamp01(worker.reputation() / 100.0);
        double quality = clamp01(worker.quality() / 100.0);
        double availability = clamp01(1.0 - worker.utilization());
        double response = responseScore(worker.avgResponseTime(), query.maxResponseTime());
        double region = regionScore(worker.region(), query.preferredRegions());

        return WEIGHT_REPUTATION * reputation
                + WEIGHT_QUALITY * quality
                + WEIGHT_AVAILABILITY * availability
                + WEIGHT_RESPONSE * response
                + WEIGHT_REGION * region;
    }

    static double responseScore(Duration avgResponse, Duration maxResponse) {
        if (avgResponse == null) {
            return 1.0;
        }
        double avgMs = avgResponse.toNanos() / 1_000_000.0;
        if (maxResponse != null && !maxResponse.isZero()) {
            double maxMs = maxResponse.toNanos() / 1_000_000.0;
            return clamp01(1.0 - avgMs / maxMs);
        }
        return 1.0 / (1.0 + avgMs / 1000.0);
    }

    static double regionScore(String region, Set<String> preferredRegions) {
        if (preferredRegions.isEmpty()) {
            return 1.0;
        }
        return region != null && preferredRegions.contains(region) ? 1.0 : 0.5;
    }

    private static boolean passesFilters(WorkerRecord worker, DiscoveryQuery query) {
        if (!worker.status().isDiscoverable()) {
            return false;
        }
        if (worker.reputation() < query.minReputation()) {
            return false;
        }
        if (worker.quality() < query.minQuality()) {
            return false;
        }
        if (query.maxResponseTime() != null && worker.avgResponseTime() != null
                && worker.avgResponseTime().compareTo(query.maxResponseTime()) > 0) {
            return false;
        }
        return worker.utilization() <= query.maxUtilization();
    }

    private static boolean containedInAll(String id, List<Set<String>> sets) {
        for (Set<String> set : sets) {
            if (!set.contains(id)) {
                return false;
            }
        }
        return true;
    }

    private static long responseMillis(WorkerRecord worker) {
        return worker.avgResponseTime() == null ? 0L : worker.avgResponseTime().toMillis();
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    // Callers hold the write lock
    private void index(WorkerRecord worker) {
        for (String capability : worker.capabilities()) {
            byCapability.computeIfAbsent(capability, k -> new HashSet<>()).add(worker.id());
        }
    }

    private void unindex(WorkerRecord worker) {
        for (String capability : worker.capabilities()) {
            Set<String> ids = byCapability.get(capability);
            if (ids != null) {
                ids.remove(worker.id());
                if (ids.isEmpty()) {
                    byCapability.remove(capability);
                }
            }
        }
    }
}
