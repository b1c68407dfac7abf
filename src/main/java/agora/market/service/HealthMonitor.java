package agora.market.service;

import agora.market.config.MarketConfig;
import agora.market.gateway.HealthProbe;
import agora.market.metrics.MarketMetrics;
import agora.market.model.WorkerRecord;
import agora.market.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Periodic liveness checker for registered workers.
 *
 * Each cycle probes every worker outside of any index lock, then writes the result
 * back with a short index update:
 * - success: failures reset, EMA response time updated, OFFLINE workers come back
 * - failure: failures incremented, worker demoted to OFFLINE after the configured limit
 *
 * MAINTENANCE is operator-owned and never changed here.
 */
public class HealthMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final CapabilityIndex index;
    private final HealthProbe probe;
    private final MarketConfig config;
    private final MarketMetrics metrics;
    private final ExecutorService probeExecutor;

    private volatile boolean running = true;

    public HealthMonitor(CapabilityIndex index, HealthProbe probe, MarketConfig config, MarketMetrics metrics) {
        this.index = index;
        this.probe = probe;
        this.config = config;
        this.metrics = metrics;
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agora-health-probe");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        try {
            checkAll();
        } catch (Exception e) {
            log.error("Health monitor error", e);
        }
    }

    /**
     * Probe every registered worker once.
     *
     * @return number of workers probed
     */
    public int checkAll() {
        List<WorkerRecord> workers = index.snapshot();
        int checked = 0;
        int failed = 0;

        for (WorkerRecord worker : workers) {
            if (!running || Thread.currentThread().isInterrupted()) {
                log.info("Health check cycle interrupted after {} workers", checked);
                break;
            }
            if (!checkWorker(worker)) {
                failed++;
            }
            checked++;
        }

        if (checked > 0) {
            log.debug("Health check cycle: {} probed, {} failed", checked, failed);
        }
        return checked;
    }

    /**
     * Probe one worker and record the outcome.
     *
     * @return true if the probe succeeded
     */
    public boolean checkWorker(WorkerRecord worker) {
        Future<Duration> pending = probeExecutor.submit(() -> probe.probe(worker));
        try {
            Duration rtt = pending.get(config.probeTimeout().toMillis(), TimeUnit.MILLISECONDS);
            recordSuccess(worker.id(), rtt);
            return true;
        } catch (TimeoutException e) {
            pending.cancel(true);
            recordFailure(worker.id(), "probe timed out after " + config.probeTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(worker.id(), cause.getMessage());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
        }
        return false;
    }

    public void recordSuccess(String workerId, Duration rtt) {
        metrics.healthCheck(true);
        Instant now = Instant.now();
        index.update(workerId, w -> {
            WorkerStatus status = w.status();
            if (status == WorkerStatus.OFFLINE) {
                status = w.isAtCapacity() ? WorkerStatus.BUSY : WorkerStatus.ONLINE;
                log.info("Worker {} is reachable again -> {}", workerId, status);
            }
            return w.toBuilder()
                    .status(status)
                    .consecutiveFailures(0)
                    .lastSeen(now)
                    .avgResponseTime(ema(w.avgResponseTime(), rtt, config.latencyEmaAlpha()))
                    .build();
        });
    }

    public void recordFailure(String workerId, String reason) {
        metrics.healthCheck(false);
        index.update(workerId, w -> {
            int failures = w.consecutiveFailures() + 1;
            WorkerStatus status = w.status();
            if (failures >= config.maxConsecutiveFailures() && status.isDiscoverable()) {
                status = WorkerStatus.OFFLINE;
                metrics.workerDemoted();
                log.warn("Worker {} marked OFFLINE after {} consecutive failures: {}", workerId, failures, reason);
            } else {
                log.debug("Worker {} probe failed ({}/{}): {}", workerId, failures,
                        config.maxConsecutiveFailures(), reason);
            }
            return w.toBuilder().consecutiveFailures(failures).status(status).build();
        });
    }

    /**
     * Exponential moving average. The first sample seeds the average.
     */
    public static Duration ema(Duration previous, Duration sample, double alpha) {
        if (previous == null) {
            return sample;
        }
        double nanos = alpha * sample.toNanos() + (1.0 - alpha) * previous.toNanos();
        return Duration.ofNanos(Math.round(nanos));
    }

    public void stop() {
        running = false;
        probeExecutor.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    /** True once the probe pool has been shut down */
    public boolean isClosed() {
        return probeExecutor.isShutdown();
    }
}
