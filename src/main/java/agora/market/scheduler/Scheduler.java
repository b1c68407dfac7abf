package agora.market.scheduler;

import agora.market.config.MarketConfig;
import agora.market.service.HealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - HealthMonitor: probes workers and demotes unresponsive ones
 * - AuctionSweeper: finalizes auctions past their bidding window
 * - EscrowReaper: refunds escrows held past the hold timeout
 *
 * Health probing runs on its own thread so a slow probe cycle never delays
 * the sweeps.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final HealthMonitor healthMonitor;
    private final AuctionSweeper auctionSweeper;
    private final EscrowReaper escrowReaper;
    private final MarketConfig config;
    private final List<ScheduledFuture<?>> handles = new ArrayList<>();

    private volatile boolean running = false;

    public Scheduler(HealthMonitor healthMonitor, AuctionSweeper auctionSweeper, EscrowReaper escrowReaper,
            MarketConfig config) {
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "agora-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.healthMonitor = healthMonitor;
        this.auctionSweeper = auctionSweeper;
        this.escrowReaper = escrowReaper;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long healthIntervalMs = config.healthCheckInterval().toMillis();
        handles.add(executor.scheduleAtFixedRate(
                wrapRunnable("health-monitor", healthMonitor),
                healthIntervalMs,
                healthIntervalMs,
                TimeUnit.MILLISECONDS));
        log.info("Health monitor scheduled every {}ms", healthIntervalMs);

        long sweepIntervalMs = config.auctionSweepInterval().toMillis();
        handles.add(executor.scheduleAtFixedRate(
                wrapRunnable("auction-sweeper", auctionSweeper),
                sweepIntervalMs,
                sweepIntervalMs,
                TimeUnit.MILLISECONDS));
        log.info("Auction sweeper scheduled every {}ms", sweepIntervalMs);

        long reaperIntervalMs = config.escrowReaperInterval().toMillis();
        handles.add(executor.scheduleAtFixedRate(
                wrapRunnable("escrow-reaper", escrowReaper),
                reaperIntervalMs,
                reaperIntervalMs,
                TimeUnit.MILLISECONDS));
        log.info("Escrow reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        healthMonitor.stop();
        for (ScheduledFuture<?> handle : handles) {
            handle.cancel(false);
        }
        handles.clear();
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public AuctionSweeper auctionSweeper() {
        return auctionSweeper;
    }

    public EscrowReaper escrowReaper() {
        return escrowReaper;
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            if (!running) {
                return;
            }
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
