package agora.market.config;

import agora.market.api.internal.v1.WorkerController;
import agora.market.api.v1.AuctionController;
import agora.market.api.v1.DiscoveryController;
import agora.market.api.v1.HealthController;
import agora.market.api.v1.LedgerController;
import agora.market.api.v1.MetricsController;
import agora.market.metrics.MarketMetrics;
import agora.market.repository.AuctionRepository;
import agora.market.repository.LedgerRepository;
import agora.market.scheduler.AuctionSweeper;
import agora.market.scheduler.EscrowReaper;
import agora.market.scheduler.Scheduler;
import agora.market.server.RouterHandler;
import agora.market.service.AuctionCoordinator;
import agora.market.service.CapabilityIndex;
import agora.market.service.EscrowLedger;
import agora.market.service.HealthMonitor;
import agora.market.service.MarketplaceOrchestrator;
import agora.market.service.ReputationPolicy;
import agora.market.service.SettlementCoordinator;
import agora.market.store.Database;
import agora.market.store.JdbcAuctionRepository;
import agora.market.store.JdbcLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(MarketConfig.fromEnv());
 * deps.startScheduler(); // health checks, auction sweep, escrow reaper
 * MarketplaceOrchestrator orchestrator = deps.orchestrator();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final MarketConfig config;
    private final Collaborators collaborators;
    private final MarketMetrics metrics;
    private final Database database;
    private final LedgerRepository ledgerRepository;
    private final AuctionRepository auctionRepository;
    private final CapabilityIndex capabilityIndex;
    private final HealthMonitor healthMonitor;
    private final AuctionCoordinator auctionCoordinator;
    private final EscrowLedger escrowLedger;
    private final SettlementCoordinator settlementCoordinator;
    private final MarketplaceOrchestrator orchestrator;

    // Controllers
    private final HealthController healthController;
    private final MetricsController metricsController;
    private final DiscoveryController discoveryController;
    private final AuctionController auctionController;
    private final LedgerController ledgerController;
    private final WorkerController workerController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(MarketConfig config, Collaborators collaborators) {
        this.config = config;
        this.collaborators = collaborators;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.metrics = new MarketMetrics();
        this.database = new Database(config);

        // Repositories
        this.ledgerRepository = new JdbcLedgerRepository(database);
        this.auctionRepository = new JdbcAuctionRepository(database);

        // Services
        this.capabilityIndex = new CapabilityIndex(metrics);
        this.healthMonitor = new HealthMonitor(capabilityIndex, collaborators.probe(), config, metrics);
        this.auctionCoordinator = new AuctionCoordinator(auctionRepository, collaborators.transport(), config,
                metrics);
        this.escrowLedger = new EscrowLedger(ledgerRepository, metrics, config.ledgerSelfCheck());
        this.settlementCoordinator = new SettlementCoordinator(escrowLedger, collaborators.reputation(),
                capabilityIndex, new ReputationPolicy(config));
        this.orchestrator = new MarketplaceOrchestrator(capabilityIndex, auctionCoordinator, escrowLedger,
                settlementCoordinator, collaborators.execution(), config, metrics);

        // Controllers (public API)
        this.healthController = new HealthController(database, capabilityIndex, auctionCoordinator, escrowLedger);
        this.metricsController = new MetricsController(metrics, capabilityIndex);
        this.discoveryController = new DiscoveryController(capabilityIndex);
        this.auctionController = new AuctionController(auctionCoordinator);
        this.ledgerController = new LedgerController(escrowLedger);

        // Controllers (internal API)
        this.workerController = new WorkerController(capabilityIndex, collaborators.reputation());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and collaborators.
     */
    public static Dependencies create(MarketConfig config, Collaborators collaborators) {
        return new Dependencies(config, collaborators);
    }

    /**
     * Create dependencies with default collaborators.
     */
    public static Dependencies create(MarketConfig config) {
        return create(config, Collaborators.defaults(config));
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(MarketConfig.fromEnv());
    }

    // Getters
    public MarketConfig config() {
        return config;
    }

    public Collaborators collaborators() {
        return collaborators;
    }

    public MarketMetrics metrics() {
        return metrics;
    }

    public Database database() {
        return database;
    }

    public CapabilityIndex capabilityIndex() {
        return capabilityIndex;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public AuctionCoordinator auctionCoordinator() {
        return auctionCoordinator;
    }

    public EscrowLedger escrowLedger() {
        return escrowLedger;
    }

    public SettlementCoordinator settlementCoordinator() {
        return settlementCoordinator;
    }

    public MarketplaceOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(metricsController)
                    .registerController(discoveryController)
                    .registerController(auctionController)
                    .registerController(ledgerController)
                    .registerController(workerController);
            log.info("RouterHandler created with {} controllers", 6);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(
                    healthMonitor,
                    new AuctionSweeper(auctionCoordinator),
                    new EscrowReaper(escrowLedger, settlementCoordinator, config),
                    config);
        }
        return scheduler;
    }

    /**
     * Start health checks, the auction sweep and the escrow reaper.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        // Scheduler.stop() skips this when the scheduler never started
        try {
            healthMonitor.stop();
        } catch (Exception e) {
            log.warn("Error stopping health monitor: {}", e.getMessage());
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error stopping orchestrator: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
