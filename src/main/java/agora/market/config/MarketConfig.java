package agora.market.config;

import agora.market.model.AuctionKind;
import agora.market.model.FailurePenaltyPolicy;

import java.time.Duration;

/**
 * Configuration holder for marketplace coordinator settings.
 * All settings have sensible defaults.
 */
public final class MarketConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/agora;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Auth settings (optional)
    private String agentKey = null; // If set, /internal calls must provide X-Agora-Key header

    // Health monitoring
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration probeTimeout = Duration.ofSeconds(5);
    private int maxConsecutiveFailures = 3;
    private double latencyEmaAlpha = 0.3;

    // Auctions
    private Duration auctionDuration = Duration.ofSeconds(30);
    private AuctionKind defaultAuctionKind = AuctionKind.SECOND_PRICE;
    private int minBidders = 3;
    private int maxBids = 10;
    private Duration auctionSweepInterval = Duration.ofSeconds(10);
    private Duration auctionRetention = Duration.ofMinutes(10);

    // Ledger
    private Duration escrowHoldTimeout = Duration.ofMinutes(10);
    private Duration escrowReaperInterval = Duration.ofSeconds(30);
    private Duration channelRetention = Duration.ofMinutes(10);
    private boolean ledgerSelfCheck = false;

    // Reputation deltas
    private FailurePenaltyPolicy failurePenaltyPolicy = FailurePenaltyPolicy.FLAT;
    private double failurePenalty = 5.0;
    private double successReward = 2.0;
    private double fastCompletionBonus = 1.0;
    private double slowCompletionPenalty = 0.5;

    private MarketConfig() {
    }

    public static MarketConfig defaults() {
        return new MarketConfig();
    }

    public static MarketConfig fromEnv() {
        MarketConfig config = new MarketConfig();

        // Override from environment variables
        String dbUrl = System.getenv("AGORA_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("AGORA_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String agentKey = System.getenv("AGORA_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String minBidders = System.getenv("AGORA_MIN_BIDDERS");
        if (minBidders != null && !minBidders.isBlank()) {
            config.minBidders = Integer.parseInt(minBidders);
        }

        String healthInterval = System.getenv("AGORA_HEALTH_INTERVAL_SEC");
        if (healthInterval != null && !healthInterval.isBlank()) {
            config.healthCheckInterval = Duration.ofSeconds(Long.parseLong(healthInterval));
        }

        String channelRetention = System.getenv("AGORA_CHANNEL_RETENTION_SEC");
        if (channelRetention != null && !channelRetention.isBlank()) {
            config.channelRetention = Duration.ofSeconds(Long.parseLong(channelRetention));
        }

        String penaltyPolicy = System.getenv("AGORA_FAILURE_PENALTY_POLICY");
        if (penaltyPolicy != null && !penaltyPolicy.isBlank()) {
            config.failurePenaltyPolicy = FailurePenaltyPolicy.valueOf(penaltyPolicy.trim().toUpperCase());
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public int maxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public double latencyEmaAlpha() {
        return latencyEmaAlpha;
    }

    public Duration auctionDuration() {
        return auctionDuration;
    }

    public AuctionKind defaultAuctionKind() {
        return defaultAuctionKind;
    }

    public int minBidders() {
        return minBidders;
    }

    public int maxBids() {
        return maxBids;
    }

    public Duration auctionSweepInterval() {
        return auctionSweepInterval;
    }

    public Duration auctionRetention() {
        return auctionRetention;
    }

    public Duration escrowHoldTimeout() {
        return escrowHoldTimeout;
    }

    public Duration escrowReaperInterval() {
        return escrowReaperInterval;
    }

    /** How long a CLOSED channel stays in memory before it is served from the store only */
    public Duration channelRetention() {
        return channelRetention;
    }

    public boolean ledgerSelfCheck() {
        return ledgerSelfCheck;
    }

    public FailurePenaltyPolicy failurePenaltyPolicy() {
        return failurePenaltyPolicy;
    }

    public double failurePenalty() {
        return failurePenalty;
    }

    public double successReward() {
        return successReward;
    }

    public double fastCompletionBonus() {
        return fastCompletionBonus;
    }

    public double slowCompletionPenalty() {
        return slowCompletionPenalty;
    }

    // Fluent setters for testing/customization
    public MarketConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public MarketConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public MarketConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public MarketConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public MarketConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public MarketConfig withMaxConsecutiveFailures(int failures) {
        this.maxConsecutiveFailures = failures;
        return this;
    }

    public MarketConfig withAuctionDuration(Duration duration) {
        this.auctionDuration = duration;
        return this;
    }

    public MarketConfig withDefaultAuctionKind(AuctionKind kind) {
        this.defaultAuctionKind = kind;
        return this;
    }

    public MarketConfig withMinBidders(int minBidders) {
        this.minBidders = minBidders;
        return this;
    }

    public MarketConfig withMaxBids(int maxBids) {
        this.maxBids = maxBids;
        return this;
    }

    public MarketConfig withAuctionSweepInterval(Duration interval) {
        this.auctionSweepInterval = interval;
        return this;
    }

    public MarketConfig withAuctionRetention(Duration retention) {
        this.auctionRetention = retention;
        return this;
    }

    public MarketConfig withEscrowHoldTimeout(Duration timeout) {
        this.escrowHoldTimeout = timeout;
        return this;
    }

    public MarketConfig withEscrowReaperInterval(Duration interval) {
        this.escrowReaperInterval = interval;
        return this;
    }

    public MarketConfig withChannelRetention(Duration retention) {
        this.channelRetention = retention;
        return this;
    }

    public MarketConfig withLedgerSelfCheck(boolean enabled) {
        this.ledgerSelfCheck = enabled;
        return this;
    }

    public MarketConfig withFailurePenaltyPolicy(FailurePenaltyPolicy policy) {
        this.failurePenaltyPolicy = policy;
        return this;
    }

    public MarketConfig withFailurePenalty(double penalty) {
        this.failurePenalty = penalty;
        return this;
    }

    @Override
    public String toString() {
        return "MarketConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", minBidders=" + minBidders +
                ", auctionDuration=" + auctionDuration +
                ", healthCheckInterval=" + healthCheckInterval +
                ", failurePenaltyPolicy=" + failurePenaltyPolicy +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
