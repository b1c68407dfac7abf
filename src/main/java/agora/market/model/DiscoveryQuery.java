package agora.market.model;

import java.time.Duration;
import java.util.Set;

/**
 * Discovery filter. A worker must carry every listed capability.
 */
public final class DiscoveryQuery {

    public static final double DEFAULT_MAX_UTILIZATION = 0.8;
    public static final int DEFAULT_LIMIT = 10;

    private final Set<String> capabilities;
    private final double minReputation;
    private final double minQuality;
    private final Duration maxResponseTime;
    private final double maxUtilization;
    private final Set<String> preferredRegions;
    private final int limit;

    private DiscoveryQuery(Builder builder) {
        this.capabilities = builder.capabilities == null ? Set.of() : Set.copyOf(builder.capabilities);
        this.minReputation = builder.minReputation;
        this.minQuality = builder.minQuality;
        this.maxResponseTime = builder.maxResponseTime;
        this.maxUtilization = builder.maxUtilization;
        this.preferredRegions = builder.preferredRegions == null ? Set.of() : Set.copyOf(builder.preferredRegions);
        this.limit = builder.limit;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public double minReputation() {
        return minReputation;
    }

    public double minQuality() {
        return minQuality;
    }

    /** Null means unbounded */
    public Duration maxResponseTime() {
        return maxResponseTime;
    }

    public double maxUtilization() {
        return maxUtilization;
    }

    /** Empty means no regional preference */
    public Set<String> preferredRegions() {
        return preferredRegions;
    }

    public int limit() {
        return limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<String> capabilities;
        private double minReputation;
        private double minQuality;
        private Duration maxResponseTime;
        private double maxUtilization = DEFAULT_MAX_UTILIZATION;
        private Set<String> preferredRegions;
        private int limit = DEFAULT_LIMIT;

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder capabilities(String... capabilities) {
            this.capabilities = Set.of(capabilities);
            return this;
        }

        public Builder minReputation(double minReputation) {
            this.minReputation = minReputation;
            return this;
        }

        public Builder minQuality(double minQuality) {
            this.minQuality = minQuality;
            return this;
        }

        public Builder maxResponseTime(Duration maxResponseTime) {
            this.maxResponseTime = maxResponseTime;
            return this;
        }

        public Builder maxUtilization(double maxUtilization) {
            this.maxUtilization = maxUtilization;
            return this;
        }

        public Builder preferredRegions(Set<String> preferredRegions) {
            this.preferredRegions = preferredRegions;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public DiscoveryQuery build() {
            return new DiscoveryQuery(this);
        }
    }

    @Override
    public String toString() {
        return "DiscoveryQuery{capabilities=" + capabilities + ", minReputation=" + minReputation
                + ", limit=" + limit + "}";
    }
}
