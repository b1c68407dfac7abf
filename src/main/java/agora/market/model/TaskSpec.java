package agora.market.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Set;

/**
 * A unit of work submitted for allocation: what it needs, what the requester pays at most,
 * and how long it may run.
 */
public final class TaskSpec {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final String taskId;
    private final String requesterId;
    private final Set<String> capabilities;
    private final double minReputation;
    private final double minQuality;
    private final Duration maxResponseTime;
    private final Set<String> preferredRegions;
    private final BigDecimal maxPrice;
    private final BigDecimal reservePrice;
    private final AuctionKind auctionKind;
    private final Duration auctionDuration;
    private final Duration timeout;
    private final String payload;

    private TaskSpec(Builder builder) {
        this.taskId = builder.taskId;
        this.requesterId = builder.requesterId;
        this.capabilities = builder.capabilities == null ? Set.of() : Set.copyOf(builder.capabilities);
        this.minReputation = builder.minReputation;
        this.minQuality = builder.minQuality;
        this.maxResponseTime = builder.maxResponseTime;
        this.preferredRegions = builder.preferredRegions == null ? Set.of() : Set.copyOf(builder.preferredRegions);
        this.maxPrice = builder.maxPrice;
        this.reservePrice = builder.reservePrice;
        this.auctionKind = builder.auctionKind;
        this.auctionDuration = builder.auctionDuration;
        this.timeout = builder.timeout == null ? DEFAULT_TIMEOUT : builder.timeout;
        this.payload = builder.payload;
    }

    public String taskId() {
        return taskId;
    }

    public String requesterId() {
        return requesterId;
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

    public Duration maxResponseTime() {
        return maxResponseTime;
    }

    public Set<String> preferredRegions() {
        return preferredRegions;
    }

    public BigDecimal maxPrice() {
        return maxPrice;
    }

    public BigDecimal reservePrice() {
        return reservePrice;
    }

    public AuctionKind auctionKind() {
        return auctionKind;
    }

    public Duration auctionDuration() {
        return auctionDuration;
    }

    public Duration timeout() {
        return timeout;
    }

    public String payload() {
        return payload;
    }

    public DiscoveryQuery toDiscoveryQuery(int limit) {
        return DiscoveryQuery.builder()
                .capabilities(capabilities)
                .minReputation(minReputation)
                .minQuality(minQuality)
                .maxResponseTime(maxResponseTime)
                .preferredRegions(preferredRegions)
                .limit(limit)
                .build();
    }

    public AuctionSpec toAuctionSpec() {
        return AuctionSpec.builder()
                .taskId(taskId)
                .requesterId(requesterId)
                .kind(auctionKind)
                .reservePrice(reservePrice)
                .maxPrice(maxPrice)
                .minReputation(minReputation)
                .capabilities(capabilities)
                .duration(auctionDuration)
                .taskTimeout(timeout)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String requesterId;
        private Set<String> capabilities;
        private double minReputation;
        private double minQuality;
        private Duration maxResponseTime;
        private Set<String> preferredRegions;
        private BigDecimal maxPrice;
        private BigDecimal reservePrice;
        private AuctionKind auctionKind;
        private Duration auctionDuration;
        private Duration timeout;
        private String payload;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder requesterId(String requesterId) {
            this.requesterId = requesterId;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
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

        public Builder preferredRegions(Set<String> preferredRegions) {
            this.preferredRegions = preferredRegions;
            return this;
        }

        public Builder maxPrice(BigDecimal maxPrice) {
            this.maxPrice = maxPrice;
            return this;
        }

        public Builder reservePrice(BigDecimal reservePrice) {
            this.reservePrice = reservePrice;
            return this;
        }

        public Builder auctionKind(AuctionKind auctionKind) {
            this.auctionKind = auctionKind;
            return this;
        }

        public Builder auctionDuration(Duration auctionDuration) {
            this.auctionDuration = auctionDuration;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(this);
        }
    }

    @Override
    public String toString() {
        return "TaskSpec{taskId='" + taskId + "', requester='" + requesterId + "', capabilities=" + capabilities + "}";
    }
}
