package agora.market.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Set;

/**
 * Parameters for opening an auction.
 */
public final class AuctionSpec {

    private final String taskId;
    private final String requesterId;
    private final AuctionKind kind;
    private final BigDecimal reservePrice;
    private final BigDecimal maxPrice;
    private final double minReputation;
    private final Set<String> capabilities;
    private final Duration duration;
    private final Duration taskTimeout;

    private AuctionSpec(Builder builder) {
        this.taskId = builder.taskId;
        this.requesterId = builder.requesterId;
        this.kind = builder.kind;
        this.reservePrice = Money.normalize(builder.reservePrice);
        this.maxPrice = builder.maxPrice == null ? null : Money.normalize(builder.maxPrice);
        this.minReputation = builder.minReputation;
        this.capabilities = builder.capabilities == null ? Set.of() : Set.copyOf(builder.capabilities);
        this.duration = builder.duration;
        this.taskTimeout = builder.taskTimeout;
    }

    public String taskId() {
        return taskId;
    }

    public String requesterId() {
        return requesterId;
    }

    /** Null means the coordinator default */
    public AuctionKind kind() {
        return kind;
    }

    public BigDecimal reservePrice() {
        return reservePrice;
    }

    public BigDecimal maxPrice() {
        return maxPrice;
    }

    public double minReputation() {
        return minReputation;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    /** Null means the coordinator default */
    public Duration duration() {
        return duration;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String requesterId;
        private AuctionKind kind;
        private BigDecimal reservePrice;
        private BigDecimal maxPrice;
        private double minReputation;
        private Set<String> capabilities;
        private Duration duration;
        private Duration taskTimeout;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder requesterId(String requesterId) {
            this.requesterId = requesterId;
            return this;
        }

        public Builder kind(AuctionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder reservePrice(BigDecimal reservePrice) {
            this.reservePrice = reservePrice;
            return this;
        }

        public Builder maxPrice(BigDecimal maxPrice) {
            this.maxPrice = maxPrice;
            return this;
        }

        public Builder minReputation(double minReputation) {
            this.minReputation = minReputation;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            this.taskTimeout = taskTimeout;
            return this;
        }

        public AuctionSpec build() {
            return new AuctionSpec(this);
        }
    }
}
