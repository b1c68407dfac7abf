package agora.market.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one task's auction round.
 * The coordinator swaps snapshots under the auction's lock.
 */
public final class TaskAuction {

    private final String id;
    private final String taskId;
    private final String requesterId;
    private final AuctionKind kind;
    private final AuctionStatus status;
    private final BigDecimal reservePrice;
    private final BigDecimal maxPrice;
    private final double minReputation;
    private final Set<String> capabilities;
    private final long taskTimeoutMs;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Instant closedAt;
    private final List<Bid> bids;
    private final Bid winningBid;
    private final BigDecimal finalPrice;

    private TaskAuction(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.requesterId = builder.requesterId;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.reservePrice = Money.normalize(builder.reservePrice);
        this.maxPrice = Money.normalize(builder.maxPrice);
        this.minReputation = builder.minReputation;
        this.capabilities = builder.capabilities == null ? Set.of() : Set.copyOf(builder.capabilities);
        this.taskTimeoutMs = builder.taskTimeoutMs;
        this.createdAt = builder.createdAt;
        this.expiresAt = builder.expiresAt;
        this.closedAt = builder.closedAt;
        this.bids = builder.bids == null ? List.of() : List.copyOf(builder.bids);
        this.winningBid = builder.winningBid;
        this.finalPrice = builder.finalPrice;
    }

    public String id() {
        return id;
    }

    public String taskId() {
        return taskId;
    }

    public String requesterId() {
        return requesterId;
    }

    public AuctionKind kind() {
        return kind;
    }

    public AuctionStatus status() {
        return status;
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

    /** Task execution timeout used by the speed component of the bid score, 0 if unknown */
    public long taskTimeoutMs() {
        return taskTimeoutMs;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Instant closedAt() {
        return closedAt;
    }

    public List<Bid> bids() {
        return bids;
    }

    public Optional<Bid> winningBid() {
        return Optional.ofNullable(winningBid);
    }

    /** Clearing price, null until awarded */
    public BigDecimal finalPrice() {
        return finalPrice;
    }

    public boolean isOpen() {
        return status == AuctionStatus.OPEN;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean hasBidFrom(String workerId) {
        return bids.stream().anyMatch(b -> b.workerId().equals(workerId));
    }

    /** Copy with one more bid appended */
    public TaskAuction withBid(Bid bid) {
        List<Bid> next = new ArrayList<>(bids);
        next.add(bid);
        return toBuilder().bids(next).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskId(taskId)
                .requesterId(requesterId)
                .kind(kind)
                .status(status)
                .reservePrice(reservePrice)
                .maxPrice(maxPrice)
                .minReputation(minReputation)
                .capabilities(capabilities)
                .taskTimeoutMs(taskTimeoutMs)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .closedAt(closedAt)
                .bids(bids)
                .winningBid(winningBid)
                .finalPrice(finalPrice);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskId;
        private String requesterId;
        private AuctionKind kind = AuctionKind.SECOND_PRICE;
        private AuctionStatus status = AuctionStatus.OPEN;
        private BigDecimal reservePrice;
        private BigDecimal maxPrice;
        private double minReputation;
        private Set<String> capabilities;
        private long taskTimeoutMs;
        private Instant createdAt;
        private Instant expiresAt;
        private Instant closedAt;
        private List<Bid> bids;
        private Bid winningBid;
        private BigDecimal finalPrice;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

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

        public Builder status(AuctionStatus status) {
            this.status = status;
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

        public Builder taskTimeoutMs(long taskTimeoutMs) {
            this.taskTimeoutMs = taskTimeoutMs;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder bids(List<Bid> bids) {
            this.bids = bids;
            return this;
        }

        public Builder winningBid(Bid winningBid) {
            this.winningBid = winningBid;
            return this;
        }

        public Builder finalPrice(BigDecimal finalPrice) {
            this.finalPrice = finalPrice;
            return this;
        }

        public TaskAuction build() {
            return new TaskAuction(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskAuction that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskAuction{id='" + id + "', taskId='" + taskId + "', status=" + status
                + ", bids=" + bids.size() + "}";
    }
}
