package agora.market.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a bilateral payment channel between a payer and a payee.
 *
 * <p>
 * Invariant: {@code totalDeposit = currentBalance + escrowedAmount + totalSettled + totalRefunded}.
 * {@code totalRefunded} is the balance handed back to the payer when the channel closed.
 */
public final class PaymentChannel {

    private final String id;
    private final String payerId;
    private final String payeeId;
    private final String auctionRef;
    private final ChannelState state;
    private final BigDecimal totalDeposit;
    private final BigDecimal currentBalance;
    private final BigDecimal escrowedAmount;
    private final BigDecimal totalSettled;
    private final BigDecimal totalRefunded;
    private final String escrowTaskId;
    private final Instant escrowLockedAt;
    private final boolean escrowReleased;
    private final ReleaseResult lastRelease;
    private final long sequence;
    private final List<ChannelTransaction> transactions;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant closedAt;

    private PaymentChannel(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.payerId = Objects.requireNonNull(builder.payerId, "payerId is required");
        this.payeeId = Objects.requireNonNull(builder.payeeId, "payeeId is required");
        this.auctionRef = builder.auctionRef;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.totalDeposit = Money.normalize(builder.totalDeposit);
        this.currentBalance = Money.normalize(builder.currentBalance);
        this.escrowedAmount = Money.normalize(builder.escrowedAmount);
        this.totalSettled = Money.normalize(builder.totalSettled);
        this.totalRefunded = Money.normalize(builder.totalRefunded);
        this.escrowTaskId = builder.escrowTaskId;
        this.escrowLockedAt = builder.escrowLockedAt;
        this.escrowReleased = builder.escrowReleased;
        this.lastRelease = builder.lastRelease;
        this.sequence = builder.sequence;
        this.transactions = builder.transactions == null ? List.of() : List.copyOf(builder.transactions);
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.closedAt = builder.closedAt;
    }

    public String id() {
        return id;
    }

    public String payerId() {
        return payerId;
    }

    public String payeeId() {
        return payeeId;
    }

    public String auctionRef() {
        return auctionRef;
    }

    public ChannelState state() {
        return state;
    }

    /** Funds put into the channel, net of the remainder returned on close */
    public BigDecimal totalDeposit() {
        return totalDeposit;
    }

    public BigDecimal currentBalance() {
        return currentBalance;
    }

    public BigDecimal escrowedAmount() {
        return escrowedAmount;
    }

    public BigDecimal totalSettled() {
        return totalSettled;
    }

    public BigDecimal totalRefunded() {
        return totalRefunded;
    }

    /** Task of the active or most recent escrow */
    public String escrowTaskId() {
        return escrowTaskId;
    }

    public Instant escrowLockedAt() {
        return escrowLockedAt;
    }

    public boolean escrowReleased() {
        return escrowReleased;
    }

    public ReleaseResult lastRelease() {
        return lastRelease;
    }

    public long sequence() {
        return sequence;
    }

    public List<ChannelTransaction> transactions() {
        return transactions;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant closedAt() {
        return closedAt;
    }

    /** Funds still owned by the payer inside this channel */
    public BigDecimal heldAmount() {
        return currentBalance.add(escrowedAmount);
    }

    public boolean isBalanced() {
        return currentBalance.signum() >= 0
                && escrowedAmount.signum() >= 0
                && totalSettled.signum() >= 0
                && totalRefunded.signum() >= 0
                && totalDeposit.compareTo(currentBalance.add(escrowedAmount).add(totalSettled).add(totalRefunded)) == 0;
    }

    public boolean involves(String ownerId) {
        return payerId.equals(ownerId) || payeeId.equals(ownerId);
    }

    /** Copy with one more log entry; the entry's sequence becomes the channel sequence */
    public PaymentChannel append(ChannelTransaction tx) {
        List<ChannelTransaction> next = new ArrayList<>(transactions);
        next.add(tx);
        return toBuilder().transactions(next).sequence(tx.sequence()).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .payerId(payerId)
                .payeeId(payeeId)
                .auctionRef(auctionRef)
                .state(state)
                .totalDeposit(totalDeposit)
                .currentBalance(currentBalance)
                .escrowedAmount(escrowedAmount)
                .totalSettled(totalSettled)
                .totalRefunded(totalRefunded)
                .escrowTaskId(escrowTaskId)
                .escrowLockedAt(escrowLockedAt)
                .escrowReleased(escrowReleased)
                .lastRelease(lastRelease)
                .sequence(sequence)
                .transactions(transactions)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .closedAt(closedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String payerId;
        private String payeeId;
        private String auctionRef;
        private ChannelState state = ChannelState.OPENING;
        private BigDecimal totalDeposit;
        private BigDecimal currentBalance;
        private BigDecimal escrowedAmount;
        private BigDecimal totalSettled;
        private BigDecimal totalRefunded;
        private String escrowTaskId;
        private Instant escrowLockedAt;
        private boolean escrowReleased;
        private ReleaseResult lastRelease;
        private long sequence;
        private List<ChannelTransaction> transactions;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant closedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder payerId(String payerId) {
            this.payerId = payerId;
            return this;
        }

        public Builder payeeId(String payeeId) {
            this.payeeId = payeeId;
            return this;
        }

        public Builder auctionRef(String auctionRef) {
            this.auctionRef = auctionRef;
            return this;
        }

        public Builder state(ChannelState state) {
            this.state = state;
            return this;
        }

        public Builder totalDeposit(BigDecimal totalDeposit) {
            this.totalDeposit = totalDeposit;
            return this;
        }

        public Builder currentBalance(BigDecimal currentBalance) {
            this.currentBalance = currentBalance;
            return this;
        }

        public Builder escrowedAmount(BigDecimal escrowedAmount) {
            this.escrowedAmount = escrowedAmount;
            return this;
        }

        public Builder totalSettled(BigDecimal totalSettled) {
            this.totalSettled = totalSettled;
            return this;
        }

        public Builder totalRefunded(BigDecimal totalRefunded) {
            this.totalRefunded = totalRefunded;
            return this;
        }

        public Builder escrowTaskId(String escrowTaskId) {
            this.escrowTaskId = escrowTaskId;
            return this;
        }

        public Builder escrowLockedAt(Instant escrowLockedAt) {
            this.escrowLockedAt = escrowLockedAt;
            return this;
        }

        public Builder escrowReleased(boolean escrowReleased) {
            this.escrowReleased = escrowReleased;
            return this;
        }

        public Builder lastRelease(ReleaseResult lastRelease) {
            this.lastRelease = lastRelease;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder transactions(List<ChannelTransaction> transactions) {
            this.transactions = transactions;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public PaymentChannel build() {
            return new PaymentChannel(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PaymentChannel that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PaymentChannel{id='" + id + "', payer='" + payerId + "', payee='" + payeeId
                + "', state=" + state + ", balance=" + currentBalance.toPlainString()
                + ", escrowed=" + escrowedAmount.toPlainString() + "}";
    }
}
