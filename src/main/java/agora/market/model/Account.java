package agora.market.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable ledger account snapshot.
 *
 * <p>
 * Invariant: {@code balance = totalDeposited + totalEarned - totalWithdrawn - totalSpent - lockedInChannels}
 * and {@code balance >= 0}.
 */
public final class Account {

    private final String ownerId;
    private final BigDecimal balance;
    private final BigDecimal totalDeposited;
    private final BigDecimal totalWithdrawn;
    private final BigDecimal totalEarned;
    private final BigDecimal totalSpent;
    private final BigDecimal lockedInChannels;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Account(Builder builder) {
        this.ownerId = Objects.requireNonNull(builder.ownerId, "ownerId is required");
        this.balance = Money.normalize(builder.balance);
        this.totalDeposited = Money.normalize(builder.totalDeposited);
        this.totalWithdrawn = Money.normalize(builder.totalWithdrawn);
        this.totalEarned = Money.normalize(builder.totalEarned);
        this.totalSpent = Money.normalize(builder.totalSpent);
        this.lockedInChannels = Money.normalize(builder.lockedInChannels);
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    /** Empty account for a new owner */
    public static Account open(String ownerId, Instant now) {
        return builder().ownerId(ownerId).createdAt(now).updatedAt(now).build();
    }

    public String ownerId() {
        return ownerId;
    }

    public BigDecimal balance() {
        return balance;
    }

    public BigDecimal totalDeposited() {
        return totalDeposited;
    }

    public BigDecimal totalWithdrawn() {
        return totalWithdrawn;
    }

    public BigDecimal totalEarned() {
        return totalEarned;
    }

    public BigDecimal totalSpent() {
        return totalSpent;
    }

    public BigDecimal lockedInChannels() {
        return lockedInChannels;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Balance expected from the running totals */
    public BigDecimal expectedBalance() {
        return totalDeposited
                .add(totalEarned)
                .subtract(totalWithdrawn)
                .subtract(totalSpent)
                .subtract(lockedInChannels);
    }

    public boolean isConsistent() {
        return balance.signum() >= 0
                && lockedInChannels.signum() >= 0
                && balance.compareTo(expectedBalance()) == 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .ownerId(ownerId)
                .balance(balance)
                .totalDeposited(totalDeposited)
                .totalWithdrawn(totalWithdrawn)
                .totalEarned(totalEarned)
                .totalSpent(totalSpent)
                .lockedInChannels(lockedInChannels)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String ownerId;
        private BigDecimal balance;
        private BigDecimal totalDeposited;
        private BigDecimal totalWithdrawn;
        private BigDecimal totalEarned;
        private BigDecimal totalSpent;
        private BigDecimal lockedInChannels;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder balance(BigDecimal balance) {
            this.balance = balance;
            return this;
        }

        public Builder totalDeposited(BigDecimal totalDeposited) {
            this.totalDeposited = totalDeposited;
            return this;
        }

        public Builder totalWithdrawn(BigDecimal totalWithdrawn) {
            this.totalWithdrawn = totalWithdrawn;
            return this;
        }

        public Builder totalEarned(BigDecimal totalEarned) {
            this.totalEarned = totalEarned;
            return this;
        }

        public Builder totalSpent(BigDecimal totalSpent) {
            this.totalSpent = totalSpent;
            return this;
        }

        public Builder lockedInChannels(BigDecimal lockedInChannels) {
            this.lockedInChannels = lockedInChannels;
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

        public Account build() {
            return new Account(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Account that))
            return false;
        return Objects.equals(ownerId, that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId);
    }

    @Override
    public String toString() {
        return "Account{ownerId='" + ownerId + "', balance=" + balance.toPlainString() + "}";
    }
}
