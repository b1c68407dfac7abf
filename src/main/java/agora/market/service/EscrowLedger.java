package agora.market.service;

import agora.market.exception.AccountNotFoundException;
import agora.market.exception.ChannelFrozenException;
import agora.market.exception.ChannelNotFoundException;
import agora.market.exception.InsufficientChannelBalanceException;
import agora.market.exception.InsufficientFundsException;
import agora.market.exception.InvalidAmountException;
import agora.market.exception.InvalidChannelStateException;
import agora.market.exception.LedgerInvariantViolationException;
import agora.market.exception.LedgerPersistenceException;
import agora.market.metrics.MarketMetrics;
import agora.market.model.Account;
import agora.market.model.ChannelState;
import agora.market.model.ChannelTransaction;
import agora.market.model.EscrowOutcome;
import agora.market.model.LedgerAudit;
import agora.market.model.Money;
import agora.market.model.PaymentChannel;
import agora.market.model.ReleaseResult;
import agora.market.model.TransactionType;
import agora.market.repository.LedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Accounts and payment channels. The only component that moves money.
 *
 * <p>
 * Every mutating call locks the channel it touches first, then the involved accounts
 * in owner-id order, computes the new snapshots, checks the channel invariant and
 * persists all touched entities in one store transaction. The in-memory working set
 * is updated only after the store commit succeeds, so a failed write leaves the
 * previous state in place.
 *
 * <p>
 * A channel that fails its invariant is frozen and rejects further mutation.
 *
 * <p>
 * CLOSED channels are evicted from memory after a retention period and read back from the
 * store on demand. Their settled totals are carried in {@code archivedSettled} so the
 * ledger audit stays complete.
 */
public class EscrowLedger {

    private static final Logger log = LoggerFactory.getLogger(EscrowLedger.class);

    private final LedgerRepository repository;
    private final MarketMetrics metrics;
    private final boolean selfCheck;

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final Map<String, PaymentChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> channelLocks = new ConcurrentHashMap<>();
    private final AtomicReference<BigDecimal> archivedSettled = new AtomicReference<>(Money.ZERO);

    public EscrowLedger(LedgerRepository repository, MarketMetrics metrics, boolean selfCheck) {
        this.repository = repository;
        this.metrics = metrics;
        this.selfCheck = selfCheck;
        recover();
    }

    private void recover() {
        for (Account account : repository.findAllAccounts()) {
            accounts.put(account.ownerId(), account);
        }
        for (PaymentChannel channel : repository.findActiveChannels()) {
            channels.put(channel.id(), channel);
        }
        archivedSettled.set(Money.normalize(repository.settledInClosedChannels()));
        log.info("Ledger loaded: {} accounts, {} active channels", accounts.size(), channels.size());
    }

    // ---------- Accounts ----------

    public Account deposit(String ownerId, BigDecimal amount) {
        requireOwner(ownerId);
        BigDecimal value = requirePositive(amount);

        return withLocks(null, List.of(ownerId), () -> {
            Instant now = Instant.now();
            Account current = accounts.getOrDefault(ownerId, Account.open(ownerId, now));
            Account updated = current.toBuilder()
                    .balance(current.balance().add(value))
                    .totalDeposited(current.totalDeposited().add(value))
                    .updatedAt(now)
                    .build();

            commit(List.of(updated), null);
            log.info("Deposit {} -> {} (balance {})", value.toPlainString(), ownerId,
                    updated.balance().toPlainString());
            return updated;
        });
    }

    public Account withdraw(String ownerId, BigDecimal amount) {
        requireOwner(ownerId);
        BigDecimal value = requirePositive(amount);

        return withLocks(null, List.of(ownerId), () -> {
            Account current = requireAccount(ownerId);
            if (current.balance().compareTo(value) < 0) {
                log.warn("Withdrawal of {} by {} rejected: balance {}", value.toPlainString(), ownerId,
                        current.balance().toPlainString());
                throw new InsufficientFundsException(ownerId, current.balance(), value);
            }
            Account updated = current.toBuilder()
                    .balance(current.balance().subtract(value))
                    .totalWithdrawn(current.totalWithdrawn().add(value))
                    .updatedAt(Instant.now())
                    .build();

            commit(List.of(updated), null);
            log.info("Withdrawal {} <- {} (balance {})", value.toPlainString(), ownerId,
                    updated.balance().toPlainString());
            return updated;
        });
    }

    /** Spendable balance; zero for unknown owners */
    public BigDecimal getBalance(String ownerId) {
        Account account = accounts.get(ownerId);
        return account == null ? Money.ZERO : account.balance();
    }

    public Account getAccount(String ownerId) {
        return requireAccount(ownerId);
    }

    public Optional<Account> findAccount(String ownerId) {
        return Optional.ofNullable(accounts.get(ownerId));
    }

    // ---------- Channels ----------

    /**
     * Open a channel funded from the payer's balance.
     */
    public PaymentChannel openChannel(String payerId, String payeeId, BigDecimal deposit, String auctionRef) {
        requireOwner(payerId);
        requireOwner(payeeId);
        if (payerId.equals(payeeId)) {
            throw new IllegalArgumentException("payer and payee must differ");
        }
        BigDecimal value = requirePositive(deposit);

        return withLocks(null, List.of(payerId, payeeId), () -> {
            Account payer = accounts.get(payerId);
            BigDecimal available = payer == null ? Money.ZERO : payer.balance();
            if (available.compareTo(value) < 0) {
                log.warn("Channel {} -> {} rejected: balance {} below deposit {}", payerId, payeeId,
                        available.toPlainString(), value.toPlainString());
                throw new InsufficientFundsException(payerId, available, value);
            }

            Instant now = Instant.now();
            String channelId = "ch-" + UUID.randomUUID();
            PaymentChannel opening = PaymentChannel.builder()
                    .id(channelId)
                    .payerId(payerId)
                    .payeeId(payeeId)
                    .auctionRef(auctionRef)
                    .state(ChannelState.OPENING)
                    .totalDeposit(value)
                    .currentBalance(value)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            PaymentChannel opened = opening.toBuilder().state(ChannelState.OPEN).build()
                    .append(entry(opening, TransactionType.DEPOSIT, value, null, "channel funded", now));

            Account debited = payer.toBuilder()
                    .balance(payer.balance().subtract(value))
                    .lockedInChannels(payer.lockedInChannels().add(value))
                    .updatedAt(now)
                    .build();

            commit(List.of(debited), opened);
            metrics.channelOpened();
            log.info("Channel {} opened: {} -> {} deposit {} (auction {})", channelId, payerId, payeeId,
                    value.toPlainString(), auctionRef);
            return opened;
        });
    }

    /**
     * Move funds from the channel balance into escrow for a task.
     */
    public PaymentChannel lockEscrow(String channelId, String taskId, BigDecimal amount) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        BigDecimal value = requirePositive(amount);
        requireChannel(channelId);

        return withLocks(channelId, List.of(), () -> {
            PaymentChannel current = requireChannel(channelId);
            requireState(current, ChannelState.OPEN);
            if (current.currentBalance().compareTo(value) < 0) {
                log.warn("Escrow of {} on channel {} rejected: channel balance {}", value.toPlainString(),
                        channelId, current.currentBalance().toPlainString());
                throw new InsufficientChannelBalanceException("Channel " + channelId + " balance "
                        + current.currentBalance().toPlainString() + " below escrow " + value.toPlainString());
            }

            Instant now = Instant.now();
            PaymentChannel escrowed = current.toBuilder()
                    .state(ChannelState.ESCROWED)
                    .currentBalance(current.currentBalance().subtract(value))
                    .escrowedAmount(current.escrowedAmount().add(value))
                    .escrowTaskId(taskId)
                    .escrowLockedAt(now)
                    .escrowReleased(false)
                    .lastRelease(null)
                    .updatedAt(now)
                    .build();
            escrowed = escrowed.append(entry(escrowed, TransactionType.ESCROW, value, taskId, "escrow locked", now));

            commit(List.of(), escrowed);
            metrics.escrowLocked();
            log.info("Escrow {} locked on channel {} for task {}", value.toPlainString(), channelId, taskId);
            return escrowed;
        });
    }

    /**
     * Resolve the escrow held for a task. SUCCESS pays the payee, FAILURE returns the funds to
     * the channel balance.
     *
     * <p>
     * The released flag is checked and set under the channel lock: a repeated call for the
     * same task returns the original result marked as a replay and changes nothing.
     */
    public ReleaseResult releaseEscrow(String channelId, String taskId, EscrowOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        PaymentChannel snapshot = requireChannel(channelId);

        return withLocks(channelId, List.of(snapshot.payerId(), snapshot.payeeId()), () -> {
            PaymentChannel current = requireChannel(channelId);

            ReleaseResult previous = current.lastRelease();
            if (current.escrowReleased() && previous != null && previous.taskId().equals(taskId)) {
                log.info("Escrow release for task {} on channel {} already applied ({})", taskId, channelId,
                        previous.outcome());
                return previous.asReplay();
            }

            requireState(current, ChannelState.ESCROWED);
            if (!current.escrowTaskId().equals(taskId)) {
                throw new InvalidChannelStateException("Channel " + channelId + " escrow is held for task "
                        + current.escrowTaskId() + ", not " + taskId);
            }

            Instant now = Instant.now();
            BigDecimal amount = current.escrowedAmount();
            PaymentChannel settling = current.toBuilder().state(ChannelState.SETTLING).build();

            List<Account> touched = new ArrayList<>();
            PaymentChannel.Builder next = settling.toBuilder()
                    .escrowedAmount(Money.ZERO)
                    .escrowReleased(true)
                    .updatedAt(now);
            TransactionType type;
            String recipient;

            if (outcome == EscrowOutcome.SUCCESS) {
                next.totalSettled(settling.totalSettled().add(amount));
                type = TransactionType.RELEASE;
                recipient = current.payeeId();

                Account payer = requireAccount(current.payerId());
                Account payee = accounts.getOrDefault(current.payeeId(), Account.open(current.payeeId(), now));
                touched.add(payer.toBuilder()
                        .lockedInChannels(payer.lockedInChannels().subtract(amount))
                        .totalSpent(payer.totalSpent().add(amount))
                        .updatedAt(now)
                        .build());
                touched.add(payee.toBuilder()
                        .balance(payee.balance().add(amount))
                        .totalEarned(payee.totalEarned().add(amount))
                        .updatedAt(now)
                        .build());
            } else {
                next.currentBalance(settling.currentBalance().add(amount));
                type = TransactionType.REFUND;
                recipient = current.payerId();
            }

            long sequence = current.sequence() + 1;
            ReleaseResult result = new ReleaseResult(channelId, taskId, outcome, amount, recipient, sequence,
                    now, false);
            PaymentChannel released = next.state(ChannelState.OPEN).lastRelease(result).build();
            released = released.append(entry(released, type, amount, taskId,
                    outcome == EscrowOutcome.SUCCESS ? "task completed" : "task failed", now));

            commit(touched, released);
            if (outcome == EscrowOutcome.SUCCESS) {
                metrics.escrowReleased(amount);
            } else {
                metrics.escrowRefunded(amount);
            }
            log.info("Escrow on channel {} for task {} {}: {} -> {}", channelId, taskId,
                    outcome == EscrowOutcome.SUCCESS ? "released" : "refunded", amount.toPlainString(), recipient);
            return result;
        });
    }

    /**
     * Close a channel and return its remaining balance to the payer.
     * Closing an already closed channel returns it unchanged.
     */
    public PaymentChannel closeChannel(String channelId) {
        PaymentChannel snapshot = channelId == null ? null : channels.get(channelId);
        if (snapshot == null) {
            return archivedChannel(channelId)
                    .orElseThrow(() -> new ChannelNotFoundException("Channel not found: " + channelId));
        }

        return withLocks(channelId, List.of(snapshot.payerId()), () -> {
            PaymentChannel current = requireChannel(channelId);
            if (current.state() == ChannelState.CLOSED) {
                return current;
            }
            if (current.state() == ChannelState.ESCROWED || current.state() == ChannelState.SETTLING) {
                throw new InvalidChannelStateException("Channel " + channelId + " has an active escrow");
            }
            requireState(current, ChannelState.OPEN);

            Instant now = Instant.now();
            BigDecimal refund = current.currentBalance();
            Account payer = requireAccount(current.payerId());
            Account credited = payer.toBuilder()
                    .balance(payer.balance().add(refund))
                    .lockedInChannels(payer.lockedInChannels().subtract(refund))
                    .updatedAt(now)
                    .build();

            PaymentChannel closed = current.toBuilder()
                    .state(ChannelState.CLOSED)
                    .currentBalance(Money.ZERO)
                    .totalRefunded(current.totalRefunded().add(refund))
                    .updatedAt(now)
                    .closedAt(now)
                    .build();
            closed = closed.append(entry(closed, TransactionType.CLOSE, refund, null, "channel closed", now));

            commit(List.of(credited), closed);
            metrics.channelClosed();
            log.info("Channel {} closed, {} returned to {}", channelId, refund.toPlainString(), current.payerId());
            return closed;
        });
    }

    /**
     * Recheck a channel's invariant, freezing it on violation.
     */
    public PaymentChannel verifyInvariant(String channelId) {
        requireChannel(channelId);
        return withLocks(channelId, List.of(), () -> {
            PaymentChannel current = requireChannel(channelId);
            if (!current.isBalanced()) {
                throw freeze(current, describe(current));
            }
            return current;
        });
    }

    /**
     * Ledger-wide check: all deposits are accounted for by withdrawals, account balances and
     * funds held in channels. Takes every lock, channels first.
     */
    public LedgerAudit verifyLedger() {
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (String channelId : new TreeSet<>(channels.keySet())) {
                ReentrantLock lock = channelLock(channelId);
                lock.lock();
                held.add(lock);
            }
            for (String ownerId : new TreeSet<>(accounts.keySet())) {
                ReentrantLock lock = accountLock(ownerId);
                lock.lock();
                held.add(lock);
            }

            BigDecimal deposited = Money.ZERO;
            BigDecimal withdrawn = Money.ZERO;
            BigDecimal balances = Money.ZERO;
            BigDecimal earned = Money.ZERO;
            BigDecimal spent = Money.ZERO;
            for (Account account : accounts.values()) {
                deposited = deposited.add(account.totalDeposited());
                withdrawn = withdrawn.add(account.totalWithdrawn());
                balances = balances.add(account.balance());
                earned = earned.add(account.totalEarned());
                spent = spent.add(account.totalSpent());
            }

            BigDecimal inChannels = Money.ZERO;
            BigDecimal settled = archivedSettled.get();
            for (PaymentChannel channel : channels.values()) {
                inChannels = inChannels.add(channel.heldAmount());
                settled = settled.add(channel.totalSettled());
            }

            boolean balanced = deposited.compareTo(withdrawn.add(balances).add(inChannels)) == 0
                    && earned.compareTo(spent) == 0
                    && earned.compareTo(settled) == 0;
            if (!balanced) {
                metrics.invariantViolation();
                log.error("LEDGER INVARIANT VIOLATION: deposited={} withdrawn={} balances={} inChannels={} "
                        + "earned={} spent={} settled={}",
                        deposited.toPlainString(), withdrawn.toPlainString(), balances.toPlainString(),
                        inChannels.toPlainString(), earned.toPlainString(), spent.toPlainString(),
                        settled.toPlainString());
            }
            return new LedgerAudit(deposited, withdrawn, balances, inChannels, settled, earned, balanced);
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    /** Live channel, or the stored copy of an evicted one */
    public PaymentChannel getChannel(String channelId) {
        PaymentChannel channel = channelId == null ? null : channels.get(channelId);
        if (channel != null) {
            return channel;
        }
        return archivedChannel(channelId)
                .orElseThrow(() -> new ChannelNotFoundException("Channel not found: " + channelId));
    }

    /** Channels where the owner is payer or payee, newest first, evicted ones included */
    public List<PaymentChannel> channelsFor(String ownerId) {
        Map<String, PaymentChannel> merged = new HashMap<>();
        for (PaymentChannel stored : repository.findChannelsFor(ownerId)) {
            merged.put(stored.id(), stored);
        }
        for (PaymentChannel live : channels.values()) {
            if (live.involves(ownerId)) {
                merged.put(live.id(), live);
            }
        }
        return merged.values().stream()
                .sorted(Comparator.comparing(PaymentChannel::createdAt).reversed())
                .toList();
    }

    /** All log entries of the owner's channels in time order */
    public List<ChannelTransaction> transactionHistory(String ownerId) {
        return channelsFor(ownerId).stream()
                .flatMap(c -> c.transactions().stream())
                .sorted(Comparator.comparing(ChannelTransaction::timestamp)
                        .thenComparing(ChannelTransaction::channelId)
                        .thenComparingLong(ChannelTransaction::sequence))
                .toList();
    }

    /** Channels whose escrow has been held longer than the given duration */
    public List<PaymentChannel> expiredEscrows(Duration holdTimeout) {
        Instant cutoff = Instant.now().minus(holdTimeout);
        return channels.values().stream()
                .filter(c -> c.state() == ChannelState.ESCROWED)
                .filter(c -> c.escrowLockedAt() != null && c.escrowLockedAt().isBefore(cutoff))
                .toList();
    }

    /**
     * Auction channels still OPEN with no activity since the cutoff. An allocation closes its
     * channel when it finishes, so these were left behind by a failed close.
     */
    public List<PaymentChannel> abandonedAuctionChannels(Duration idleTimeout) {
        Instant cutoff = Instant.now().minus(idleTimeout);
        return channels.values().stream()
                .filter(c -> c.state() == ChannelState.OPEN)
                .filter(c -> c.auctionRef() != null)
                .filter(c -> c.updatedAt() != null && c.updatedAt().isBefore(cutoff))
                .toList();
    }

    /**
     * Drop CLOSED channels older than the retention period from memory. They stay readable
     * through {@link #getChannel}, {@link #channelsFor} and {@link #transactionHistory}.
     *
     * @return number of channels evicted
     */
    public int evictClosedChannels(Duration retention) {
        Instant cutoff = Instant.now().minus(retention);
        List<String> candidates = channels.values().stream()
                .filter(c -> c.state() == ChannelState.CLOSED)
                .filter(c -> c.closedAt() != null && !c.closedAt().isAfter(cutoff))
                .map(PaymentChannel::id)
                .toList();

        int evicted = 0;
        for (String channelId : candidates) {
            ReentrantLock lock = channelLock(channelId);
            lock.lock();
            try {
                PaymentChannel current = channels.get(channelId);
                if (current == null || current.state() != ChannelState.CLOSED) {
                    continue;
                }
                archivedSettled.accumulateAndGet(current.totalSettled(), BigDecimal::add);
                channels.remove(channelId);
                evicted++;
            } finally {
                lock.unlock();
                channelLocks.remove(channelId, lock);
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} closed channel(s) from memory", evicted);
        }
        return evicted;
    }

    public int activeChannelCount() {
        return channels.size();
    }

    // ---------- Internals ----------

    private Optional<PaymentChannel> archivedChannel(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        return repository.findChannel(channelId).filter(c -> c.state() == ChannelState.CLOSED);
    }

    /**
     * Run an action holding the channel lock (if any) and then the account locks in owner-id order.
     */
    private <T> T withLocks(String channelId, Collection<String> ownerIds, Supplier<T> action) {
        List<ReentrantLock> held = new ArrayList<>();
        try {
            if (channelId != null) {
                ReentrantLock lock = channelLock(channelId);
                lock.lock();
                held.add(lock);
            }
            for (String ownerId : new TreeSet<>(ownerIds)) {
                ReentrantLock lock = accountLock(ownerId);
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    // Caller holds the locks of every entity passed in
    private void commit(List<Account> touched, PaymentChannel channel) {
        if (channel != null && !channel.isBalanced()) {
            PaymentChannel stored = channels.get(channel.id());
            throw freeze(stored != null ? stored : channel, describe(channel));
        }
        for (Account account : touched) {
            if (!account.isConsistent()) {
                metrics.invariantViolation();
                log.error("LEDGER INVARIANT VIOLATION on account {}: balance={} expected={}", account.ownerId(),
                        account.balance().toPlainString(), account.expectedBalance().toPlainString());
                throw new LedgerInvariantViolationException(null,
                        "Account " + account.ownerId() + " failed its balance invariant");
            }
        }

        try {
            repository.saveAll(touched, channel);
        } catch (RuntimeException e) {
            log.error("Ledger write failed, in-memory state unchanged", e);
            throw new LedgerPersistenceException("Failed to persist ledger update", e);
        }

        for (Account account : touched) {
            accounts.put(account.ownerId(), account);
        }
        if (channel != null) {
            channels.put(channel.id(), channel);
        }

        if (selfCheck && channel != null) {
            verifyStored(channel);
        }
    }

    // Read-back check: the stored channel must match the committed snapshot
    private void verifyStored(PaymentChannel committed) {
        PaymentChannel stored = repository.findChannel(committed.id()).orElse(null);
        if (stored == null
                || !stored.isBalanced()
                || stored.sequence() != committed.sequence()
                || stored.currentBalance().compareTo(committed.currentBalance()) != 0
                || stored.escrowedAmount().compareTo(committed.escrowedAmount()) != 0
                || stored.totalSettled().compareTo(committed.totalSettled()) != 0
                || stored.totalRefunded().compareTo(committed.totalRefunded()) != 0) {
            throw freeze(committed, "stored state differs from committed state: "
                    + (stored == null ? "missing" : describe(stored)));
        }
    }

    // Caller holds the channel lock
    private LedgerInvariantViolationException freeze(PaymentChannel channel, String detail) {
        metrics.invariantViolation();
        log.error("LEDGER INVARIANT VIOLATION on channel {}: {} - channel frozen", channel.id(), detail);

        PaymentChannel frozen = channel.toBuilder()
                .state(ChannelState.FROZEN)
                .updatedAt(Instant.now())
                .build();
        try {
            repository.saveAll(List.of(), frozen);
        } catch (RuntimeException e) {
            log.error("Failed to persist frozen state of channel {}", channel.id(), e);
        }
        channels.put(frozen.id(), frozen);
        return new LedgerInvariantViolationException(channel.id(), "Channel " + channel.id() + " invariant violated: "
                + detail);
    }

    private static String describe(PaymentChannel c) {
        return "deposit=" + c.totalDeposit().toPlainString()
                + " balance=" + c.currentBalance().toPlainString()
                + " escrowed=" + c.escrowedAmount().toPlainString()
                + " settled=" + c.totalSettled().toPlainString()
                + " refunded=" + c.totalRefunded().toPlainString();
    }

    private static ChannelTransaction entry(PaymentChannel after, TransactionType type, BigDecimal amount,
            String taskId, String reason, Instant now) {
        return new ChannelTransaction(
                "tx-" + UUID.randomUUID(),
                after.id(),
                after.sequence() + 1,
                type,
                amount,
                taskId,
                reason,
                after.currentBalance(),
                after.escrowedAmount(),
                after.totalSettled(),
                now);
    }

    private static void requireState(PaymentChannel channel, ChannelState expected) {
        if (channel.state() == ChannelState.FROZEN) {
            throw new ChannelFrozenException(channel.id());
        }
        if (channel.state() != expected) {
            throw new InvalidChannelStateException("Channel " + channel.id() + " is " + channel.state()
                    + ", expected " + expected);
        }
    }

    private Account requireAccount(String ownerId) {
        Account account = accounts.get(ownerId);
        if (account == null) {
            throw new AccountNotFoundException("Account not found: " + ownerId);
        }
        return account;
    }

    private PaymentChannel requireChannel(String channelId) {
        PaymentChannel channel = channelId == null ? null : channels.get(channelId);
        if (channel == null) {
            throw new ChannelNotFoundException("Channel not found: " + channelId);
        }
        return channel;
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("owner id is required");
        }
    }

    private static BigDecimal requirePositive(BigDecimal amount) {
        if (!Money.isPositive(amount)) {
            throw new InvalidAmountException("amount must be positive");
        }
        return Money.normalize(amount);
    }

    private ReentrantLock accountLock(String ownerId) {
        return accountLocks.computeIfAbsent(ownerId, k -> new ReentrantLock());
    }

    private ReentrantLock channelLock(String channelId) {
        return channelLocks.computeIfAbsent(channelId, k -> new ReentrantLock());
    }
}
