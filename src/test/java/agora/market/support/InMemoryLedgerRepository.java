package agora.market.support;

import agora.market.model.Account;
import agora.market.model.ChannelState;
import agora.market.model.Money;
import agora.market.model.PaymentChannel;
import agora.market.repository.LedgerRepository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed ledger store with switches for simulating storage faults.
 */
public class InMemoryLedgerRepository implements LedgerRepository {

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final Map<String, PaymentChannel> channels = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    private final AtomicInteger attempts = new AtomicInteger();

    private volatile boolean failWrites;
    private volatile int failOnAttempt;
    private volatile boolean corruptChannelReads;

    @Override
    public List<Account> findAllAccounts() {
        return new ArrayList<>(accounts.values());
    }

    @Override
    public List<PaymentChannel> findAllChannels() {
        return new ArrayList<>(channels.values());
    }

    @Override
    public List<PaymentChannel> findActiveChannels() {
        return channels.values().stream()
                .filter(c -> c.state() != ChannelState.CLOSED)
                .toList();
    }

    @Override
    public List<PaymentChannel> findChannelsFor(String ownerId) {
        return channels.values().stream()
                .filter(c -> c.involves(ownerId))
                .toList();
    }

    @Override
    public BigDecimal settledInClosedChannels() {
        return channels.values().stream()
                .filter(c -> c.state() == ChannelState.CLOSED)
                .map(PaymentChannel::totalSettled)
                .reduce(Money.ZERO, BigDecimal::add);
    }

    @Override
    public Optional<Account> findAccount(String ownerId) {
        return Optional.ofNullable(accounts.get(ownerId));
    }

    @Override
    public Optional<PaymentChannel> findChannel(String channelId) {
        PaymentChannel stored = channels.get(channelId);
        if (stored != null && corruptChannelReads) {
            return Optional.of(stored.toBuilder()
                    .currentBalance(stored.currentBalance().add(BigDecimal.ONE))
                    .build());
        }
        return Optional.ofNullable(stored);
    }

    @Override
    public synchronized void saveAll(Collection<Account> touched, PaymentChannel channel) {
        int attempt = attempts.incrementAndGet();
        if (failWrites || attempt == failOnAttempt) {
            throw new RuntimeException("simulated storage failure");
        }
        for (Account account : touched) {
            accounts.put(account.ownerId(), account);
        }
        if (channel != null) {
            channels.put(channel.id(), channel);
        }
        writes.incrementAndGet();
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    /** Fail only the n-th write attempt from now on, counting from 1 */
    public void failAttempt(int n) {
        this.failOnAttempt = attempts.get() + n;
    }

    public void corruptChannelReads(boolean corrupt) {
        this.corruptChannelReads = corrupt;
    }

    public int writes() {
        return writes.get();
    }

    public PaymentChannel storedChannel(String channelId) {
        return channels.get(channelId);
    }
}
