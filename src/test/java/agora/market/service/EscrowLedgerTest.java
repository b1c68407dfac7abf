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
import agora.market.support.InMemoryLedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EscrowLedgerTest {

    private InMemoryLedgerRepository repository;
    private MarketMetrics metrics;
    private EscrowLedger ledger;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLedgerRepository();
        metrics = new MarketMetrics();
        ledger = new EscrowLedger(repository, metrics, true);
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    @Test
    void depositAndWithdraw() {
        ledger.deposit("alice", amount("100"));
        Account after = ledger.withdraw("alice", amount("30.5"));

        assertEquals(Money.of("69.5"), after.balance());
        assertEquals(Money.of("100"), after.totalDeposited());
        assertEquals(Money.of("30.5"), after.totalWithdrawn());
        assertEquals(Money.of("69.5"), ledger.getBalance("alice"));
        assertTrue(repository.findAccount("alice").isPresent());
    }

    @Test
    void unknownOwnerHasZeroBalance() {
        assertEquals(Money.ZERO, ledger.getBalance("nobody"));
        assertTrue(ledger.findAccount("nobody").isEmpty());
        assertThrows(AccountNotFoundException.class, () -> ledger.getAccount("nobody"));
        assertThrows(AccountNotFoundException.class, () -> ledger.withdraw("nobody", amount("1")));
    }

    @Test
    void rejectsNonPositiveAmounts() {
        assertThrows(InvalidAmountException.class, () -> ledger.deposit("alice", BigDecimal.ZERO));
        assertThrows(InvalidAmountException.class, () -> ledger.deposit("alice", amount("-5")));
        assertThrows(InvalidAmountException.class, () -> ledger.deposit("alice", null));
        assertEquals(0, repository.writes());
    }

    @Test
    void withdrawBeyondBalanceFails() {
        ledger.deposit("alice", amount("10"));

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> ledger.withdraw("alice", amount("10.00000001")));

        assertEquals("alice", e.ownerId());
        assertEquals(Money.of("10"), ledger.getBalance("alice"));
    }

    @Test
    void openChannelMovesFundsFromPayer() {
        ledger.deposit("alice", amount("100"));

        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("40"), "auc-1");

        assertEquals(ChannelState.OPEN, channel.state());
        assertEquals(Money.of("40"), channel.totalDeposit());
        assertEquals(Money.of("40"), channel.currentBalance());
        assertEquals("auc-1", channel.auctionRef());
        assertEquals(Money.of("60"), ledger.getBalance("alice"));
        assertEquals(Money.of("40"), ledger.getAccount("alice").lockedInChannels());
        assertEquals(1, channel.transactions().size());
        assertEquals(TransactionType.DEPOSIT, channel.transactions().get(0).type());
    }

    @Test
    void openChannelRequiresFunds() {
        ledger.deposit("alice", amount("10"));

        assertThrows(InsufficientFundsException.class,
                () -> ledger.openChannel("alice", "bob", amount("20"), null));
        assertThrows(InsufficientFundsException.class,
                () -> ledger.openChannel("carol", "bob", amount("1"), null));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.openChannel("alice", "alice", amount("1"), null));
        assertTrue(ledger.channelsFor("alice").isEmpty());
    }

    @Test
    @DisplayName("Successful task pays the payee and the channel stays balanced")
    void escrowReleaseOnSuccess() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);

        PaymentChannel escrowed = ledger.lockEscrow(channel.id(), "task-1", amount("20"));
        assertEquals(ChannelState.ESCROWED, escrowed.state());
        assertEquals(Money.of("30"), escrowed.currentBalance());
        assertEquals(Money.of("20"), escrowed.escrowedAmount());

        ReleaseResult result = ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);

        assertFalse(result.replay());
        assertEquals("bob", result.recipientId());
        assertEquals(Money.of("20"), result.amount());

        PaymentChannel after = ledger.getChannel(channel.id());
        assertEquals(ChannelState.OPEN, after.state());
        assertEquals(Money.of("30"), after.currentBalance());
        assertEquals(Money.ZERO, after.escrowedAmount());
        assertEquals(Money.of("20"), after.totalSettled());
        assertTrue(after.isBalanced());

        assertEquals(Money.of("20"), ledger.getBalance("bob"));
        assertEquals(Money.of("20"), ledger.getAccount("bob").totalEarned());
        assertEquals(Money.of("20"), ledger.getAccount("alice").totalSpent());
        assertEquals(Money.of("50"), ledger.getBalance("alice"));
    }

    @Test
    void escrowRefundOnFailure() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.lockEscrow(channel.id(), "task-1", amount("20"));

        ReleaseResult result = ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.FAILURE);

        assertEquals("alice", result.recipientId());
        PaymentChannel after = ledger.getChannel(channel.id());
        assertEquals(Money.of("50"), after.currentBalance());
        assertEquals(Money.ZERO, after.totalSettled());
        assertEquals(Money.ZERO, ledger.getBalance("bob"));
    }

    @Test
    void releaseIsIdempotent() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.lockEscrow(channel.id(), "task-1", amount("20"));

        ReleaseResult first = ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);
        ReleaseResult second = ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);
        ReleaseResult conflicting = ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.FAILURE);

        assertTrue(second.replay());
        assertEquals(first.sequence(), second.sequence());
        assertEquals(EscrowOutcome.SUCCESS, conflicting.outcome());
        assertEquals(Money.of("20"), ledger.getBalance("bob"));
    }

    @Test
    void releaseForOtherTaskIsRejected() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);

        assertThrows(InvalidChannelStateException.class,
                () -> ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS));

        ledger.lockEscrow(channel.id(), "task-1", amount("20"));
        assertThrows(InvalidChannelStateException.class,
                () -> ledger.releaseEscrow(channel.id(), "task-2", EscrowOutcome.SUCCESS));
    }

    @Test
    void lockEscrowRules() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);

        assertThrows(InsufficientChannelBalanceException.class,
                () -> ledger.lockEscrow(channel.id(), "task-1", amount("50.00000001")));
        assertThrows(ChannelNotFoundException.class,
                () -> ledger.lockEscrow("ch-missing", "task-1", amount("1")));

        ledger.lockEscrow(channel.id(), "task-1", amount("10"));
        assertThrows(InvalidChannelStateException.class,
                () -> ledger.lockEscrow(channel.id(), "task-2", amount("10")));
    }

    @Test
    void closeChannelRefundsRemainder() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.lockEscrow(channel.id(), "task-1", amount("20"));

        assertThrows(InvalidChannelStateException.class, () -> ledger.closeChannel(channel.id()));

        ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);
        PaymentChannel closed = ledger.closeChannel(channel.id());

        assertEquals(ChannelState.CLOSED, closed.state());
        assertEquals(Money.ZERO, closed.currentBalance());
        assertEquals(Money.of("50"), closed.totalDeposit());
        assertEquals(Money.of("20"), closed.totalSettled());
        assertEquals(Money.of("30"), closed.totalRefunded());
        assertTrue(closed.isBalanced());
        assertNotNull(closed.closedAt());
        assertEquals(Money.of("80"), ledger.getBalance("alice"));
        assertEquals(Money.ZERO, ledger.getAccount("alice").lockedInChannels());

        PaymentChannel again = ledger.closeChannel(channel.id());
        assertEquals(closed.sequence(), again.sequence());
        assertThrows(InvalidChannelStateException.class,
                () -> ledger.lockEscrow(channel.id(), "task-2", amount("1")));
    }

    @Test
    void transactionLogIsOrdered() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.lockEscrow(channel.id(), "task-1", amount("20"));
        ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);
        ledger.closeChannel(channel.id());

        List<ChannelTransaction> log = ledger.getChannel(channel.id()).transactions();
        assertEquals(List.of(TransactionType.DEPOSIT, TransactionType.ESCROW, TransactionType.RELEASE,
                TransactionType.CLOSE), log.stream().map(ChannelTransaction::type).toList());
        for (int i = 0; i < log.size(); i++) {
            assertEquals(i + 1, log.get(i).sequence());
        }
        assertEquals(4, ledger.transactionHistory("bob").size());
        assertTrue(ledger.transactionHistory("carol").isEmpty());
    }

    @Test
    @DisplayName("Concurrent releases of the same escrow pay out exactly once")
    void concurrentReleasePaysOnce() throws Exception {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.lockEscrow(channel.id(), "task-1", amount("20"));

        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReleaseResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);
                }));
            }
            start.countDown();

            int applied = 0;
            for (Future<ReleaseResult> f : futures) {
                if (!f.get(30, TimeUnit.SECONDS).replay()) {
                    applied++;
                }
            }
            assertEquals(1, applied);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(Money.of("20"), ledger.getBalance("bob"));
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    void concurrentDepositsAreAllApplied() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 100; i++) {
                futures.add(pool.submit(() -> ledger.deposit("alice", amount("1.5"))));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(Money.of("150"), ledger.getBalance("alice"));
    }

    @Test
    void failedWriteLeavesStateUnchanged() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        repository.failWrites(true);

        assertThrows(LedgerPersistenceException.class, () -> ledger.deposit("alice", amount("5")));
        assertThrows(LedgerPersistenceException.class,
                () -> ledger.lockEscrow(channel.id(), "task-1", amount("10")));

        assertEquals(Money.of("50"), ledger.getBalance("alice"));
        PaymentChannel unchanged = ledger.getChannel(channel.id());
        assertEquals(ChannelState.OPEN, unchanged.state());
        assertEquals(Money.of("50"), unchanged.currentBalance());

        repository.failWrites(false);
        assertEquals(ChannelState.ESCROWED,
                ledger.lockEscrow(channel.id(), "task-1", amount("10")).state());
    }

    @Test
    @DisplayName("A stored channel that disagrees with the committed state is frozen")
    void corruptedStoreFreezesChannel() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);

        repository.corruptChannelReads(true);
        LedgerInvariantViolationException e = assertThrows(LedgerInvariantViolationException.class,
                () -> ledger.lockEscrow(channel.id(), "task-1", amount("10")));
        repository.corruptChannelReads(false);

        assertEquals(channel.id(), e.channelId());
        assertEquals(ChannelState.FROZEN, ledger.getChannel(channel.id()).state());
        assertEquals(ChannelState.FROZEN, repository.storedChannel(channel.id()).state());
        assertEquals(1L, metrics.invariantViolations());

        assertThrows(ChannelFrozenException.class,
                () -> ledger.lockEscrow(channel.id(), "task-2", amount("1")));
        assertThrows(ChannelFrozenException.class,
                () -> ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS));
        assertThrows(InvalidChannelStateException.class, () -> ledger.closeChannel(channel.id()));
    }

    @Test
    void verifyInvariantOnHealthyChannel() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);

        assertEquals(ChannelState.OPEN, ledger.verifyInvariant(channel.id()).state());
        assertEquals(0L, metrics.invariantViolations());
    }

    @Test
    void ledgerAuditBalancesAcrossOperations() {
        ledger.deposit("alice", amount("100"));
        ledger.deposit("carol", amount("30"));
        PaymentChannel first = ledger.openChannel("alice", "bob", amount("50"), null);
        PaymentChannel second = ledger.openChannel("carol", "bob", amount("30"), null);
        ledger.lockEscrow(first.id(), "task-1", amount("20"));
        ledger.lockEscrow(second.id(), "task-2", amount("5"));
        ledger.releaseEscrow(first.id(), "task-1", EscrowOutcome.SUCCESS);
        ledger.withdraw("bob", amount("15"));

        LedgerAudit audit = ledger.verifyLedger();

        assertTrue(audit.balanced());
        assertEquals(Money.of("130"), audit.totalDeposited());
        assertEquals(Money.of("15"), audit.totalWithdrawn());
        assertEquals(Money.of("60"), audit.totalHeldInChannels());
        assertEquals(Money.of("20"), audit.totalSettled());
        assertEquals(Money.of("20"), audit.totalEarned());
    }

    @Test
    void stateIsRecoveredFromRepository() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.lockEscrow(channel.id(), "task-1", amount("20"));

        EscrowLedger restarted = new EscrowLedger(repository, metrics, true);

        assertEquals(Money.of("50"), restarted.getBalance("alice"));
        assertEquals(ChannelState.ESCROWED, restarted.getChannel(channel.id()).state());
        ReleaseResult result = restarted.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);
        assertFalse(result.replay());
        assertTrue(restarted.verifyLedger().balanced());
    }

    @Test
    void expiredEscrowsAreListed() throws InterruptedException {
        ledger.deposit("alice", amount("100"));
        PaymentChannel held = ledger.openChannel("alice", "bob", amount("50"), null);
        ledger.openChannel("alice", "carol", amount("10"), null);
        ledger.lockEscrow(held.id(), "task-1", amount("20"));

        Thread.sleep(20);

        assertEquals(List.of(held.id()),
                ledger.expiredEscrows(Duration.ofMillis(1)).stream().map(PaymentChannel::id).toList());
        assertTrue(ledger.expiredEscrows(Duration.ofMinutes(5)).isEmpty());
    }

    @Test
    @DisplayName("Closed channels past retention leave memory but stay readable and audited")
    void closedChannelsAreEvicted() {
        ledger.deposit("alice", amount("100"));
        PaymentChannel paid = ledger.openChannel("alice", "bob", amount("40"), "auction-1");
        ledger.lockEscrow(paid.id(), "task-1", amount("40"));
        ledger.releaseEscrow(paid.id(), "task-1", EscrowOutcome.SUCCESS);
        ledger.closeChannel(paid.id());
        PaymentChannel open = ledger.openChannel("alice", "carol", amount("10"), null);

        assertEquals(0, ledger.evictClosedChannels(Duration.ofMinutes(5)));
        assertEquals(1, ledger.evictClosedChannels(Duration.ZERO));
        assertEquals(1, ledger.activeChannelCount());

        PaymentChannel archived = ledger.getChannel(paid.id());
        assertEquals(ChannelState.CLOSED, archived.state());
        assertEquals(Money.of("40"), archived.totalSettled());
        assertEquals(ChannelState.CLOSED, ledger.closeChannel(paid.id()).state());
        assertEquals(Set.of(open.id(), paid.id()),
                ledger.channelsFor("alice").stream().map(PaymentChannel::id).collect(Collectors.toSet()));
        assertTrue(ledger.transactionHistory("bob").stream()
                .anyMatch(tx -> tx.type() == TransactionType.RELEASE));

        LedgerAudit audit = ledger.verifyLedger();
        assertTrue(audit.balanced(), audit.toString());
        assertEquals(Money.of("40"), audit.totalSettled());

        EscrowLedger restarted = new EscrowLedger(repository, metrics, true);
        assertEquals(1, restarted.activeChannelCount());
        assertTrue(restarted.verifyLedger().balanced());
        assertThrows(ChannelNotFoundException.class, () -> restarted.getChannel("ch-missing"));
    }

    @Test
    void abandonedAuctionChannelsAreListed() throws InterruptedException {
        ledger.deposit("alice", amount("100"));
        PaymentChannel auctionChannel = ledger.openChannel("alice", "bob", amount("20"), "auction-1");
        ledger.openChannel("alice", "carol", amount("10"), null);

        Thread.sleep(20);

        assertEquals(List.of(auctionChannel.id()),
                ledger.abandonedAuctionChannels(Duration.ofMillis(1)).stream().map(PaymentChannel::id).toList());
        assertTrue(ledger.abandonedAuctionChannels(Duration.ofMinutes(5)).isEmpty());
    }
}
