package agora.market.store;

import agora.market.config.MarketConfig;
import agora.market.metrics.MarketMetrics;
import agora.market.model.Account;
import agora.market.model.ChannelState;
import agora.market.model.EscrowOutcome;
import agora.market.model.Money;
import agora.market.model.PaymentChannel;
import agora.market.model.ReleaseResult;
import agora.market.model.TransactionType;
import agora.market.service.EscrowLedger;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLedgerRepositoryTest {

    private static Database db;
    private static JdbcLedgerRepository repo;

    @BeforeAll
    static void setup() {
        MarketConfig config = MarketConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-ledger;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcLedgerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM channels");
            st.execute("DELETE FROM accounts");
            conn.commit();
        }
    }

    @Test
    void saveAndFindAccount() {
        Account account = Account.builder()
                .ownerId("alice")
                .balance(new BigDecimal("70.5"))
                .totalDeposited(new BigDecimal("100"))
                .lockedInChannels(new BigDecimal("29.5"))
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();

        repo.saveAll(List.of(account), null);

        Optional<Account> found = repo.findAccount("alice");
        assertTrue(found.isPresent());
        assertEquals(Money.of("70.5"), found.get().balance());
        assertEquals(Money.of("100"), found.get().totalDeposited());
        assertEquals(Money.of("29.5"), found.get().lockedInChannels());
        assertTrue(found.get().isConsistent());
        assertNotNull(found.get().createdAt());

        assertTrue(repo.findAccount("bob").isEmpty());
    }

    @Test
    void upsertReplacesAccount() {
        Account first = Account.open("alice", Instant.now()).toBuilder()
                .balance(new BigDecimal("10"))
                .totalDeposited(new BigDecimal("10"))
                .build();
        repo.saveAll(List.of(first), null);
        repo.saveAll(List.of(first.toBuilder()
                .balance(new BigDecimal("25"))
                .totalDeposited(new BigDecimal("25"))
                .build()), null);

        assertEquals(1, repo.findAllAccounts().size());
        assertEquals(Money.of("25"), repo.findAccount("alice").orElseThrow().balance());
    }

    @Test
    @DisplayName("Channel with transaction log and last release survives a round trip through the store")
    void channelRoundTripThroughLedger() {
        EscrowLedger ledger = new EscrowLedger(repo, new MarketMetrics(), true);
        ledger.deposit("alice", new BigDecimal("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", new BigDecimal("40"), "auc-1");
        ledger.lockEscrow(channel.id(), "task-1", new BigDecimal("15"));
        ReleaseResult release = ledger.releaseEscrow(channel.id(), "task-1", EscrowOutcome.SUCCESS);

        PaymentChannel stored = repo.findChannel(channel.id()).orElseThrow();

        assertEquals(ChannelState.OPEN, stored.state());
        assertEquals("auc-1", stored.auctionRef());
        assertEquals(Money.of("40"), stored.totalDeposit());
        assertEquals(Money.of("25"), stored.currentBalance());
        assertEquals(Money.of("15"), stored.totalSettled());
        assertTrue(stored.escrowReleased());
        assertEquals("task-1", stored.escrowTaskId());
        assertEquals(3, stored.sequence());
        assertEquals(List.of(TransactionType.DEPOSIT, TransactionType.ESCROW, TransactionType.RELEASE),
                stored.transactions().stream().map(t -> t.type()).toList());
        assertEquals(release.sequence(), stored.lastRelease().sequence());
        assertEquals(EscrowOutcome.SUCCESS, stored.lastRelease().outcome());
        assertTrue(stored.isBalanced());

        assertEquals(Money.of("15"), repo.findAccount("bob").orElseThrow().balance());
        assertEquals(2, repo.findAllAccounts().size());
        assertEquals(1, repo.findAllChannels().size());
    }

    @Test
    void ledgerRecoversFromStore() {
        EscrowLedger ledger = new EscrowLedger(repo, new MarketMetrics(), false);
        ledger.deposit("alice", new BigDecimal("100"));
        PaymentChannel channel = ledger.openChannel("alice", "bob", new BigDecimal("40"), null);
        ledger.lockEscrow(channel.id(), "task-1", new BigDecimal("15"));

        EscrowLedger restarted = new EscrowLedger(repo, new MarketMetrics(), false);

        assertEquals(Money.of("60"), restarted.getBalance("alice"));
        assertEquals(ChannelState.ESCROWED, restarted.getChannel(channel.id()).state());
        restarted.releaseEscrow(channel.id(), "task-1", EscrowOutcome.FAILURE);
        restarted.closeChannel(channel.id());
        assertEquals(Money.of("100"), restarted.getBalance("alice"));
        assertTrue(restarted.verifyLedger().balanced());
    }

    @Test
    void closedChannelsAreQueriedSeparately() {
        EscrowLedger ledger = new EscrowLedger(repo, new MarketMetrics(), false);
        ledger.deposit("alice", new BigDecimal("100"));
        PaymentChannel paid = ledger.openChannel("alice", "bob", new BigDecimal("40"), "auc-1");
        ledger.lockEscrow(paid.id(), "task-1", new BigDecimal("15"));
        ledger.releaseEscrow(paid.id(), "task-1", EscrowOutcome.SUCCESS);
        ledger.closeChannel(paid.id());
        PaymentChannel open = ledger.openChannel("alice", "carol", new BigDecimal("10"), null);

        PaymentChannel closed = repo.findChannel(paid.id()).orElseThrow();
        assertEquals(Money.of("40"), closed.totalDeposit());
        assertEquals(Money.of("25"), closed.totalRefunded());
        assertTrue(closed.isBalanced());

        assertEquals(List.of(open.id()), repo.findActiveChannels().stream().map(PaymentChannel::id).toList());
        assertEquals(1, repo.findChannelsFor("bob").size());
        assertEquals(2, repo.findChannelsFor("alice").size());
        assertTrue(repo.findChannelsFor("dave").isEmpty());
        assertEquals(Money.of("15"), repo.settledInClosedChannels());
    }

    @Test
    void failedBatchIsRolledBack() {
        Account good = Account.open("alice", Instant.now());
        // id longer than the column allows
        String oversizedId = "ch-" + "x".repeat(100);
        PaymentChannel broken = PaymentChannel.builder()
                .id(oversizedId)
                .payerId("alice")
                .payeeId("bob")
                .state(ChannelState.OPEN)
                .build();

        assertThrows(RuntimeException.class, () -> repo.saveAll(List.of(good), broken));

        assertTrue(repo.findAccount("alice").isEmpty());
        assertTrue(repo.findAllChannels().isEmpty());
    }
}
