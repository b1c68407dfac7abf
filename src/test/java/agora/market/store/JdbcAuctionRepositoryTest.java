package agora.market.store;

import agora.market.config.MarketConfig;
import agora.market.model.AuctionKind;
import agora.market.model.AuctionStatus;
import agora.market.model.Bid;
import agora.market.model.Money;
import agora.market.model.TaskAuction;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAuctionRepositoryTest {

    private static Database db;
    private static JdbcAuctionRepository repo;

    @BeforeAll
    static void setup() {
        MarketConfig config = MarketConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-auctions;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcAuctionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanAuctions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM auctions");
            conn.commit();
        }
    }

    private static TaskAuction auction(String id, String taskId, Instant createdAt) {
        return TaskAuction.builder()
                .id(id)
                .taskId(taskId)
                .requesterId("req-1")
                .kind(AuctionKind.SECOND_PRICE)
                .status(AuctionStatus.OPEN)
                .reservePrice(Money.of("1"))
                .maxPrice(Money.of("100"))
                .minReputation(30)
                .capabilities(Set.of("gpu", "cuda"))
                .taskTimeoutMs(60_000)
                .createdAt(createdAt)
                .expiresAt(createdAt.plus(Duration.ofSeconds(30)))
                .build();
    }

    private static Bid bid(String auctionId, String workerId, String price, int sequence) {
        return new Bid("bid-" + sequence, auctionId, workerId, Money.of(price), 2_000, 80, 70,
                Instant.now(), sequence, 0.6);
    }

    @Test
    void saveAndFindById() {
        repo.save(auction("auc-1", "task-1", Instant.now()));

        Optional<TaskAuction> found = repo.findById("auc-1");
        assertTrue(found.isPresent());
        assertEquals("task-1", found.get().taskId());
        assertEquals(AuctionKind.SECOND_PRICE, found.get().kind());
        assertEquals(AuctionStatus.OPEN, found.get().status());
        assertEquals(Money.of("100"), found.get().maxPrice());
        assertEquals(Set.of("gpu", "cuda"), found.get().capabilities());
        assertEquals(60_000, found.get().taskTimeoutMs());
        assertTrue(found.get().bids().isEmpty());
        assertTrue(found.get().winningBid().isEmpty());
        assertNull(found.get().finalPrice());

        assertTrue(repo.findById("auc-missing").isEmpty());
    }

    @Test
    @DisplayName("Awarded auction keeps its bids, winner and clearing price")
    void awardedAuctionRoundTrip() {
        TaskAuction open = auction("auc-1", "task-1", Instant.now());
        Bid first = bid("auc-1", "w-1", "50", 1);
        Bid second = bid("auc-1", "w-2", "40", 2);
        TaskAuction awarded = open.withBid(first).withBid(second).toBuilder()
                .status(AuctionStatus.AWARDED)
                .winningBid(second)
                .finalPrice(Money.of("50"))
                .closedAt(Instant.now())
                .build();

        repo.save(open);
        repo.save(awarded);

        TaskAuction found = repo.findById("auc-1").orElseThrow();
        assertEquals(AuctionStatus.AWARDED, found.status());
        assertEquals(2, found.bids().size());
        assertEquals("w-2", found.winningBid().orElseThrow().workerId());
        assertEquals(Money.of("40"), found.winningBid().orElseThrow().price());
        assertEquals(2, found.winningBid().orElseThrow().sequence());
        assertEquals(Money.of("50"), found.finalPrice());
        assertNotNull(found.closedAt());
        assertEquals(1, repo.findAll().size());
    }

    @Test
    void findByTaskIdReturnsLatest() {
        Instant now = Instant.now();
        repo.save(auction("auc-old", "task-1", now.minusSeconds(60)));
        repo.save(auction("auc-new", "task-1", now));
        repo.save(auction("auc-other", "task-2", now));

        assertEquals("auc-new", repo.findByTaskId("task-1").orElseThrow().id());
        assertTrue(repo.findByTaskId("task-3").isEmpty());
    }

    @Test
    void findOpenSkipsDecidedAuctions() {
        Instant now = Instant.now();
        repo.save(auction("auc-1", "task-1", now));
        repo.save(auction("auc-2", "task-2", now).toBuilder()
                .status(AuctionStatus.CANCELED)
                .closedAt(now)
                .build());

        List<TaskAuction> open = repo.findOpen();

        assertEquals(1, open.size());
        assertEquals("auc-1", open.get(0).id());
        assertEquals(2, repo.findAll().size());
    }
}
