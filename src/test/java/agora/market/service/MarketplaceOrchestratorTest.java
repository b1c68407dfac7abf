package agora.market.service;

import agora.market.config.MarketConfig;
import agora.market.exception.InvalidAuctionSpecException;
import agora.market.gateway.ExecutionGateway;
import agora.market.gateway.InMemoryReputationGateway;
import agora.market.gateway.TransportGateway;
import agora.market.metrics.MarketMetrics;
import agora.market.model.AllocationResult;
import agora.market.model.AllocationStatus;
import agora.market.model.AuctionStatus;
import agora.market.model.BidRequest;
import agora.market.model.ChannelState;
import agora.market.model.ExecutionResult;
import agora.market.model.Money;
import agora.market.model.NotAllocatedReason;
import agora.market.model.PaymentChannel;
import agora.market.model.TaskSpec;
import agora.market.model.WorkerRecord;
import agora.market.scheduler.EscrowReaper;
import agora.market.support.InMemoryAuctionRepository;
import agora.market.support.InMemoryLedgerRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MarketplaceOrchestratorTest {

    private MarketConfig config;
    private CapabilityIndex index;
    private AuctionCoordinator auctions;
    private InMemoryLedgerRepository ledgerStore;
    private EscrowLedger ledger;
    private InMemoryReputationGateway reputation;
    private SettlementCoordinator settlement;
    private MarketplaceOrchestrator orchestrator;

    /** Price each worker bids when invited; workers without an entry stay silent */
    private final Map<String, String> quotes = new ConcurrentHashMap<>();
    /** Reputation each worker reports in its bid, 80 when absent */
    private final Map<String, Double> bidReputations = new ConcurrentHashMap<>();
    private final AtomicReference<ExecutionGateway> execution = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        MarketMetrics metrics = new MarketMetrics();
        config = MarketConfig.defaults()
                .withMinBidders(3)
                .withMaxBids(3)
                .withAuctionDuration(Duration.ofMillis(300));

        AtomicReference<AuctionCoordinator> auctionRef = new AtomicReference<>();
        TransportGateway biddingWorkers = (workerIds, invite) -> {
            for (String workerId : workerIds) {
                String price = quotes.get(workerId);
                if (price != null) {
                    auctionRef.get().submitBid(invite.auctionId(), new BidRequest(workerId,
                            new BigDecimal(price), Duration.ofSeconds(10),
                            bidReputations.getOrDefault(workerId, 80.0), 80));
                }
            }
        };

        index = new CapabilityIndex(metrics);
        auctions = new AuctionCoordinator(new InMemoryAuctionRepository(), biddingWorkers, config, metrics);
        auctionRef.set(auctions);
        ledgerStore = new InMemoryLedgerRepository();
        ledger = new EscrowLedger(ledgerStore, metrics, true);
        reputation = new InMemoryReputationGateway(80.0);
        settlement = new SettlementCoordinator(ledger, reputation, index, new ReputationPolicy(config));
        orchestrator = new MarketplaceOrchestrator(index, auctions, ledger, settlement,
                (task, workerId) -> execution.get().execute(task, workerId), config, metrics);

        for (String id : new String[]{"w-1", "w-2", "w-3"}) {
            index.register(WorkerRecord.builder()
                    .id(id)
                    .capabilities(Set.of("gpu"))
                    .reputation(80)
                    .build());
        }
        quotes.put("w-1", "50");
        quotes.put("w-2", "45");
        quotes.put("w-3", "40");
        execution.set((task, workerId) -> ExecutionResult.success(Duration.ofSeconds(1), "done"));
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private static TaskSpec task(String taskId) {
        return TaskSpec.builder()
                .taskId(taskId)
                .requesterId("alice")
                .capabilities(Set.of("gpu"))
                .maxPrice(new BigDecimal("100"))
                .build();
    }

    @Test
    @DisplayName("Happy path: cheapest worker wins, is paid the clearing price and the channel is closed")
    void allocatesAndSettles() {
        ledger.deposit("alice", new BigDecimal("100"));

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.SETTLED, result.status());
        assertEquals("w-3", result.workerId());
        assertEquals(Money.of("45"), result.price());
        assertEquals(3.0, result.reputationDelta(), 1e-9);

        assertEquals(Money.of("55"), ledger.getBalance("alice"));
        assertEquals(Money.of("45"), ledger.getBalance("w-3"));
        assertEquals(ChannelState.CLOSED, ledger.getChannel(result.channelId()).state());
        assertEquals(AuctionStatus.AWARDED, auctions.getAuction(result.auctionId()).status());
        assertEquals(0, index.find("w-3").orElseThrow().load());
        assertEquals(83.0, index.find("w-3").orElseThrow().reputation(), 1e-9);
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    void failedExecutionIsRefunded() {
        ledger.deposit("alice", new BigDecimal("100"));
        execution.set((task, workerId) -> {
            throw new IllegalStateException("worker crashed");
        });

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.REFUNDED, result.status());
        assertEquals("w-3", result.workerId());
        assertTrue(result.detail().contains("worker crashed"));
        assertEquals(-5.0, result.reputationDelta(), 1e-9);
        assertEquals(Money.of("100"), ledger.getBalance("alice"));
        assertEquals(Money.ZERO, ledger.getBalance("w-3"));
        assertEquals(75.0, reputation.getScore("w-3"), 1e-9);
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    void executionTimeoutIsRefunded() {
        ledger.deposit("alice", new BigDecimal("100"));
        execution.set((task, workerId) -> {
            Thread.sleep(5_000);
            return ExecutionResult.success(Duration.ofSeconds(5), "late");
        });

        AllocationResult result = orchestrator.allocateAndSettle(TaskSpec.builder()
                .taskId("task-1")
                .requesterId("alice")
                .capabilities(Set.of("gpu"))
                .maxPrice(new BigDecimal("100"))
                .timeout(Duration.ofMillis(200))
                .build());

        assertEquals(AllocationStatus.REFUNDED, result.status());
        assertEquals("execution timed out", result.detail());
        assertEquals(Money.of("100"), ledger.getBalance("alice"));
    }

    @Test
    void nullExecutionResultIsRefunded() {
        ledger.deposit("alice", new BigDecimal("100"));
        execution.set((task, workerId) -> null);

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.REFUNDED, result.status());
        assertEquals(Money.of("100"), ledger.getBalance("alice"));
    }

    @Test
    void tooFewEligibleWorkers() {
        ledger.deposit("alice", new BigDecimal("100"));
        index.unregister("w-1");

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.NOT_ALLOCATED, result.status());
        assertEquals(NotAllocatedReason.NO_ELIGIBLE_WORKERS, result.reason());
        assertNull(result.auctionId());
        assertTrue(auctions.findByTask("task-1").isEmpty());
        assertTrue(ledger.channelsFor("alice").isEmpty());
    }

    @Test
    @DisplayName("Too few bids within the window leaves the ledger untouched")
    void insufficientBidders() {
        ledger.deposit("alice", new BigDecimal("100"));
        quotes.remove("w-1");

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.NOT_ALLOCATED, result.status());
        assertEquals(NotAllocatedReason.INSUFFICIENT_BIDDERS, result.reason());
        assertEquals(AuctionStatus.INSUFFICIENT_BIDDERS, auctions.getAuction(result.auctionId()).status());
        assertTrue(ledger.channelsFor("alice").isEmpty());
        assertEquals(Money.of("100"), ledger.getBalance("alice"));
    }

    @Test
    void auctionWithoutBidsExpires() {
        ledger.deposit("alice", new BigDecimal("100"));
        quotes.clear();

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(NotAllocatedReason.AUCTION_EXPIRED, result.reason());
    }

    @Test
    void requesterWithoutFundsIsNotAllocated() {
        ledger.deposit("alice", new BigDecimal("10"));

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.NOT_ALLOCATED, result.status());
        assertEquals(NotAllocatedReason.INSUFFICIENT_FUNDS, result.reason());
        assertNotNull(result.auctionId());
        assertTrue(ledger.channelsFor("alice").isEmpty());
        assertEquals(Money.of("10"), ledger.getBalance("alice"));
        assertEquals(0, index.find("w-3").orElseThrow().load());
    }

    @Test
    void malformedTaskIsRejected() {
        assertThrows(InvalidAuctionSpecException.class,
                () -> orchestrator.allocateAndSettle(TaskSpec.builder()
                        .requesterId("alice")
                        .capabilities(Set.of("gpu"))
                        .maxPrice(new BigDecimal("100"))
                        .build()));
        assertThrows(InvalidAuctionSpecException.class,
                () -> orchestrator.allocateAndSettle(TaskSpec.builder()
                        .taskId("task-1")
                        .requesterId("alice")
                        .capabilities(Set.of("gpu"))
                        .build()));
    }

    private void registerVisionWorkers() {
        String[][] workers = {{"v-1", "0.20", "90"}, {"v-2", "0.30", "70"}, {"v-3", "0.45", "95"}};
        for (String[] w : workers) {
            index.register(WorkerRecord.builder()
                    .id(w[0])
                    .capabilities(Set.of("vision-analysis"))
                    .reputation(Double.parseDouble(w[2]))
                    .build());
            quotes.put(w[0], w[1]);
            bidReputations.put(w[0], Double.parseDouble(w[2]));
        }
    }

    private static TaskSpec visionTask(String taskId) {
        return TaskSpec.builder()
                .taskId(taskId)
                .requesterId("alice")
                .capabilities(Set.of("vision-analysis"))
                .maxPrice(new BigDecimal("0.50"))
                .build();
    }

    @Test
    @DisplayName("vision-analysis: 0.20 bidder scores highest and is paid the 0.30 second price")
    void visionAnalysisSettles() {
        registerVisionWorkers();
        ledger.deposit("alice", new BigDecimal("1.00"));

        AllocationResult result = orchestrator.allocateAndSettle(visionTask("vision-1"));

        assertEquals(AllocationStatus.SETTLED, result.status());
        assertEquals("v-1", result.workerId());
        assertEquals(Money.of("0.30"), result.price());
        assertEquals(Money.of("0.70"), ledger.getBalance("alice"));
        assertEquals(Money.of("0.30"), ledger.getBalance("v-1"));
        assertEquals(Money.ZERO, ledger.getBalance("v-2"));
        assertEquals(83.0, reputation.getScore("v-1"), 1e-9);
        assertEquals(ChannelState.CLOSED, ledger.getChannel(result.channelId()).state());
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    void visionAnalysisFailureRefundsRequester() {
        registerVisionWorkers();
        ledger.deposit("alice", new BigDecimal("1.00"));
        execution.set((task, workerId) -> ExecutionResult.failure(Duration.ofSeconds(2), "model load failed"));

        AllocationResult result = orchestrator.allocateAndSettle(visionTask("vision-2"));

        assertEquals(AllocationStatus.REFUNDED, result.status());
        assertEquals("v-1", result.workerId());
        assertEquals(Money.of("0.30"), result.price());
        assertEquals(Money.of("1.00"), ledger.getBalance("alice"));
        assertEquals(Money.ZERO, ledger.getBalance("v-1"));
        assertEquals(75.0, reputation.getScore("v-1"), 1e-9);
        PaymentChannel channel = ledger.getChannel(result.channelId());
        assertEquals(ChannelState.CLOSED, channel.state());
        assertEquals(Money.of("0.30"), channel.totalRefunded());
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    @DisplayName("Escrow lock write fails after the channel opened: channel closed, requester made whole")
    void failedEscrowLockClosesChannel() {
        ledger.deposit("alice", new BigDecimal("100"));
        // write 1 opens the channel, write 2 locks the escrow
        ledgerStore.failAttempt(2);

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.NOT_ALLOCATED, result.status());
        assertEquals(NotAllocatedReason.LEDGER_FAILURE, result.reason());
        assertEquals(Money.of("100"), ledger.getBalance("alice"));
        assertEquals(Money.ZERO, ledger.getAccount("alice").lockedInChannels());
        List<PaymentChannel> channels = ledger.channelsFor("alice");
        assertEquals(1, channels.size());
        assertEquals(ChannelState.CLOSED, channels.get(0).state());
        assertEquals(Money.of("45"), channels.get(0).totalRefunded());
        assertEquals(0, index.find("w-3").orElseThrow().load());
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    void failedSettlementWriteRefundsRequester() {
        ledger.deposit("alice", new BigDecimal("100"));
        // open, lock, then the release write fails
        ledgerStore.failAttempt(3);

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.REFUNDED, result.status());
        assertTrue(result.detail().startsWith("settlement failed"));
        assertEquals(Money.of("100"), ledger.getBalance("alice"));
        assertEquals(Money.ZERO, ledger.getBalance("w-3"));
        assertEquals(ChannelState.CLOSED, ledger.getChannel(result.channelId()).state());
        assertEquals(0, index.find("w-3").orElseThrow().load());
        assertEquals(80.0, reputation.getScore("w-3"), 1e-9);
        assertTrue(ledger.verifyLedger().balanced());
    }

    @Test
    @DisplayName("A failed channel close still reports the settlement; the reaper closes the channel later")
    void failedCloseIsLeftToReaper() throws InterruptedException {
        ledger.deposit("alice", new BigDecimal("100"));
        // open, lock, release, then the close write fails
        ledgerStore.failAttempt(4);

        AllocationResult result = orchestrator.allocateAndSettle(task("task-1"));

        assertEquals(AllocationStatus.SETTLED, result.status());
        assertEquals(Money.of("45"), ledger.getBalance("w-3"));
        assertEquals(ChannelState.OPEN, ledger.getChannel(result.channelId()).state());

        Thread.sleep(20);
        EscrowReaper reaper = new EscrowReaper(ledger, settlement,
                config.withEscrowHoldTimeout(Duration.ofMillis(1)));
        assertEquals(1, reaper.closeAbandonedChannels());
        assertEquals(ChannelState.CLOSED, ledger.getChannel(result.channelId()).state());
        assertEquals(Money.of("55"), ledger.getBalance("alice"));
        assertTrue(ledger.verifyLedger().balanced());
    }
}
