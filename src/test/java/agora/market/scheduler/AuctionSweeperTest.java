package agora.market.scheduler;

import agora.market.config.MarketConfig;
import agora.market.metrics.MarketMetrics;
import agora.market.model.AuctionSpec;
import agora.market.model.AuctionStatus;
import agora.market.model.BidRequest;
import agora.market.model.TaskAuction;
import agora.market.service.AuctionCoordinator;
import agora.market.support.InMemoryAuctionRepository;
import agora.market.support.RecordingTransportGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AuctionSweeperTest {

    private AuctionCoordinator auctions;
    private AuctionSweeper sweeper;

    @BeforeEach
    void setUp() {
        MarketConfig config = MarketConfig.defaults().withMinBidders(1);
        auctions = new AuctionCoordinator(new InMemoryAuctionRepository(), new RecordingTransportGateway(),
                config, new MarketMetrics());
        sweeper = new AuctionSweeper(auctions);
    }

    private TaskAuction open(String taskId, Duration duration) {
        return auctions.createAuction(AuctionSpec.builder()
                .taskId(taskId)
                .requesterId("req-1")
                .maxPrice(new BigDecimal("10"))
                .capabilities(Set.of("cpu"))
                .duration(duration)
                .build(), List.of());
    }

    @Test
    void finalizesOnlyExpiredAuctions() throws InterruptedException {
        TaskAuction withBid = open("task-1", Duration.ofMillis(30));
        auctions.submitBid(withBid.id(), new BidRequest("w-1", new BigDecimal("5"), Duration.ofSeconds(1), 60, 60));
        TaskAuction withoutBids = open("task-2", Duration.ofMillis(30));
        TaskAuction running = open("task-3", Duration.ofMinutes(5));

        Thread.sleep(80);

        assertEquals(2, sweeper.sweep());
        assertEquals(AuctionStatus.AWARDED, auctions.getAuction(withBid.id()).status());
        assertEquals(AuctionStatus.EXPIRED, auctions.getAuction(withoutBids.id()).status());
        assertEquals(AuctionStatus.OPEN, auctions.getAuction(running.id()).status());

        assertEquals(0, sweeper.sweep());
    }

    @Test
    void runDoesNotThrow() {
        open("task-1", Duration.ofMinutes(5));

        assertDoesNotThrow(() -> sweeper.run());
    }
}
