package agora.market.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Aggregate view over all known auctions.
 */
public record AuctionStats(
        Map<AuctionStatus, Long> byStatus,
        long totalAuctions,
        long totalBids,
        double averageBidsPerAuction,
        BigDecimal averageWinningPrice) {
}
