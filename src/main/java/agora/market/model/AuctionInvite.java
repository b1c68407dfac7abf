package agora.market.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Invitation broadcast to candidate workers when an auction opens.
 */
public record AuctionInvite(
        String auctionId,
        String taskId,
        Set<String> capabilities,
        BigDecimal maxPrice,
        BigDecimal reservePrice,
        double minReputation,
        Instant expiresAt) {

    public static AuctionInvite of(TaskAuction auction) {
        return new AuctionInvite(
                auction.id(),
                auction.taskId(),
                auction.capabilities(),
                auction.maxPrice(),
                auction.reservePrice(),
                auction.minReputation(),
                auction.expiresAt());
    }
}
