package agora.market.model;

/**
 * Auction lifecycle.
 * OPEN -> CLOSED -> AWARDED | INSUFFICIENT_BIDDERS, or OPEN -> EXPIRED | CANCELED.
 */
public enum AuctionStatus {
    OPEN,
    CLOSED,
    AWARDED,
    INSUFFICIENT_BIDDERS,
    EXPIRED,
    CANCELED;

    /** Terminal states accept no further bids or transitions */
    public boolean isDecided() {
        return this == AWARDED || this == INSUFFICIENT_BIDDERS || this == EXPIRED || this == CANCELED;
    }
}
