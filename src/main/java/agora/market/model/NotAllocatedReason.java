package agora.market.model;

public enum NotAllocatedReason {
    NO_ELIGIBLE_WORKERS,
    INSUFFICIENT_BIDDERS,
    AUCTION_EXPIRED,
    AUCTION_CANCELED,
    INSUFFICIENT_FUNDS,
    /** Escrow could not be locked; the channel was closed and the deposit returned */
    LEDGER_FAILURE
}
