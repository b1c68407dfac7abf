package agora.market.model;

/**
 * Channel transaction log entry types.
 */
public enum TransactionType {
    DEPOSIT,
    ESCROW,
    RELEASE,
    REFUND,
    CLOSE
}
