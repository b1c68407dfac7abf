package agora.market.model;

/**
 * Terminal outcome of an allocation: every allocation ends in exactly one of these.
 */
public enum AllocationStatus {
    /** Work succeeded and the escrow was paid to the worker */
    SETTLED,

    /** Work failed or timed out and the escrow went back to the requester */
    REFUNDED,

    /** No worker was awarded; the ledger was not touched */
    NOT_ALLOCATED
}
