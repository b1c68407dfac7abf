package agora.market.model;

/**
 * How an escrow is resolved: SUCCESS pays the payee, FAILURE returns funds to the channel.
 */
public enum EscrowOutcome {
    SUCCESS,
    FAILURE
}
