package agora.market.model;

/**
 * Payment channel lifecycle.
 * OPENING -> OPEN -> ESCROWED -> SETTLING -> OPEN ... -> CLOSED.
 * FROZEN is entered only after an invariant violation.
 */
public enum ChannelState {
    OPENING,
    OPEN,
    ESCROWED,
    SETTLING,
    CLOSED,
    FROZEN
}
