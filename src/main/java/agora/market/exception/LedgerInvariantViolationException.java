package agora.market.exception;

public class LedgerInvariantViolationException extends MarketException {

    private final String channelId;

    public LedgerInvariantViolationException(String channelId, String message) {
        super(ErrorKind.INVARIANT, message);
        this.channelId = channelId;
    }

    /** Null when the violation concerns an account rather than a channel */
    public String channelId() {
        return channelId;
    }
}
