package agora.market.exception;

public class InvalidChannelStateException extends MarketException {
    public InvalidChannelStateException(String message) {
        super(ErrorKind.BUSINESS_RULE, message);
    }
}
