package agora.market.exception;

public class InsufficientBiddersException extends MarketException {
    public InsufficientBiddersException(String message) {
        super(ErrorKind.BUSINESS_RULE, message);
    }
}
