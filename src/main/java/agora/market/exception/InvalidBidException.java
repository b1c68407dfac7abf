package agora.market.exception;

public class InvalidBidException extends MarketException {
    public InvalidBidException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
