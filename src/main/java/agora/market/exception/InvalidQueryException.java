package agora.market.exception;

public class InvalidQueryException extends MarketException {
    public InvalidQueryException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
