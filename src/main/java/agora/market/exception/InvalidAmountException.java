package agora.market.exception;

public class InvalidAmountException extends MarketException {
    public InvalidAmountException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
