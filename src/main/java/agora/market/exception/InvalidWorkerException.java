package agora.market.exception;

public class InvalidWorkerException extends MarketException {
    public InvalidWorkerException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
