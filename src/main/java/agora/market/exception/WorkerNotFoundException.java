package agora.market.exception;

public class WorkerNotFoundException extends MarketException {
    public WorkerNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
