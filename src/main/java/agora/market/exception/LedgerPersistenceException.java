package agora.market.exception;

public class LedgerPersistenceException extends MarketException {
    public LedgerPersistenceException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
