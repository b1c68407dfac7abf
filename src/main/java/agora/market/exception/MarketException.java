package agora.market.exception;

/**
 * Base class for marketplace failures.
 */
public abstract class MarketException extends RuntimeException {

    private final ErrorKind kind;

    protected MarketException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MarketException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
