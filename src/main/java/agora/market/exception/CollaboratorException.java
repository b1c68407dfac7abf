package agora.market.exception;

/**
 * Failure of an external collaborator (transport, execution runtime, reputation service).
 */
public class CollaboratorException extends MarketException {
    public CollaboratorException(String message, Throwable cause) {
        super(ErrorKind.COLLABORATOR, message, cause);
    }
}
