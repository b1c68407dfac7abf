package agora.market.exception;

public class AccountNotFoundException extends MarketException {
    public AccountNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
