package agora.market.exception;

public class NoEligibleWorkersException extends MarketException {
    public NoEligibleWorkersException(String message) {
        super(ErrorKind.BUSINESS_RULE, message);
    }
}
