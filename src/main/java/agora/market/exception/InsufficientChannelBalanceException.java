package agora.market.exception;

public class InsufficientChannelBalanceException extends MarketException {
    public InsufficientChannelBalanceException(String message) {
        super(ErrorKind.BUSINESS_RULE, message);
    }
}
