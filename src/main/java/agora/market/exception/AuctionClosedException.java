package agora.market.exception;

public class AuctionClosedException extends MarketException {
    public AuctionClosedException(String message) {
        super(ErrorKind.BUSINESS_RULE, message);
    }
}
