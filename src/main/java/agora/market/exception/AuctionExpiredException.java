package agora.market.exception;

public class AuctionExpiredException extends MarketException {
    public AuctionExpiredException(String message) {
        super(ErrorKind.BUSINESS_RULE, message);
    }
}
