package agora.market.exception;

public class AuctionNotFoundException extends MarketException {
    public AuctionNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
