package agora.market.exception;

public class InvalidAuctionSpecException extends MarketException {
    public InvalidAuctionSpecException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
