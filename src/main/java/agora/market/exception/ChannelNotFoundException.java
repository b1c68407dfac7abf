package agora.market.exception;

public class ChannelNotFoundException extends MarketException {
    public ChannelNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
