package agora.market.exception;

/**
 * Thrown on any mutation attempt against a channel frozen after an invariant violation.
 */
public class ChannelFrozenException extends InvalidChannelStateException {
    public ChannelFrozenException(String channelId) {
        super("Channel " + channelId + " is frozen");
    }
}
