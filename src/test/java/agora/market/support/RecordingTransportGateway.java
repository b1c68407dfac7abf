package agora.market.support;

import agora.market.gateway.TransportGateway;
import agora.market.model.AuctionInvite;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures auction invitations instead of sending them.
 */
public class RecordingTransportGateway implements TransportGateway {

    public record Sent(List<String> workerIds, AuctionInvite invite) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();

    @Override
    public void broadcast(List<String> workerIds, AuctionInvite invite) {
        sent.add(new Sent(workerIds, invite));
    }

    public List<Sent> sent() {
        return sent;
    }
}
