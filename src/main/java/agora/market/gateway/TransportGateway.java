package agora.market.gateway;

import agora.market.model.AuctionInvite;

import java.util.List;

/**
 * Delivers auction invitations to candidate workers.
 */
public interface TransportGateway {

    void broadcast(List<String> workerIds, AuctionInvite invite);
}
