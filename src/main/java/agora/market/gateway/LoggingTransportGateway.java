package agora.market.gateway;

import agora.market.model.AuctionInvite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Transport used when workers poll for open auctions over HTTP instead of receiving pushes.
 * Only records the invitation.
 */
public class LoggingTransportGateway implements TransportGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingTransportGateway.class);

    @Override
    public void broadcast(List<String> workerIds, AuctionInvite invite) {
        log.info("Auction {} for task {} offered to {} workers (expires {})",
                invite.auctionId(), invite.taskId(), workerIds.size(), invite.expiresAt());
    }
}
