package agora.market.scheduler;

import agora.market.service.AuctionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that finalizes auctions whose bidding window has ended.
 *
 * Auctions with bids are closed and awarded (or marked as having too few bidders);
 * auctions without bids are marked EXPIRED.
 */
public class AuctionSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AuctionSweeper.class);

    private final AuctionCoordinator auctions;

    public AuctionSweeper(AuctionCoordinator auctions) {
        this.auctions = auctions;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Auction sweeper error", e);
        }
    }

    /**
     * @return number of auctions finalized
     */
    public int sweep() {
        int finalized = auctions.sweepExpired();
        if (finalized == 0) {
            log.debug("No expired auctions");
        }
        return finalized;
    }
}
