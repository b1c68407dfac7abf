package agora.market.scheduler;

import agora.market.config.MarketConfig;
import agora.market.model.PaymentChannel;
import agora.market.service.EscrowLedger;
import agora.market.service.SettlementCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Background task that refunds escrows held longer than the hold timeout.
 *
 * Escrows can be left behind if:
 * - the execution runtime never reports back
 * - the coordinator restarted while a task was running
 *
 * Each expired escrow is refunded to the payer, the worker takes the failure
 * penalty and the channel is closed.
 *
 * The same pass closes auction channels an allocation failed to close and evicts
 * closed channels past the retention period from memory.
 */
public class EscrowReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EscrowReaper.class);

    private final EscrowLedger ledger;
    private final SettlementCoordinator settlement;
    private final MarketConfig config;

    public EscrowReaper(EscrowLedger ledger, SettlementCoordinator settlement, MarketConfig config) {
        this.ledger = ledger;
        this.settlement = settlement;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapExpiredEscrows();
            closeAbandonedChannels();
            ledger.evictClosedChannels(config.channelRetention());
        } catch (Exception e) {
            log.error("Escrow reaper error", e);
        }
    }

    /**
     * Find and refund escrows past their hold timeout.
     *
     * @return number of escrows refunded
     */
    public int reapExpiredEscrows() {
        List<PaymentChannel> expired = ledger.expiredEscrows(config.escrowHoldTimeout());

        if (expired.isEmpty()) {
            log.debug("No expired escrows found");
            return 0;
        }

        int refunded = 0;
        for (PaymentChannel channel : expired) {
            try {
                settlement.refundExpired(channel);
                refunded++;
            } catch (Exception e) {
                log.error("Failed to refund escrow on channel {}", channel.id(), e);
            }
        }

        log.info("Escrow reaper: {} refunded, {} expired", refunded, expired.size());
        return refunded;
    }

    /**
     * Close auction channels left OPEN past the hold timeout, returning the deposit to the payer.
     *
     * @return number of channels closed
     */
    public int closeAbandonedChannels() {
        List<PaymentChannel> abandoned = ledger.abandonedAuctionChannels(config.escrowHoldTimeout());
        int closed = 0;
        for (PaymentChannel channel : abandoned) {
            try {
                ledger.closeChannel(channel.id());
                closed++;
            } catch (Exception e) {
                log.error("Failed to close abandoned channel {}", channel.id(), e);
            }
        }
        if (closed > 0) {
            log.warn("Escrow reaper: closed {} abandoned channel(s)", closed);
        }
        return closed;
    }
}
