package agora.market.model;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Bid as submitted by a worker, before validation and scoring.
 */
public record BidRequest(
        String workerId,
        BigDecimal price,
        Duration estimatedTime,
        double reputation,
        double quality) {
}
