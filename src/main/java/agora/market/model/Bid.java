package agora.market.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable bid on an auction. Score is the composite score computed on acceptance.
 */
public record Bid(
        String id,
        String auctionId,
        String workerId,
        BigDecimal price,
        long estimatedTimeMs,
        double reputation,
        double quality,
        Instant submittedAt,
        int sequence,
        double score) {

    public Duration estimatedTime() {
        return Duration.ofMillis(estimatedTimeMs);
    }
}
