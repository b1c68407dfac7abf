package agora.market.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of releasing an escrow. Replayed results come from an earlier release of the same task.
 */
public record ReleaseResult(
        String channelId,
        String taskId,
        EscrowOutcome outcome,
        BigDecimal amount,
        String recipientId,
        long sequence,
        Instant releasedAt,
        boolean replay) {

    public ReleaseResult asReplay() {
        return new ReleaseResult(channelId, taskId, outcome, amount, recipientId, sequence, releasedAt, true);
    }
}
