package agora.market.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only channel log entry. Balances are the channel totals after the entry was applied.
 */
public record ChannelTransaction(
        String id,
        String channelId,
        long sequence,
        TransactionType type,
        BigDecimal amount,
        String taskId,
        String reason,
        BigDecimal currentBalance,
        BigDecimal escrowedAmount,
        BigDecimal totalSettled,
        Instant timestamp) {
}
