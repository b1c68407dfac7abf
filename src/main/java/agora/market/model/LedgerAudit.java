package agora.market.model;

import java.math.BigDecimal;

/**
 * Ledger-wide balance check: deposits = withdrawals + account balances + funds held in channels.
 */
public record LedgerAudit(
        BigDecimal totalDeposited,
        BigDecimal totalWithdrawn,
        BigDecimal totalAccountBalances,
        BigDecimal totalHeldInChannels,
        BigDecimal totalSettled,
        BigDecimal totalEarned,
        boolean balanced) {
}
