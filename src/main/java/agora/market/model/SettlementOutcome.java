package agora.market.model;

/**
 * Ledger release plus the reputation delta that was pushed for the worker.
 */
public record SettlementOutcome(ReleaseResult release, double reputationDelta) {

    public boolean paid() {
        return release.outcome() == EscrowOutcome.SUCCESS;
    }
}
