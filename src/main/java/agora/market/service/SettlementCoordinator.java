package agora.market.service;

import agora.market.exception.WorkerNotFoundException;
import agora.market.gateway.ReputationGateway;
import agora.market.model.EscrowOutcome;
import agora.market.model.ExecutionResult;
import agora.market.model.PaymentChannel;
import agora.market.model.ReleaseResult;
import agora.market.model.SettlementOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Turns an execution result into a ledger release or refund and a reputation update.
 *
 * The ledger step is idempotent; a replayed release pushes no second reputation delta
 * and does not touch the worker's load again.
 */
public class SettlementCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SettlementCoordinator.class);

    private final EscrowLedger ledger;
    private final ReputationGateway reputation;
    private final CapabilityIndex index;
    private final ReputationPolicy policy;

    public SettlementCoordinator(EscrowLedger ledger, ReputationGateway reputation, CapabilityIndex index,
            ReputationPolicy policy) {
        this.ledger = ledger;
        this.reputation = reputation;
        this.index = index;
        this.policy = policy;
    }

    /**
     * Settle the escrow held on a channel for a task.
     *
     * @param estimatedTime the winner's estimate from its bid, may be null
     * @param taskTimeout   the task's execution timeout, may be null
     */
    public SettlementOutcome settle(String channelId, String taskId, String workerId, ExecutionResult result,
            Duration estimatedTime, Duration taskTimeout) {
        EscrowOutcome outcome = result.success() ? EscrowOutcome.SUCCESS : EscrowOutcome.FAILURE;
        ReleaseResult release = ledger.releaseEscrow(channelId, taskId, outcome);
        if (release.replay()) {
            return new SettlementOutcome(release, 0.0);
        }

        double delta = policy.delta(result, estimatedTime, taskTimeout);
        String reason = result.success()
                ? "task " + taskId + " completed"
                : "task " + taskId + " failed: " + result.error();
        pushReputation(workerId, delta, reason);
        releaseLoad(workerId);
        return new SettlementOutcome(release, delta);
    }

    /**
     * Refund an escrow whose hold window ran out and close the channel.
     */
    public SettlementOutcome refundExpired(PaymentChannel channel) {
        String taskId = channel.escrowTaskId();
        ReleaseResult release = ledger.releaseEscrow(channel.id(), taskId, EscrowOutcome.FAILURE);
        double delta = 0.0;
        if (!release.replay()) {
            delta = policy.expiredHoldDelta();
            pushReputation(channel.payeeId(), delta, "task " + taskId + " escrow hold expired");
            releaseLoad(channel.payeeId());
        }
        ledger.closeChannel(channel.id());
        log.warn("Escrow for task {} on channel {} refunded after hold timeout", taskId, channel.id());
        return new SettlementOutcome(release, delta);
    }

    private void pushReputation(String workerId, double delta, String reason) {
        try {
            double score = reputation.updateScore(workerId, delta, reason);
            index.updateReputation(workerId, score);
            log.info("Reputation {} {} -> {} ({})", workerId, String.format("%+.2f", delta),
                    String.format("%.2f", score), reason);
        } catch (RuntimeException e) {
            // The ledger change is already committed at this point
            log.warn("Reputation update for {} failed: {}", workerId, e.getMessage());
        }
    }

    private void releaseLoad(String workerId) {
        try {
            index.updateLoad(workerId, -1);
        } catch (WorkerNotFoundException e) {
            log.debug("Worker {} left before settlement", workerId);
        }
    }
}
