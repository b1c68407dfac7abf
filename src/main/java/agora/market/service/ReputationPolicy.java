package agora.market.service;

import agora.market.config.MarketConfig;
import agora.market.model.ExecutionResult;
import agora.market.model.FailurePenaltyPolicy;

import java.time.Duration;

/**
 * Computes the reputation delta pushed after a settlement.
 *
 * Success: base reward, a bonus when the work finished within half the task timeout,
 * and a small penalty when it overran the worker's own estimate.
 * Failure: penalty shaped by the configured {@link FailurePenaltyPolicy}.
 */
public final class ReputationPolicy {

    private final FailurePenaltyPolicy failurePolicy;
    private final double failurePenalty;
    private final double successReward;
    private final double fastCompletionBonus;
    private final double slowCompletionPenalty;

    public ReputationPolicy(MarketConfig config) {
        this(config.failurePenaltyPolicy(), config.failurePenalty(), config.successReward(),
                config.fastCompletionBonus(), config.slowCompletionPenalty());
    }

    public ReputationPolicy(FailurePenaltyPolicy failurePolicy, double failurePenalty, double successReward,
            double fastCompletionBonus, double slowCompletionPenalty) {
        this.failurePolicy = failurePolicy;
        this.failurePenalty = failurePenalty;
        this.successReward = successReward;
        this.fastCompletionBonus = fastCompletionBonus;
        this.slowCompletionPenalty = slowCompletionPenalty;
    }

    /**
     * @param estimatedTime worker's estimate from its bid, may be null
     * @param taskTimeout   execution timeout of the task, may be null
     */
    public double delta(ExecutionResult result, Duration estimatedTime, Duration taskTimeout) {
        if (!result.success()) {
            return -failurePolicy.penalty(failurePenalty, result.completedFraction());
        }

        double delta = successReward;
        Duration elapsed = result.executionTime();
        if (elapsed == null) {
            return delta;
        }
        if (taskTimeout != null && !taskTimeout.isZero()
                && elapsed.compareTo(taskTimeout.dividedBy(2)) <= 0) {
            delta += fastCompletionBonus;
        }
        if (estimatedTime != null && !estimatedTime.isZero() && elapsed.compareTo(estimatedTime) > 0) {
            delta -= slowCompletionPenalty;
        }
        return delta;
    }

    /** Delta applied when an escrow is refunded because the hold window ran out */
    public double expiredHoldDelta() {
        return -failurePolicy.penalty(failurePenalty, 0.0);
    }

    public FailurePenaltyPolicy failurePolicy() {
        return failurePolicy;
    }
}
