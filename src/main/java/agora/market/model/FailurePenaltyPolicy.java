package agora.market.model;

/**
 * How hard a failed execution hits the worker's reputation.
 */
public enum FailurePenaltyPolicy {

    /** Same penalty for every failure */
    FLAT {
        @Override
        public double penalty(double basePenalty, double completedFraction) {
            return basePenalty;
        }
    },

    /** Penalty scaled by the share of work left unfinished */
    PROPORTIONAL {
        @Override
        public double penalty(double basePenalty, double completedFraction) {
            double done = Math.max(0.0, Math.min(1.0, completedFraction));
            return basePenalty * (1.0 - done);
        }
    };

    public abstract double penalty(double basePenalty, double completedFraction);
}
