package agora.market.model;

import java.time.Duration;

/**
 * Outcome reported by the execution runtime.
 *
 * @param completedFraction share of the work finished before a failure, in [0, 1]
 */
public record ExecutionResult(
        boolean success,
        Duration executionTime,
        String output,
        String error,
        double completedFraction) {

    public static ExecutionResult success(Duration executionTime, String output) {
        return new ExecutionResult(true, executionTime, output, null, 1.0);
    }

    public static ExecutionResult failure(Duration executionTime, String error) {
        return new ExecutionResult(false, executionTime, null, error, 0.0);
    }

    public static ExecutionResult partial(Duration executionTime, String error, double completedFraction) {
        return new ExecutionResult(false, executionTime, null, error, completedFraction);
    }
}
