package agora.market.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local reputation store. Scores start at the initial score and are clamped to [0, 100].
 */
public class InMemoryReputationGateway implements ReputationGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReputationGateway.class);

    public static final double DEFAULT_INITIAL_SCORE = 50.0;

    private final Map<String, Double> scores = new ConcurrentHashMap<>();
    private final double initialScore;

    public InMemoryReputationGateway() {
        this(DEFAULT_INITIAL_SCORE);
    }

    public InMemoryReputationGateway(double initialScore) {
        this.initialScore = initialScore;
    }

    @Override
    public double getScore(String workerId) {
        return scores.getOrDefault(workerId, initialScore);
    }

    @Override
    public double updateScore(String workerId, double delta, String reason) {
        double updated = scores.merge(workerId, clamp(initialScore + delta),
                (current, ignored) -> clamp(current + delta));
        log.debug("Reputation {} {} -> {} ({})", workerId, delta >= 0 ? "+" + delta : delta, updated, reason);
        return updated;
    }

    /** Seed a score, e.g. when a worker registers with a known reputation */
    public void setScore(String workerId, double score) {
        scores.put(workerId, clamp(score));
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
