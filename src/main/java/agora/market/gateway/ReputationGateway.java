package agora.market.gateway;

/**
 * Source of truth for worker reputation scores (0-100).
 */
public interface ReputationGateway {

    double getScore(String workerId);

    /**
     * Apply a delta and return the new score.
     */
    double updateScore(String workerId, double delta, String reason);
}
