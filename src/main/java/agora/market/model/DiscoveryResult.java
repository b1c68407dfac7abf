package agora.market.model;

/**
 * A discovered worker together with its match score in [0, 1].
 */
public record DiscoveryResult(WorkerRecord worker, double score) {
}
