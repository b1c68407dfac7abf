package agora.market.api.v1.dto;

import agora.market.api.internal.v1.dto.WorkerResponse;
import agora.market.model.DiscoveryResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ranked discovery results.
 */
public record DiscoveryResponse(
        @JsonProperty("count") int count,
        @JsonProperty("workers") List<Match> workers) {

    public record Match(
            @JsonProperty("score") double score,
            @JsonProperty("worker") WorkerResponse worker) {
    }

    public static DiscoveryResponse from(List<DiscoveryResult> results) {
        List<Match> matches = results.stream()
                .map(r -> new Match(r.score(), WorkerResponse.from(r.worker())))
                .toList();
        return new DiscoveryResponse(matches.size(), matches);
    }
}
