package agora.market.api.internal.v1.dto;

import agora.market.model.WorkerRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Worker view returned by the worker endpoints and by discovery.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("status") String status,
        @JsonProperty("load") int load,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("reputation") double reputation,
        @JsonProperty("quality") double quality,
        @JsonProperty("region") String region,
        @JsonProperty("avgResponseTimeMs") Long avgResponseTimeMs,
        @JsonProperty("lastSeen") Instant lastSeen) {

    public static WorkerResponse from(WorkerRecord w) {
        return new WorkerResponse(
                w.id(),
                w.capabilities().stream().sorted().toList(),
                w.status().name(),
                w.load(),
                w.capacity(),
                w.reputation(),
                w.quality(),
                w.region(),
                w.avgResponseTime() != null ? w.avgResponseTime().toMillis() : null,
                w.lastSeen());
    }
}
