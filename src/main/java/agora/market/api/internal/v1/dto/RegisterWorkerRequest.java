package agora.market.api.internal.v1.dto;

import agora.market.model.WorkerRecord;
import agora.market.model.WorkerStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Request DTO for worker registration.
 * POST /internal/v1/workers
 */
public record RegisterWorkerRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("capabilities") Set<String> capabilities,
        @JsonProperty("capacity") Integer capacity,
        @JsonProperty("quality") Double quality,
        @JsonProperty("region") String region,
        @JsonProperty("endpoint") String endpoint) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities must not be empty");
        }
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (quality != null && (quality < 0 || quality > 100)) {
            throw new IllegalArgumentException("quality must be between 0 and 100");
        }
    }

    /** Build the index record; reputation comes from the reputation service */
    public WorkerRecord toRecord(double reputation) {
        WorkerRecord.Builder builder = WorkerRecord.builder()
                .id(workerId)
                .capabilities(capabilities)
                .status(WorkerStatus.ONLINE)
                .region(region)
                .endpoint(endpoint)
                .reputation(reputation);
        if (capacity != null) {
            builder.capacity(capacity);
        }
        if (quality != null) {
            builder.quality(quality);
        }
        return builder.build();
    }
}
