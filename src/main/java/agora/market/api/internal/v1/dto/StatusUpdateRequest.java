package agora.market.api.internal.v1.dto;

import agora.market.model.WorkerStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a worker status change.
 * POST /internal/v1/workers/{id}/status
 */
public record StatusUpdateRequest(
        @JsonProperty("status") String status) {

    public void validate() {
        parsedStatus();
    }

    public WorkerStatus parsedStatus() {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return WorkerStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + status);
        }
    }
}
