package agora.market.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("workers") Map<String, Long> workers,
        @JsonProperty("openAuctions") Integer openAuctions,
        @JsonProperty("ledgerBalanced") Boolean ledgerBalanced) {

    public static HealthResponse healthy(String uptime, String version, Map<String, Long> workers,
            int openAuctions, boolean ledgerBalanced) {
        return new HealthResponse(ledgerBalanced ? "healthy" : "degraded", "ok", uptime, version, workers,
                openAuctions, ledgerBalanced);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
