package agora.market.api.v1.dto;

import agora.market.model.DiscoveryQuery;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Set;

/**
 * Request DTO for worker discovery.
 * POST /api/v1/discover
 */
public record DiscoverRequest(
        @JsonProperty("capabilities") Set<String> capabilities,
        @JsonProperty("minReputation") double minReputation,
        @JsonProperty("minQuality") double minQuality,
        @JsonProperty("maxResponseTimeMs") Long maxResponseTimeMs,
        @JsonProperty("maxUtilization") Double maxUtilization,
        @JsonProperty("preferredRegions") Set<String> preferredRegions,
        @JsonProperty("limit") Integer limit) {

    public void validate() {
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities must not be empty");
        }
        if (maxResponseTimeMs != null && maxResponseTimeMs <= 0) {
            throw new IllegalArgumentException("maxResponseTimeMs must be positive");
        }
        if (maxUtilization != null && (maxUtilization <= 0 || maxUtilization > 1)) {
            throw new IllegalArgumentException("maxUtilization must be in (0, 1]");
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public DiscoveryQuery toQuery() {
        DiscoveryQuery.Builder builder = DiscoveryQuery.builder()
                .capabilities(capabilities)
                .minReputation(minReputation)
                .minQuality(minQuality)
                .preferredRegions(preferredRegions);
        if (maxResponseTimeMs != null) {
            builder.maxResponseTime(Duration.ofMillis(maxResponseTimeMs));
        }
        if (maxUtilization != null) {
            builder.maxUtilization(maxUtilization);
        }
        if (limit != null) {
            builder.limit(limit);
        }
        return builder.build();
    }
}
