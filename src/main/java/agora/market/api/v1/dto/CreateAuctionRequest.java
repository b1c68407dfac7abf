package agora.market.api.v1.dto;

import agora.market.model.AuctionKind;
import agora.market.model.AuctionSpec;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for opening an auction.
 * POST /api/v1/auctions
 */
public record CreateAuctionRequest(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("requesterId") String requesterId,
        @JsonProperty("kind") String kind,
        @JsonProperty("reservePrice") BigDecimal reservePrice,
        @JsonProperty("maxPrice") BigDecimal maxPrice,
        @JsonProperty("minReputation") double minReputation,
        @JsonProperty("capabilities") Set<String> capabilities,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("taskTimeoutMs") Long taskTimeoutMs,
        @JsonProperty("candidates") List<String> candidates) {

    public void validate() {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (maxPrice == null) {
            throw new IllegalArgumentException("maxPrice is required");
        }
        if (durationMs != null && durationMs <= 0) {
            throw new IllegalArgumentException("durationMs must be positive");
        }
        if (taskTimeoutMs != null && taskTimeoutMs <= 0) {
            throw new IllegalArgumentException("taskTimeoutMs must be positive");
        }
        // Throws IllegalArgumentException on unknown kinds
        AuctionKind.parse(kind);
    }

    public AuctionSpec toSpec() {
        return AuctionSpec.builder()
                .taskId(taskId)
                .requesterId(requesterId)
                .kind(kind == null || kind.isBlank() ? null : AuctionKind.parse(kind))
                .reservePrice(reservePrice)
                .maxPrice(maxPrice)
                .minReputation(minReputation)
                .capabilities(capabilities)
                .duration(durationMs != null ? Duration.ofMillis(durationMs) : null)
                .taskTimeout(taskTimeoutMs != null ? Duration.ofMillis(taskTimeoutMs) : null)
                .build();
    }

    public List<String> candidateIds() {
        return candidates != null ? candidates : List.of();
    }
}
