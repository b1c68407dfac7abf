package agora.market.api.v1.dto;

import agora.market.model.BidRequest;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Request DTO for a bid.
 * POST /api/v1/auctions/{id}/bids
 */
public record SubmitBidRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("estimatedTimeMs") long estimatedTimeMs,
        @JsonProperty("reputation") double reputation,
        @JsonProperty("quality") double quality) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (price == null) {
            throw new IllegalArgumentException("price is required");
        }
    }

    public BidRequest toBidRequest() {
        return new BidRequest(workerId, price, Duration.ofMillis(estimatedTimeMs), reputation, quality);
    }
}
