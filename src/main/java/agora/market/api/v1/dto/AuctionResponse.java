package agora.market.api.v1.dto;

import agora.market.model.Bid;
import agora.market.model.TaskAuction;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Auction view with its bids.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuctionResponse(
        @JsonProperty("auctionId") String auctionId,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("kind") String kind,
        @JsonProperty("status") String status,
        @JsonProperty("reservePrice") BigDecimal reservePrice,
        @JsonProperty("maxPrice") BigDecimal maxPrice,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("expiresAt") Instant expiresAt,
        @JsonProperty("closedAt") Instant closedAt,
        @JsonProperty("bidCount") int bidCount,
        @JsonProperty("bids") List<BidResponse> bids,
        @JsonProperty("winnerId") String winnerId,
        @JsonProperty("finalPrice") BigDecimal finalPrice) {

    public static AuctionResponse from(TaskAuction a) {
        return new AuctionResponse(
                a.id(),
                a.taskId(),
                a.kind().name(),
                a.status().name(),
                a.reservePrice(),
                a.maxPrice(),
                a.createdAt(),
                a.expiresAt(),
                a.closedAt(),
                a.bids().size(),
                a.bids().stream().map(BidResponse::from).toList(),
                a.winningBid().map(Bid::workerId).orElse(null),
                a.finalPrice());
    }
}
