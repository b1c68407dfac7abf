package agora.market.api.v1.dto;

import agora.market.model.Bid;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record BidResponse(
        @JsonProperty("bidId") String bidId,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("estimatedTimeMs") long estimatedTimeMs,
        @JsonProperty("sequence") int sequence,
        @JsonProperty("score") double score) {

    public static BidResponse from(Bid bid) {
        return new BidResponse(bid.id(), bid.workerId(), bid.price(), bid.estimatedTimeMs(),
                bid.sequence(), bid.score());
    }
}
