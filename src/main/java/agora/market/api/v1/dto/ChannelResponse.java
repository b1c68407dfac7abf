package agora.market.api.v1.dto;

import agora.market.model.ChannelTransaction;
import agora.market.model.PaymentChannel;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Channel view including the full transaction log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelResponse(
        @JsonProperty("channelId") String channelId,
        @JsonProperty("payerId") String payerId,
        @JsonProperty("payeeId") String payeeId,
        @JsonProperty("auctionRef") String auctionRef,
        @JsonProperty("state") String state,
        @JsonProperty("totalDeposit") BigDecimal totalDeposit,
        @JsonProperty("currentBalance") BigDecimal currentBalance,
        @JsonProperty("escrowedAmount") BigDecimal escrowedAmount,
        @JsonProperty("totalSettled") BigDecimal totalSettled,
        @JsonProperty("totalRefunded") BigDecimal totalRefunded,
        @JsonProperty("escrowTaskId") String escrowTaskId,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("closedAt") Instant closedAt,
        @JsonProperty("transactions") List<ChannelTransaction> transactions) {

    public static ChannelResponse from(PaymentChannel ch) {
        return new ChannelResponse(
                ch.id(),
                ch.payerId(),
                ch.payeeId(),
                ch.auctionRef(),
                ch.state().name(),
                ch.totalDeposit(),
                ch.currentBalance(),
                ch.escrowedAmount(),
                ch.totalSettled(),
                ch.totalRefunded(),
                ch.escrowTaskId(),
                ch.sequence(),
                ch.createdAt(),
                ch.closedAt(),
                ch.transactions());
    }
}
