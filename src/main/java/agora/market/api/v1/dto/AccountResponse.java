package agora.market.api.v1.dto;

import agora.market.model.Account;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record AccountResponse(
        @JsonProperty("ownerId") String ownerId,
        @JsonProperty("balance") BigDecimal balance,
        @JsonProperty("totalDeposited") BigDecimal totalDeposited,
        @JsonProperty("totalWithdrawn") BigDecimal totalWithdrawn,
        @JsonProperty("totalEarned") BigDecimal totalEarned,
        @JsonProperty("totalSpent") BigDecimal totalSpent,
        @JsonProperty("lockedInChannels") BigDecimal lockedInChannels) {

    public static AccountResponse from(Account a) {
        return new AccountResponse(a.ownerId(), a.balance(), a.totalDeposited(), a.totalWithdrawn(),
                a.totalEarned(), a.totalSpent(), a.lockedInChannels());
    }
}
