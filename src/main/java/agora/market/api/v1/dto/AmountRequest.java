package agora.market.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Request DTO for deposits and withdrawals.
 */
public record AmountRequest(
        @JsonProperty("amount") BigDecimal amount) {

    public void validate() {
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
    }
}
