package agora.market.exception;

import java.math.BigDecimal;

public class InsufficientFundsException extends MarketException {

    private final String ownerId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(String ownerId, BigDecimal available, BigDecimal requested) {
        super(ErrorKind.BUSINESS_RULE, "Insufficient funds for " + ownerId + ": available "
                + available.toPlainString() + ", requested " + requested.toPlainString());
        this.ownerId = ownerId;
        this.available = available;
        this.requested = requested;
    }

    public String ownerId() {
        return ownerId;
    }

    public BigDecimal available() {
        return available;
    }

    public BigDecimal requested() {
        return requested;
    }
}
