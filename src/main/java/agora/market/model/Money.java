package agora.market.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers for monetary amounts. All amounts carry scale 8.
 */
public final class Money {

    public static final int SCALE = 8;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_EVEN);

    private Money() {
    }

    public static BigDecimal of(String amount) {
        return normalize(new BigDecimal(amount));
    }

    public static BigDecimal of(double amount) {
        return normalize(BigDecimal.valueOf(amount));
    }

    /** Null-safe rescale to the ledger scale */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }
}
