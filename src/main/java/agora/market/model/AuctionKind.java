package agora.market.model;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Auction pricing rules. Each kind computes the clearing price paid by the winner.
 */
public enum AuctionKind {

    /** Winner pays its own bid */
    FIRST_PRICE {
        @Override
        public BigDecimal clearingPrice(Bid winner, List<Bid> bids, BigDecimal reservePrice) {
            return winner.price();
        }
    },

    /**
     * Winner pays the second-highest quoted price among all bids,
     * or the reserve price when only one bid was received. A lone bid with no reserve pays its own price.
     */
    SECOND_PRICE {
        @Override
        public BigDecimal clearingPrice(Bid winner, List<Bid> bids, BigDecimal reservePrice) {
            if (bids.size() < 2) {
                BigDecimal reserve = Money.normalize(reservePrice);
                return reserve.signum() > 0 ? reserve : winner.price();
            }
            List<BigDecimal> prices = bids.stream()
                    .map(Bid::price)
                    .sorted(Comparator.reverseOrder())
                    .toList();
            return prices.get(1);
        }
    },

    /** Winner pays its own bid, raised to the reserve price if lower */
    RESERVE {
        @Override
        public BigDecimal clearingPrice(Bid winner, List<Bid> bids, BigDecimal reservePrice) {
            BigDecimal reserve = Money.normalize(reservePrice);
            return winner.price().max(reserve);
        }
    };

    public abstract BigDecimal clearingPrice(Bid winner, List<Bid> bids, BigDecimal reservePrice);

    /** Parse a kind name, case-insensitive, defaulting to SECOND_PRICE */
    public static AuctionKind parse(String value) {
        if (value == null || value.isBlank()) {
            return SECOND_PRICE;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (AuctionKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown auction kind: " + value);
    }
}
