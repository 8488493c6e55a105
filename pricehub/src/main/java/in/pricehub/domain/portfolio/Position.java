package in.pricehub.domain.portfolio;

import in.pricehub.domain.market.Ticker;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Holding supplied by the portfolio store.
 *
 * lastKnownPrice is the price the store last saw (may be null); it is the fallback
 * valuation price until a live tick arrives.
 */
public record Position(
    String positionId,
    Ticker ticker,
    BigDecimal quantity,
    BigDecimal buyPrice,
    BigDecimal lastKnownPrice
) {
    public Position {
        if (positionId == null || positionId.isBlank()) {
            throw new IllegalArgumentException("positionId cannot be blank");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null for position " + positionId);
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive for position " + positionId);
        }
        if (buyPrice == null || buyPrice.signum() <= 0) {
            throw new IllegalArgumentException("buyPrice must be positive for position " + positionId);
        }
        if (lastKnownPrice != null && lastKnownPrice.signum() <= 0) {
            throw new IllegalArgumentException("lastKnownPrice must be positive for position " + positionId);
        }
    }

    public static Position of(String positionId, String symbol, String quantity, String buyPrice) {
        return new Position(positionId, Ticker.of(symbol), new BigDecimal(quantity), new BigDecimal(buyPrice), null);
    }

    /**
     * @throws IllegalArgumentException if two positions share a positionId
     */
    public static void requireUniqueIds(Collection<Position> positions) {
        Set<String> ids = new HashSet<>();
        for (Position p : positions) {
            if (!ids.add(p.positionId())) {
                throw new IllegalArgumentException("Duplicate positionId: " + p.positionId());
            }
        }
    }

    public BigDecimal costBasis() {
        return buyPrice.multiply(quantity);
    }

    /**
     * Price used before any live tick: the store's last price, else the buy price.
     */
    public BigDecimal initialPrice() {
        return lastKnownPrice != null ? lastKnownPrice : buyPrice;
    }
}
