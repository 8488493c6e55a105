package in.pricehub.domain.portfolio;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived valuation of one position at one price.
 *
 * value = price * quantity
 * profitLoss = value - buyPrice * quantity
 * profitLossPercent = (price - buyPrice) / buyPrice * 100
 *
 * live is false while the price is still the pre-live fallback.
 */
public record PositionValuation(
    Position position,
    BigDecimal currentPrice,
    BigDecimal value,
    BigDecimal costBasis,
    BigDecimal profitLoss,
    BigDecimal profitLossPercent,
    boolean live
) {
    static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public static PositionValuation at(Position position, BigDecimal price, boolean live) {
        BigDecimal value = price.multiply(position.quantity());
        BigDecimal cost = position.costBasis();
        BigDecimal pnl = value.subtract(cost);
        BigDecimal pnlPercent = price.subtract(position.buyPrice())
            .multiply(HUNDRED)
            .divide(position.buyPrice(), PERCENT_SCALE, RoundingMode.HALF_UP);
        return new PositionValuation(position, price, value, cost, pnl, pnlPercent, live);
    }

    public static PositionValuation initial(Position position) {
        return at(position, position.initialPrice(), false);
    }

    /**
     * Same price (numerically) and same liveness as another valuation.
     */
    public boolean samePriceAs(PositionValuation other) {
        return other != null && live == other.live && currentPrice.compareTo(other.currentPrice) == 0;
    }
}
