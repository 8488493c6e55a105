package in.pricehub.domain.portfolio;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;

/**
 * Portfolio totals at one instant. Never mutated: every recompute produces a new instance
 * with version + 1, so listeners can detect change by reference or by version.
 */
public record PortfolioSnapshot(
    BigDecimal totalValue,
    BigDecimal totalCost,
    BigDecimal totalProfitLoss,
    BigDecimal totalProfitLossPercent,
    int positionCount,
    long version,
    Instant lastUpdatedAt
) {
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public static final PortfolioSnapshot EMPTY = new PortfolioSnapshot(
        BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0L, Instant.EPOCH);

    /**
     * Sum valuations into the next snapshot version.
     */
    public static PortfolioSnapshot sum(Collection<PositionValuation> valuations, long version, Instant at) {
        BigDecimal value = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (PositionValuation v : valuations) {
            value = value.add(v.value());
            cost = cost.add(v.costBasis());
        }
        BigDecimal pnl = value.subtract(cost);
        BigDecimal pnlPercent = cost.signum() == 0
            ? BigDecimal.ZERO
            : pnl.multiply(HUNDRED).divide(cost, PositionValuation.PERCENT_SCALE, RoundingMode.HALF_UP);
        return new PortfolioSnapshot(value, cost, pnl, pnlPercent, valuations.size(), version, at);
    }
}
