package in.pricehub.domain.portfolio;

import java.math.BigDecimal;
import java.util.List;

/**
 * Share of distinct portfolio tickers that fall in one sector.
 */
public record SectorAllocation(
    String sector,
    List<String> tickers,
    int count,
    BigDecimal percentage
) {
    public SectorAllocation {
        tickers = List.copyOf(tickers);
    }
}
