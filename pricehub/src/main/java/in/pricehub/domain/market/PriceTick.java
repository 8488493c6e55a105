package in.pricehub.domain.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Single trade price update for one ticker.
 *
 * timestamp is the upstream event time in epoch millis; it orders ticks per ticker.
 */
public record PriceTick(
    Ticker ticker,
    BigDecimal price,
    long size,
    long timestamp
) {
    public PriceTick {
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive for " + ticker + ", got " + price);
        }
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative for " + ticker);
        }
    }

    public static PriceTick of(String symbol, String price, long timestamp) {
        return new PriceTick(Ticker.of(symbol), new BigDecimal(price), 0L, timestamp);
    }

    public Instant eventTime() {
        return Instant.ofEpochMilli(timestamp);
    }
}
