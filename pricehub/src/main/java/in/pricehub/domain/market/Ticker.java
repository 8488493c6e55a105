package in.pricehub.domain.market;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Upper-case stock symbol. Two tickers are equal when their normalised symbols are equal,
 * so "aapl", " AAPL " and "AAPL" all map to the same ticker.
 */
public record Ticker(String symbol) implements Comparable<Ticker> {

    public Ticker {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Ticker symbol cannot be blank");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static Ticker of(String symbol) {
        return new Ticker(symbol);
    }

    /**
     * Normalise a batch of raw symbols, dropping duplicates (after case folding) and preserving order.
     */
    public static Set<Ticker> setOf(Collection<String> symbols) {
        Set<Ticker> out = new LinkedHashSet<>();
        if (symbols == null) {
            return out;
        }
        for (String s : symbols) {
            out.add(new Ticker(s));
        }
        return out;
    }

    @Override
    public int compareTo(Ticker other) {
        return symbol.compareTo(other.symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
