package in.pricehub.service.portfolio;

import in.pricehub.domain.market.Ticker;

import java.util.HashMap;
import java.util.Map;

/**
 * Sector lookup from a fixed table. Unknown tickers fall into SectorClassifier.OTHER.
 */
public final class StaticSectorClassifier implements SectorClassifier {

    private static final Map<String, String> DEFAULT_SECTORS = Map.ofEntries(
        // Technology
        Map.entry("AAPL", "Technology"), Map.entry("MSFT", "Technology"), Map.entry("NVDA", "Technology"),
        Map.entry("AMD", "Technology"), Map.entry("INTC", "Technology"), Map.entry("ORCL", "Technology"),
        Map.entry("CRM", "Technology"), Map.entry("ADBE", "Technology"), Map.entry("AVGO", "Technology"),
        Map.entry("QCOM", "Technology"), Map.entry("IBM", "Technology"),
        // Communication Services
        Map.entry("GOOGL", "Communication Services"), Map.entry("GOOG", "Communication Services"),
        Map.entry("META", "Communication Services"), Map.entry("NFLX", "Communication Services"),
        Map.entry("DIS", "Communication Services"), Map.entry("T", "Communication Services"),
        Map.entry("VZ", "Communication Services"), Map.entry("CMCSA", "Communication Services"),
        // Consumer Cyclical
        Map.entry("AMZN", "Consumer Cyclical"), Map.entry("TSLA", "Consumer Cyclical"),
        Map.entry("HD", "Consumer Cyclical"), Map.entry("MCD", "Consumer Cyclical"),
        Map.entry("NKE", "Consumer Cyclical"),
        // Consumer Defensive
        Map.entry("KO", "Consumer Defensive"), Map.entry("PEP", "Consumer Defensive"),
        Map.entry("PG", "Consumer Defensive"), Map.entry("WMT", "Consumer Defensive"),
        Map.entry("COST", "Consumer Defensive"),
        // Financial Services
        Map.entry("JPM", "Financial Services"), Map.entry("V", "Financial Services"),
        Map.entry("MA", "Financial Services"), Map.entry("BAC", "Financial Services"),
        Map.entry("WFC", "Financial Services"), Map.entry("GS", "Financial Services"),
        Map.entry("MS", "Financial Services"),
        // Healthcare
        Map.entry("JNJ", "Healthcare"), Map.entry("UNH", "Healthcare"), Map.entry("PFE", "Healthcare"),
        Map.entry("LLY", "Healthcare"), Map.entry("MRK", "Healthcare"), Map.entry("ABBV", "Healthcare"),
        // Energy
        Map.entry("XOM", "Energy"), Map.entry("CVX", "Energy"), Map.entry("COP", "Energy"),
        // Industrials
        Map.entry("BA", "Industrials"), Map.entry("CAT", "Industrials"), Map.entry("GE", "Industrials"),
        Map.entry("HON", "Industrials"), Map.entry("UPS", "Industrials"),
        // Utilities
        Map.entry("NEE", "Utilities"), Map.entry("DUK", "Utilities"), Map.entry("SO", "Utilities"),
        // Real Estate
        Map.entry("AMT", "Real Estate"), Map.entry("PLD", "Real Estate"), Map.entry("O", "Real Estate"),
        // Basic Materials
        Map.entry("LIN", "Basic Materials"), Map.entry("APD", "Basic Materials"), Map.entry("NEM", "Basic Materials")
    );

    private final Map<String, String> sectors;

    public StaticSectorClassifier() {
        this(DEFAULT_SECTORS);
    }

    /**
     * @param sectors symbol -> sector; symbols are normalised like tickers
     */
    public StaticSectorClassifier(Map<String, String> sectors) {
        Map<String, String> normalised = new HashMap<>();
        sectors.forEach((symbol, sector) -> normalised.put(Ticker.of(symbol).symbol(), sector));
        this.sectors = Map.copyOf(normalised);
    }

    @Override
    public String sectorOf(Ticker ticker) {
        return sectors.getOrDefault(ticker.symbol(), OTHER);
    }
}
