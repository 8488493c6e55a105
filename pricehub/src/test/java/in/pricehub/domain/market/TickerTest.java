package in.pricehub.domain.market;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TickerTest {

    @Test
    void testSymbolsNormaliseToUpperCase() {
        assertEquals(Ticker.of("AAPL"), Ticker.of(" aapl "));
        assertEquals("AAPL", Ticker.of("aApL").symbol());
    }

    @Test
    void testBlankSymbolRejected() {
        assertThrows(IllegalArgumentException.class, () -> Ticker.of(" "));
        assertThrows(IllegalArgumentException.class, () -> Ticker.of(null));
    }

    @Test
    void testSetOfDropsCaseDuplicatesAndKeepsOrder() {
        Set<Ticker> tickers = Ticker.setOf(List.of("msft", "AAPL", "MSFT"));

        assertEquals(List.of(Ticker.of("MSFT"), Ticker.of("AAPL")), List.copyOf(tickers));
        assertTrue(Ticker.setOf(null).isEmpty(), "null batch is empty");
    }

    @Test
    void testPriceTickValidation() {
        assertThrows(IllegalArgumentException.class, () -> PriceTick.of("AAPL", "0", 1L));
        assertThrows(IllegalArgumentException.class, () -> PriceTick.of("AAPL", "-1.5", 1L));

        PriceTick tick = PriceTick.of("aapl", "185.43", 1707229815000L);
        assertEquals(Ticker.of("AAPL"), tick.ticker());
        assertEquals("2024-02-06T14:30:15Z", tick.eventTime().toString());
    }
}
