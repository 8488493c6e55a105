package in.pricehub.service.live;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static in.pricehub.service.live.PriceCache.ApplyResult.*;
import static org.junit.jupiter.api.Assertions.*;

class PriceCacheTest {

    private PriceCache cache;

    @BeforeEach
    void setUp() {
        cache = new PriceCache();
    }

    @Test
    void testFirstTickIsChanged() {
        assertEquals(CHANGED, cache.applyTick(PriceTick.of("AAPL", "185.43", 1L)));
        assertEquals(1, cache.size());
    }

    @Test
    void testOlderTickNeverOverwritesNewer() {
        cache.applyTick(PriceTick.of("AAPL", "101", 5L));

        assertEquals(STALE, cache.applyTick(PriceTick.of("AAPL", "99", 4L)));

        PriceTick cached = cache.get(Ticker.of("AAPL")).orElseThrow();
        assertEquals(5L, cached.timestamp());
        assertEquals("101", cached.price().toPlainString());
    }

    @Test
    void testEqualTimestampIsStale() {
        cache.applyTick(PriceTick.of("AAPL", "101", 5L));

        PriceCache.ApplyResult result = cache.applyTick(PriceTick.of("AAPL", "102", 5L));

        assertEquals(STALE, result);
        assertFalse(result.accepted());
    }

    @Test
    void testSamePriceNewerTimestampIsUnchangedButRefreshes() {
        cache.applyTick(PriceTick.of("AAPL", "185.4", 5L));

        PriceCache.ApplyResult result = cache.applyTick(PriceTick.of("AAPL", "185.40", 6L));

        assertEquals(UNCHANGED, result);
        assertTrue(result.accepted());
        assertEquals(6L, cache.get(Ticker.of("AAPL")).orElseThrow().timestamp());
    }

    @Test
    void testTickersAreIndependent() {
        cache.applyTick(PriceTick.of("AAPL", "100", 10L));

        assertEquals(CHANGED, cache.applyTick(PriceTick.of("MSFT", "400", 1L)),
            "an older timestamp on another ticker is not stale");
    }

    @Test
    void testGetAllSkipsMissesAndSnapshotIsSorted() {
        cache.applyTick(PriceTick.of("MSFT", "400", 1L));
        cache.applyTick(PriceTick.of("AAPL", "100", 1L));

        Map<Ticker, PriceTick> found = cache.getAll(List.of(Ticker.of("AAPL"), Ticker.of("TSLA")));
        assertEquals(1, found.size());
        assertTrue(found.containsKey(Ticker.of("AAPL")));

        List<PriceTick> all = cache.snapshot();
        assertEquals(Ticker.of("AAPL"), all.get(0).ticker());
        assertEquals(Ticker.of("MSFT"), all.get(1).ticker());

        cache.clear();
        assertTrue(cache.get(Ticker.of("AAPL")).isEmpty());
    }
}
