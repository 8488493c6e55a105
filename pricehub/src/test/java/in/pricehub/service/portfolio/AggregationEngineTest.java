package in.pricehub.service.portfolio;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.domain.portfolio.DeltaDirection;
import in.pricehub.domain.portfolio.PortfolioSnapshot;
import in.pricehub.domain.portfolio.Position;
import in.pricehub.domain.portfolio.PositionValuation;
import in.pricehub.domain.portfolio.SectorAllocation;
import in.pricehub.infrastructure.metrics.NoopLivePriceMetrics;
import in.pricehub.service.live.PriceCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Incremental portfolio aggregation")
class AggregationEngineTest {

    private static final Instant NOW = Instant.parse("2024-02-06T15:00:00Z");

    private PriceCache cache;
    private AggregationEngine engine;
    private final List<PortfolioSnapshot> snapshots = new ArrayList<>();
    private final List<DeltaDirection> deltas = new ArrayList<>();

    @BeforeEach
    void setUp() {
        cache = new PriceCache();
        engine = new AggregationEngine(cache, new StaticSectorClassifier(),
            Clock.fixed(NOW, ZoneOffset.UTC), NoopLivePriceMetrics.INSTANCE);
        engine.onSnapshot(snapshots::add);
        engine.onDelta(deltas::add);
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }

    @Test
    @DisplayName("Price tick revalues the position and the totals")
    void testTickRevaluesPosition() {
        Set<Ticker> interest = engine.replacePositions(List.of(Position.of("p1", "TSLA", "10", "200")));

        assertEquals(Set.of(Ticker.of("TSLA")), interest);
        PortfolioSnapshot initial = engine.snapshot();
        assertEquals(0, initial.totalValue().compareTo(bd("2000")));
        assertEquals(0, initial.totalProfitLoss().signum());
        assertEquals(1L, initial.version());
        assertEquals(NOW, initial.lastUpdatedAt());

        engine.onPriceChanged(PriceTick.of("TSLA", "220", 1L));

        PortfolioSnapshot after = engine.snapshot();
        assertEquals(0, after.totalValue().compareTo(bd("2200")));
        assertEquals(0, after.totalProfitLoss().compareTo(bd("200")));
        assertEquals("10.0000", after.totalProfitLossPercent().toPlainString());
        assertEquals(2L, after.version());

        PositionValuation v = engine.valuations().get(0);
        assertEquals("10.0000", v.profitLossPercent().toPlainString());
        assertTrue(v.live());
    }

    @Test
    @DisplayName("A tick that changes no valuation produces no new snapshot")
    void testNoOpTickKeepsSnapshot() {
        engine.replacePositions(List.of(Position.of("p1", "TSLA", "10", "200")));
        engine.onPriceChanged(PriceTick.of("TSLA", "220", 1L));
        PortfolioSnapshot before = engine.snapshot();
        int published = snapshots.size();

        engine.onPriceChanged(PriceTick.of("TSLA", "220.00", 2L));
        engine.onPriceChanged(PriceTick.of("NVDA", "900", 2L));

        assertSame(before, engine.snapshot());
        assertEquals(published, snapshots.size());
    }

    @Test
    void testVersionIncreasesByOnePerSnapshot() {
        engine.replacePositions(List.of(Position.of("p1", "TSLA", "10", "200")));
        engine.onPriceChanged(PriceTick.of("TSLA", "201", 1L));
        engine.onPriceChanged(PriceTick.of("TSLA", "202", 2L));

        assertEquals(3, snapshots.size());
        for (int i = 0; i < snapshots.size(); i++) {
            assertEquals(i + 1L, snapshots.get(i).version());
        }
    }

    @Test
    void testUntickedPositionUsesLastKnownPriceThenBuyPrice() {
        Position withLast = new Position("p1", Ticker.of("AAPL"), bd("2"), bd("100"), bd("150"));
        Position withoutLast = Position.of("p2", "MSFT", "1", "400");

        engine.replacePositions(List.of(withLast, withoutLast));

        PortfolioSnapshot s = engine.snapshot();
        assertEquals(0, s.totalValue().compareTo(bd("700")), "2 * 150 + 1 * 400");
        assertTrue(engine.valuations().stream().noneMatch(PositionValuation::live));
    }

    @Test
    void testCachedPriceSeedsNewPositions() {
        cache.applyTick(PriceTick.of("AAPL", "180", 1L));

        engine.replacePositions(List.of(Position.of("p1", "AAPL", "1", "100")));

        PositionValuation v = engine.valuations().get(0);
        assertEquals(0, v.currentPrice().compareTo(bd("180")));
        assertTrue(v.live());
    }

    @Test
    void testOnlyPositionsOfTickedTickerChange() {
        engine.replacePositions(List.of(
            Position.of("p1", "AAPL", "1", "100"),
            Position.of("p2", "AAPL", "3", "120"),
            Position.of("p3", "MSFT", "1", "400")));

        engine.onPriceChanged(PriceTick.of("AAPL", "110", 1L));

        List<PositionValuation> values = engine.valuations();
        assertEquals(0, values.get(0).value().compareTo(bd("110")));
        assertEquals(0, values.get(1).value().compareTo(bd("330")));
        assertFalse(values.get(2).live(), "MSFT untouched");
        assertEquals(0, engine.snapshot().totalValue().compareTo(bd("840")));
    }

    @Test
    void testDeltaEmittedOnlyForPriceDrivenSnapshots() {
        engine.replacePositions(List.of(Position.of("p1", "TSLA", "10", "200")));
        assertTrue(deltas.isEmpty(), "loading positions is not a price move");

        engine.onPriceChanged(PriceTick.of("TSLA", "210", 1L));
        engine.onPriceChanged(PriceTick.of("TSLA", "205", 2L));

        assertEquals(List.of(DeltaDirection.INCREASED, DeltaDirection.DECREASED), deltas);
    }

    @Test
    void testDuplicatePositionIdRejected() {
        List<Position> dupes = List.of(Position.of("p1", "AAPL", "1", "100"), Position.of("p1", "MSFT", "1", "100"));

        assertThrows(IllegalArgumentException.class, () -> engine.replacePositions(dupes));
    }

    @Test
    @DisplayName("Sector breakdown is rebuilt only when the ticker set changes")
    void testSectorBreakdownMemoised() {
        engine.replacePositions(List.of(
            Position.of("p1", "AAPL", "1", "100"),
            Position.of("p2", "MSFT", "1", "100"),
            Position.of("p3", "JPM", "1", "100")));
        assertEquals(1, engine.sectorComputations());

        engine.onPriceChanged(PriceTick.of("AAPL", "120", 1L));
        engine.replacePositions(List.of(
            Position.of("p9", "JPM", "5", "150"),
            Position.of("p8", "MSFT", "2", "300"),
            Position.of("p7", "AAPL", "4", "90")));
        assertEquals(1, engine.sectorComputations(), "same tickers, different positions");

        engine.replacePositions(List.of(Position.of("p1", "TSLA", "1", "100")));
        assertEquals(2, engine.sectorComputations());
    }

    @Test
    void testSectorBreakdownByTickerCount() {
        engine.replacePositions(List.of(
            Position.of("p1", "AAPL", "1", "100"),
            Position.of("p2", "MSFT", "100", "100"),
            Position.of("p3", "MSFT", "1", "100"),
            Position.of("p4", "JPM", "1", "100"),
            Position.of("p5", "ZZZZ", "1", "100")));

        List<SectorAllocation> sectors = engine.sectorBreakdown();

        assertEquals(3, sectors.size());
        assertEquals("Technology", sectors.get(0).sector());
        assertEquals(2, sectors.get(0).count());
        assertEquals(List.of("AAPL", "MSFT"), sectors.get(0).tickers());
        assertEquals("50.00", sectors.get(0).percentage().toPlainString());
        assertEquals("Financial Services", sectors.get(1).sector());
        assertEquals("25.00", sectors.get(1).percentage().toPlainString());
        assertEquals(SectorClassifier.OTHER, sectors.get(2).sector());
    }

    @Test
    void testEmptyPortfolio() {
        engine.replacePositions(List.of());

        assertEquals(0, engine.snapshot().positionCount());
        assertTrue(engine.sectorBreakdown().isEmpty());
        assertTrue(engine.valuations().isEmpty());
    }

    @Test
    void testFingerprintIgnoresOrder() {
        assertEquals(
            AggregationEngine.fingerprint(List.of(Ticker.of("MSFT"), Ticker.of("AAPL"))),
            AggregationEngine.fingerprint(List.of(Ticker.of("AAPL"), Ticker.of("MSFT"))));
        assertEquals("AAPL,MSFT", AggregationEngine.fingerprint(Set.of(Ticker.of("AAPL"), Ticker.of("MSFT"))));
    }
}
