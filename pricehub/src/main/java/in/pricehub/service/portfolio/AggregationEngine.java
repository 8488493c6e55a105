package in.pricehub.service.portfolio;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.domain.portfolio.DeltaDirection;
import in.pricehub.domain.portfolio.PortfolioSnapshot;
import in.pricehub.domain.portfolio.Position;
import in.pricehub.domain.portfolio.PositionValuation;
import in.pricehub.domain.portfolio.SectorAllocation;
import in.pricehub.infrastructure.metrics.LivePriceMetrics;
import in.pricehub.service.core.ListenerHandle;
import in.pricehub.service.core.ListenerList;
import in.pricehub.service.live.PriceCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Incremental portfolio valuation.
 *
 * Features:
 * - Per-position valuations cached and recomputed only for the ticker whose price changed
 * - A new PortfolioSnapshot (version + 1) only when at least one valuation changed
 * - Delta direction emitted after each price-driven snapshot
 * - Sector breakdown recomputed only when the set of tickers changes
 *
 * Positions that never receive a tick stay at their last externally supplied price
 * (Position.lastKnownPrice, else buyPrice).
 *
 * Mutations run on the event loop; snapshot(), valuations() and sectorBreakdown() are safe
 * from any thread.
 */
public final class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final PriceCache cache;
    private final SectorClassifier classifier;
    private final Clock clock;
    private final LivePriceMetrics metrics;

    private final Map<Ticker, List<Position>> positionsByTicker = new LinkedHashMap<>();
    private final Map<String, PositionValuation> valuations = new LinkedHashMap<>();

    private final ListenerList<PortfolioSnapshot> snapshotListeners = new ListenerList<>("SNAPSHOT LISTENER");
    private final ListenerList<DeltaDirection> deltaListeners = new ListenerList<>("DELTA SIGNAL");

    private volatile PortfolioSnapshot snapshot = PortfolioSnapshot.EMPTY;
    private volatile List<PositionValuation> valuationView = List.of();
    private volatile List<SectorAllocation> sectors = List.of();
    private String sectorFingerprint = "";
    private int sectorComputations = 0;

    public AggregationEngine(PriceCache cache, SectorClassifier classifier, Clock clock, LivePriceMetrics metrics) {
        this.cache = cache;
        this.classifier = classifier;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Replace the whole position list and recompute.
     *
     * @return distinct tickers of the new list (the engine's interest set)
     */
    public Set<Ticker> replacePositions(Collection<Position> positions) {
        Position.requireUniqueIds(positions);

        positionsByTicker.clear();
        valuations.clear();
        for (Position p : positions) {
            positionsByTicker.computeIfAbsent(p.ticker(), t -> new ArrayList<>()).add(p);
            valuations.put(p.positionId(), seed(p));
        }

        refreshSectors();
        publish(false);
        log.info("[PORTFOLIO] Loaded {} positions across {} tickers", positions.size(), positionsByTicker.size());
        return new TreeSet<>(positionsByTicker.keySet());
    }

    private PositionValuation seed(Position p) {
        return cache.get(p.ticker())
            .map(tick -> PositionValuation.at(p, tick.price(), true))
            .orElseGet(() -> PositionValuation.initial(p));
    }

    /**
     * Revalue the positions of one ticker. No-op if none of them changed.
     */
    public void onPriceChanged(PriceTick tick) {
        List<Position> affected = positionsByTicker.get(tick.ticker());
        if (affected == null) {
            return;
        }
        boolean changed = false;
        for (Position p : affected) {
            PositionValuation previous = valuations.get(p.positionId());
            PositionValuation next = PositionValuation.at(p, tick.price(), true);
            if (!next.samePriceAs(previous)) {
                valuations.put(p.positionId(), next);
                changed = true;
            }
        }
        if (changed) {
            publish(true);
        }
    }

    private void publish(boolean emitDelta) {
        PortfolioSnapshot previous = snapshot;
        PortfolioSnapshot next = PortfolioSnapshot.sum(valuations.values(), previous.version() + 1, clock.instant());
        snapshot = next;
        valuationView = List.copyOf(valuations.values());
        metrics.recordSnapshotRecompute();
        log.debug("[PORTFOLIO] Snapshot v{} value={} pnl={}", next.version(), next.totalValue(), next.totalProfitLoss());

        snapshotListeners.notifyAll(next);
        if (emitDelta) {
            deltaListeners.notifyAll(DeltaDirection.between(previous.totalValue(), next.totalValue()));
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Sector breakdown
    // ═══════════════════════════════════════════════════════════════════════

    private void refreshSectors() {
        String fingerprint = fingerprint(positionsByTicker.keySet());
        if (fingerprint.equals(sectorFingerprint)) {
            return;
        }
        sectorFingerprint = fingerprint;
        sectors = computeSectors(positionsByTicker.keySet());
        sectorComputations++;
    }

    /**
     * Sorted, comma-joined ticker list. Equal for equal ticker sets regardless of order.
     */
    static String fingerprint(Collection<Ticker> tickers) {
        return new TreeSet<>(tickers).stream().map(Ticker::symbol).collect(Collectors.joining(","));
    }

    private List<SectorAllocation> computeSectors(Collection<Ticker> tickers) {
        if (tickers.isEmpty()) {
            return List.of();
        }
        Map<String, List<String>> bySector = new TreeMap<>();
        for (Ticker t : new TreeSet<>(tickers)) {
            bySector.computeIfAbsent(classifier.sectorOf(t), s -> new ArrayList<>()).add(t.symbol());
        }
        BigDecimal total = BigDecimal.valueOf(tickers.size());
        List<SectorAllocation> out = new ArrayList<>();
        bySector.forEach((sector, symbols) -> out.add(new SectorAllocation(
            sector,
            symbols,
            symbols.size(),
            BigDecimal.valueOf(symbols.size()).multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP))));
        out.sort((a, b) -> {
            int byCount = Integer.compare(b.count(), a.count());
            return byCount != 0 ? byCount : a.sector().compareTo(b.sector());
        });
        return List.copyOf(out);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Reads and listeners
    // ═══════════════════════════════════════════════════════════════════════

    public PortfolioSnapshot snapshot() {
        return snapshot;
    }

    public List<PositionValuation> valuations() {
        return valuationView;
    }

    public List<SectorAllocation> sectorBreakdown() {
        return sectors;
    }

    /**
     * Number of times the sector breakdown was rebuilt.
     */
    int sectorComputations() {
        return sectorComputations;
    }

    public ListenerHandle onSnapshot(Consumer<PortfolioSnapshot> listener) {
        return snapshotListeners.add(listener);
    }

    public ListenerHandle onDelta(DeltaSignal signal) {
        return deltaListeners.add(signal::emit);
    }
}
