package in.pricehub.service.live;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory cache of the latest accepted tick per ticker.
 *
 * A tick is accepted only if its timestamp is strictly newer than the cached one; older or
 * duplicate ticks leave the cache untouched. Writes come from the event loop only; reads are
 * safe from any thread.
 */
public final class PriceCache {
    private static final Logger log = LoggerFactory.getLogger(PriceCache.class);

    /**
     * Outcome of applyTick.
     */
    public enum ApplyResult {
        /** Accepted and the price differs from the cached one (or nothing was cached). */
        CHANGED,
        /** Accepted for freshness; price numerically equal to the cached one. */
        UNCHANGED,
        /** Rejected: timestamp not newer than the cached tick. */
        STALE;

        public boolean accepted() {
            return this != STALE;
        }
    }

    private final ConcurrentHashMap<Ticker, PriceTick> latestTicks = new ConcurrentHashMap<>();

    public ApplyResult applyTick(PriceTick tick) {
        PriceTick previous = latestTicks.get(tick.ticker());
        if (previous != null && previous.timestamp() >= tick.timestamp()) {
            log.debug("Stale tick dropped: {} t={} (cached t={})",
                tick.ticker(), tick.timestamp(), previous.timestamp());
            return ApplyResult.STALE;
        }
        latestTicks.put(tick.ticker(), tick);
        if (previous != null && previous.price().compareTo(tick.price()) == 0) {
            return ApplyResult.UNCHANGED;
        }
        log.debug("Updated price cache: {} = {} @ {}", tick.ticker(), tick.price(), tick.timestamp());
        return ApplyResult.CHANGED;
    }

    public Optional<PriceTick> get(Ticker ticker) {
        return Optional.ofNullable(latestTicks.get(ticker));
    }

    /**
     * Cached ticks for the given tickers; tickers without a tick are absent from the result.
     */
    public Map<Ticker, PriceTick> getAll(Collection<Ticker> tickers) {
        Map<Ticker, PriceTick> result = new LinkedHashMap<>();
        for (Ticker t : tickers) {
            PriceTick tick = latestTicks.get(t);
            if (tick != null) {
                result.put(t, tick);
            }
        }
        return result;
    }

    /**
     * All cached ticks, sorted by ticker.
     */
    public List<PriceTick> snapshot() {
        return latestTicks.values().stream()
            .sorted(Comparator.comparing(PriceTick::ticker))
            .collect(Collectors.toList());
    }

    public void clear() {
        latestTicks.clear();
        log.info("Price cache cleared");
    }

    public int size() {
        return latestTicks.size();
    }
}
