package in.pricehub.service.live;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.infrastructure.metrics.LivePriceMetrics;
import in.pricehub.infrastructure.metrics.LivePriceMetrics.TickOutcome;
import in.pricehub.infrastructure.upstream.DecodedFrame;
import in.pricehub.infrastructure.upstream.PolygonMessageCodec;
import in.pricehub.infrastructure.upstream.UpstreamStatus;
import in.pricehub.service.core.ListenerHandle;
import in.pricehub.service.core.ListenerList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Routes inbound ticks: decode -> PriceCache -> listeners.
 *
 * Only CHANGED ticks reach listeners. UNCHANGED ticks refresh the cached timestamp and stop
 * there; STALE ticks are dropped. A consumer's listeners fire only for tickers in its claimed
 * set, so a consumer never hears about tickers another consumer subscribed to.
 *
 * Runs on the event loop.
 */
public final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final PriceCache cache;
    private final SubscriptionRegistry registry;
    private final PolygonMessageCodec codec;
    private final LivePriceMetrics metrics;

    private final Map<String, ListenerList<PriceTick>> consumerListeners = new ConcurrentHashMap<>();
    private final ListenerList<PriceTick> priceListeners = new ListenerList<>("PRICE LISTENER");

    public Dispatcher(PriceCache cache, SubscriptionRegistry registry,
                      PolygonMessageCodec codec, LivePriceMetrics metrics) {
        this.cache = cache;
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Handle one upstream text frame. Malformed entries are counted and dropped.
     */
    public void onFrame(String raw) {
        DecodedFrame frame = codec.decode(raw);
        if (frame.malformed() > 0) {
            metrics.recordMalformed(frame.malformed());
            log.warn("[DISPATCH] Dropped {} malformed entr{} from upstream frame ({} chars)",
                frame.malformed(), frame.malformed() == 1 ? "y" : "ies", raw == null ? 0 : raw.length());
        }
        for (UpstreamStatus status : frame.statuses()) {
            log.info("[DISPATCH] Upstream status: {} {}", status.status(), status.message());
        }
        for (PriceTick tick : frame.ticks()) {
            dispatch(tick);
        }
    }

    /**
     * Apply one tick and notify interested listeners if the price changed.
     */
    public PriceCache.ApplyResult dispatch(PriceTick tick) {
        PriceCache.ApplyResult result = cache.applyTick(tick);
        metrics.recordTick(TickOutcome.valueOf(result.name()));
        if (result != PriceCache.ApplyResult.CHANGED) {
            return result;
        }

        for (String consumerId : registry.consumersOf(tick.ticker())) {
            ListenerList<PriceTick> listeners = consumerListeners.get(consumerId);
            if (listeners != null) {
                listeners.notifyAll(tick);
            }
        }
        priceListeners.notifyAll(tick);
        return result;
    }

    /**
     * Listener for changed prices of tickers claimed by one consumer.
     */
    public ListenerHandle addConsumerListener(String consumerId, Consumer<PriceTick> listener) {
        return consumerListeners
            .computeIfAbsent(consumerId, id -> new ListenerList<>("CONSUMER " + id))
            .add(listener);
    }

    public void removeConsumer(String consumerId) {
        consumerListeners.remove(consumerId);
    }

    /**
     * Listener for every changed price, regardless of who subscribed.
     */
    public ListenerHandle onPriceUpdate(Consumer<PriceTick> listener) {
        return priceListeners.add(listener);
    }
}
