package in.pricehub.service;

import in.pricehub.domain.market.ConnectivityState;
import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.domain.portfolio.PortfolioSnapshot;
import in.pricehub.domain.portfolio.Position;
import in.pricehub.domain.portfolio.PositionValuation;
import in.pricehub.domain.portfolio.SectorAllocation;
import in.pricehub.infrastructure.metrics.LivePriceMetrics;
import in.pricehub.infrastructure.metrics.NoopLivePriceMetrics;
import in.pricehub.infrastructure.upstream.PolygonMessageCodec;
import in.pricehub.infrastructure.upstream.UpstreamTransport;
import in.pricehub.infrastructure.upstream.common.ReconnectionPolicy;
import in.pricehub.service.core.EventLoop;
import in.pricehub.service.core.ListenerHandle;
import in.pricehub.service.live.ConnectionManager;
import in.pricehub.service.live.Dispatcher;
import in.pricehub.service.live.PriceCache;
import in.pricehub.service.live.SubscriptionDelta;
import in.pricehub.service.live.SubscriptionRegistry;
import in.pricehub.service.portfolio.AggregationEngine;
import in.pricehub.service.portfolio.DeltaSignal;
import in.pricehub.service.portfolio.SectorClassifier;
import in.pricehub.service.portfolio.StaticSectorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Live price service: one shared upstream connection multiplexed across independent consumers,
 * plus the incremental portfolio aggregator fed by it.
 *
 * Created once at startup and passed to whoever needs live prices. Consumers acquire a scoped
 * handle and close it when done:
 * <pre>
 * try (PriceConsumer watchlist = service.openConsumer("watchlist")) {
 *     watchlist.onPrice(tick -> render(tick));
 *     watchlist.replaceInterest(Ticker.setOf(List.of("AAPL", "MSFT")));
 *     ...
 * }
 * </pre>
 *
 * Consumer calls may come from any thread. Calls from one outside thread are applied on the event loop
 * in call order; a call made on the loop itself, e.g. from a price listener, is applied immediately,
 * ahead of work already queued by other threads.
 * Read methods never block and never touch loop-confined state.
 */
public final class LivePriceService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LivePriceService.class);

    private static final String PORTFOLIO_CONSUMER = "portfolio";

    private final EventLoop loop;
    private final LivePriceMetrics metrics;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final PriceCache cache = new PriceCache();
    private final Dispatcher dispatcher;
    private final ConnectionManager connection;
    private final AggregationEngine engine;
    private final PriceConsumer portfolioConsumer;

    private final AtomicLong consumerSeq = new AtomicLong();
    private volatile Set<Ticker> activeView = Set.of();
    private volatile int consumerCount = 0;

    private LivePriceService(Builder b) {
        this.loop = b.loop;
        this.metrics = b.metrics;
        this.dispatcher = new Dispatcher(cache, registry, b.codec, metrics);
        this.connection = new ConnectionManager(b.transport, loop, b.reconnectionPolicy,
            b.heartbeatInterval, b.heartbeatTimeout, registry::activeTickers, dispatcher::onFrame, metrics);
        this.engine = new AggregationEngine(cache, b.sectorClassifier, b.clock, metrics);
        this.portfolioConsumer = openConsumer(PORTFOLIO_CONSUMER);
        this.portfolioConsumer.onPrice(engine::onPriceChanged);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        connection.start();
    }

    /**
     * Shut the upstream connection down. The event loop itself belongs to the caller.
     */
    @Override
    public void close() {
        log.info("[LIVE] Shutting down live price service");
        connection.shutdown();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Consumers
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Open an independent consumer. Each handle has its own claimed ticker set; closing it
     * releases exactly that set.
     *
     * @param name label used in logs and consumer ids
     */
    public PriceConsumer openConsumer(String name) {
        String id = name + "#" + consumerSeq.incrementAndGet();
        log.debug("[LIVE] Consumer opened: {}", id);
        return new PriceConsumer(this, id);
    }

    void subscribe(String consumerId, Collection<Ticker> tickers) {
        Set<Ticker> batch = Set.copyOf(tickers);
        onLoop(() -> apply(registry.subscribe(consumerId, batch)));
    }

    void unsubscribe(String consumerId, Collection<Ticker> tickers) {
        Set<Ticker> batch = Set.copyOf(tickers);
        onLoop(() -> apply(registry.unsubscribe(consumerId, batch)));
    }

    void replaceInterest(String consumerId, Collection<Ticker> tickers) {
        Set<Ticker> batch = Set.copyOf(tickers);
        onLoop(() -> apply(registry.replace(consumerId, batch)));
    }

    void release(String consumerId) {
        onLoop(() -> {
            apply(registry.release(consumerId));
            dispatcher.removeConsumer(consumerId);
            log.debug("[LIVE] Consumer closed: {}", consumerId);
        });
    }

    ListenerHandle addConsumerListener(String consumerId, Consumer<PriceTick> listener) {
        return dispatcher.addConsumerListener(consumerId, listener);
    }

    private void apply(SubscriptionDelta delta) {
        connection.request(delta);
        activeView = registry.activeTickers();
        consumerCount = registry.consumerCount();
        metrics.updateActiveTickers(activeView.size());
        metrics.updateOpenConsumers(consumerCount);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Prices and connectivity
    // ═══════════════════════════════════════════════════════════════════════

    public Optional<PriceTick> getPrice(Ticker ticker) {
        return cache.get(ticker);
    }

    public List<PriceTick> cachedPrices() {
        return cache.snapshot();
    }

    public ConnectivityState getConnectivity() {
        return connection.state();
    }

    public ListenerHandle onConnectivityChange(Consumer<ConnectivityState> listener) {
        return connection.onStateChange(listener);
    }

    /**
     * Every changed price, whichever consumer asked for it.
     */
    public ListenerHandle onPriceUpdate(Consumer<PriceTick> listener) {
        return dispatcher.onPriceUpdate(listener);
    }

    /**
     * Feed a tick as if it came from upstream (replays, tests, alternate feeds).
     */
    public void publishTick(PriceTick tick) {
        onLoop(() -> dispatcher.dispatch(tick));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Portfolio
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Replace the portfolio positions. Their tickers become the portfolio's interest set.
     *
     * @throws IllegalArgumentException if two positions share a positionId
     */
    public void replacePositions(Collection<Position> positions) {
        List<Position> copy = List.copyOf(positions);
        Position.requireUniqueIds(copy);
        onLoop(() -> portfolioConsumer.replaceInterest(engine.replacePositions(copy)));
    }

    public PortfolioSnapshot currentSnapshot() {
        return engine.snapshot();
    }

    public List<PositionValuation> valuations() {
        return engine.valuations();
    }

    public List<SectorAllocation> sectorBreakdown() {
        return engine.sectorBreakdown();
    }

    public ListenerHandle onSnapshot(Consumer<PortfolioSnapshot> listener) {
        return engine.onSnapshot(listener);
    }

    public ListenerHandle onDelta(DeltaSignal signal) {
        return engine.onDelta(signal);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Status
    // ═══════════════════════════════════════════════════════════════════════

    public LivePriceStatus status() {
        return new LivePriceStatus(
            connection.state(),
            consumerCount,
            activeView,
            connection.upstreamTickers(),
            Collections.unmodifiableSet(new TreeSet<>(cachedTickers())));
    }

    private Set<Ticker> cachedTickers() {
        Set<Ticker> out = new TreeSet<>();
        for (PriceTick t : cache.snapshot()) {
            out.add(t.ticker());
        }
        return out;
    }

    private void onLoop(Runnable task) {
        if (loop.inEventLoop()) {
            task.run();
        } else {
            loop.execute(task);
        }
    }

    /**
     * Builder for LivePriceService.
     */
    public static final class Builder {
        private EventLoop loop;
        private UpstreamTransport transport;
        private PolygonMessageCodec codec = new PolygonMessageCodec();
        private ReconnectionPolicy reconnectionPolicy = ReconnectionPolicy.forUpstreamFeed();
        private Duration heartbeatInterval = Duration.ofSeconds(20);
        private Duration heartbeatTimeout = Duration.ofSeconds(30);
        private SectorClassifier sectorClassifier = new StaticSectorClassifier();
        private LivePriceMetrics metrics = NoopLivePriceMetrics.INSTANCE;
        private Clock clock = Clock.systemUTC();

        public Builder eventLoop(EventLoop loop) {
            this.loop = loop;
            return this;
        }

        public Builder transport(UpstreamTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder codec(PolygonMessageCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder reconnectionPolicy(ReconnectionPolicy policy) {
            this.reconnectionPolicy = policy;
            return this;
        }

        public Builder heartbeat(Duration interval, Duration timeout) {
            this.heartbeatInterval = interval;
            this.heartbeatTimeout = timeout;
            return this;
        }

        public Builder sectorClassifier(SectorClassifier classifier) {
            this.sectorClassifier = classifier;
            return this;
        }

        public Builder metrics(LivePriceMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LivePriceService build() {
            if (loop == null) {
                throw new IllegalStateException("eventLoop is required");
            }
            if (transport == null) {
                throw new IllegalStateException("transport is required");
            }
            return new LivePriceService(this);
        }
    }
}
