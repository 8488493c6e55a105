package in.pricehub.infrastructure.metrics;

import in.pricehub.domain.market.ConnectivityState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of LivePriceMetrics.
 *
 * Key Metrics:
 * - live_price_ticks_total{outcome} - Ticks by cache outcome
 * - live_price_malformed_total - Dropped upstream entries
 * - live_price_upstream_messages_total{action} - Control messages sent upstream
 * - live_price_upstream_message_tickers{action} - Tickers per control message
 * - live_price_reconnect_attempts_total - Reconnect attempts
 * - live_price_connection_state{state} - 1 for the current state, 0 otherwise
 * - live_price_active_tickers - Tickers with refcount > 0
 * - live_price_open_consumers - Open consumer handles
 * - portfolio_snapshot_recomputes_total - New snapshots produced
 */
public class PrometheusLivePriceMetrics implements LivePriceMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusLivePriceMetrics.class);

    private final CollectorRegistry registry;

    private final Counter tickCounter;
    private final Counter malformedCounter;
    private final Counter upstreamMessageCounter;
    private final Histogram upstreamMessageTickers;
    private final Counter reconnectCounter;
    private final Gauge reconnectAttempt;
    private final Gauge connectionState;
    private final Gauge activeTickers;
    private final Gauge openConsumers;
    private final Counter snapshotCounter;

    public PrometheusLivePriceMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLivePriceMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.tickCounter = Counter.build()
            .name("live_price_ticks_total")
            .help("Total number of ticks applied to the price cache")
            .labelNames("outcome")
            .register(registry);

        this.malformedCounter = Counter.build()
            .name("live_price_malformed_total")
            .help("Total number of malformed upstream entries dropped")
            .register(registry);

        this.upstreamMessageCounter = Counter.build()
            .name("live_price_upstream_messages_total")
            .help("Total number of control messages sent upstream")
            .labelNames("action")
            .register(registry);

        this.upstreamMessageTickers = Histogram.build()
            .name("live_price_upstream_message_tickers")
            .help("Tickers carried per upstream control message")
            .labelNames("action")
            .buckets(1, 2, 5, 10, 25, 50, 100)
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("live_price_reconnect_attempts_total")
            .help("Total number of upstream reconnect attempts")
            .register(registry);

        this.reconnectAttempt = Gauge.build()
            .name("live_price_reconnect_attempt")
            .help("Attempt number of the current reconnect streak (0 when open)")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("live_price_connection_state")
            .help("Current connection state (1=current, 0=other)")
            .labelNames("state")
            .register(registry);

        this.activeTickers = Gauge.build()
            .name("live_price_active_tickers")
            .help("Tickers with at least one interested consumer")
            .register(registry);

        this.openConsumers = Gauge.build()
            .name("live_price_open_consumers")
            .help("Open consumer handles")
            .register(registry);

        this.snapshotCounter = Counter.build()
            .name("portfolio_snapshot_recomputes_total")
            .help("Total number of portfolio snapshots produced")
            .register(registry);

        log.info("[PrometheusLivePriceMetrics] Initialized");
    }

    @Override
    public void recordTick(TickOutcome outcome) {
        tickCounter.labels(outcome.name().toLowerCase()).inc();
    }

    @Override
    public void recordMalformed(int count) {
        if (count > 0) {
            malformedCounter.inc(count);
        }
    }

    @Override
    public void recordUpstreamMessage(UpstreamAction action, int tickerCount) {
        String label = action.name().toLowerCase();
        upstreamMessageCounter.labels(label).inc();
        upstreamMessageTickers.labels(label).observe(tickerCount);
    }

    @Override
    public void recordReconnectAttempt(int attemptNumber) {
        reconnectCounter.inc();
        reconnectAttempt.set(attemptNumber);
    }

    @Override
    public void recordConnectivity(ConnectivityState state) {
        for (ConnectivityState s : ConnectivityState.values()) {
            connectionState.labels(s.name()).set(s == state ? 1 : 0);
        }
        if (state == ConnectivityState.OPEN) {
            reconnectAttempt.set(0);
        }
    }

    @Override
    public void updateActiveTickers(int count) {
        activeTickers.set(count);
    }

    @Override
    public void updateOpenConsumers(int count) {
        openConsumers.set(count);
    }

    @Override
    public void recordSnapshotRecompute() {
        snapshotCounter.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
