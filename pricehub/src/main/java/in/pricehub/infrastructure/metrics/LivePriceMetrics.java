package in.pricehub.infrastructure.metrics;

import in.pricehub.domain.market.ConnectivityState;

/**
 * Metrics for the live price pipeline.
 *
 * Implementations can publish to Prometheus or discard (NoopLivePriceMetrics).
 *
 * Key metrics:
 * - Tick outcomes (changed / unchanged / stale)
 * - Malformed upstream entries
 * - Upstream control messages sent
 * - Reconnect attempts and connection state
 * - Active tickers and open consumers
 * - Portfolio snapshot recomputes
 */
public interface LivePriceMetrics {

    /**
     * Outcome of applying a tick to the price cache.
     */
    enum TickOutcome { CHANGED, UNCHANGED, STALE }

    /**
     * Upstream control message kinds.
     */
    enum UpstreamAction { SUBSCRIBE, UNSUBSCRIBE, RESUBSCRIBE_ALL }

    void recordTick(TickOutcome outcome);

    /**
     * @param count number of dropped entries in one frame
     */
    void recordMalformed(int count);

    /**
     * @param tickerCount tickers carried by the message
     */
    void recordUpstreamMessage(UpstreamAction action, int tickerCount);

    void recordReconnectAttempt(int attemptNumber);

    void recordConnectivity(ConnectivityState state);

    void updateActiveTickers(int count);

    void updateOpenConsumers(int count);

    void recordSnapshotRecompute();
}
