package in.pricehub.infrastructure.metrics;

import in.pricehub.domain.market.ConnectivityState;

/**
 * Discards all metrics. Default when the service is embedded without a registry.
 */
public final class NoopLivePriceMetrics implements LivePriceMetrics {

    public static final NoopLivePriceMetrics INSTANCE = new NoopLivePriceMetrics();

    private NoopLivePriceMetrics() {}

    @Override
    public void recordTick(TickOutcome outcome) {}

    @Override
    public void recordMalformed(int count) {}

    @Override
    public void recordUpstreamMessage(UpstreamAction action, int tickerCount) {}

    @Override
    public void recordReconnectAttempt(int attemptNumber) {}

    @Override
    public void recordConnectivity(ConnectivityState state) {}

    @Override
    public void updateActiveTickers(int count) {}

    @Override
    public void updateOpenConsumers(int count) {}

    @Override
    public void recordSnapshotRecompute() {}
}
