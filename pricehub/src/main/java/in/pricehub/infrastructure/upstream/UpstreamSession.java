package in.pricehub.infrastructure.upstream;

import in.pricehub.domain.market.Ticker;

import java.util.Set;

/**
 * One open upstream connection.
 *
 * Send methods throw UpstreamConnectionException if the session is no longer writable.
 */
public interface UpstreamSession {

    void subscribe(Set<Ticker> tickers);

    void unsubscribe(Set<Ticker> tickers);

    void ping();

    /**
     * Close without reporting a drop to the listener.
     */
    void close();
}
