package in.pricehub.infrastructure.upstream;

import java.util.concurrent.CompletableFuture;

/**
 * Factory for sessions on the duplex upstream price feed.
 *
 * Error Handling:
 * - open() completes exceptionally with UpstreamConnectionException when the session
 *   cannot be established or authenticated
 * - after a session is open, drops are reported through UpstreamListener.onClosed/onError
 *
 * Listener callbacks arrive on transport threads; callers re-dispatch them.
 */
public interface UpstreamTransport {

    /**
     * Open and authenticate a new session.
     *
     * @param listener receives inbound frames and lifecycle events for this session only
     * @return future completing with a ready-to-use session
     */
    CompletableFuture<UpstreamSession> open(UpstreamListener listener);

    /**
     * Human-readable endpoint, credentials masked.
     */
    String describe();
}
