package in.pricehub.transport.ws;

import in.pricehub.service.PriceConsumer;

import java.time.Instant;

/**
 * One connected price socket client and the consumer handle it owns.
 */
public final class ClientSession {
    private final String sessionId;
    private final String remoteAddress;
    private final PriceConsumer consumer;
    private final Instant connectedAt;
    private volatile Instant lastActivity;    // volatile: written by I/O threads, read by status

    public ClientSession(String sessionId, String remoteAddress, PriceConsumer consumer) {
        this.sessionId = sessionId;
        this.remoteAddress = remoteAddress;
        this.consumer = consumer;
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public PriceConsumer getConsumer() {
        return consumer;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }
}
