package in.pricehub.domain.market;

/**
 * Lifecycle of the single upstream price connection.
 *
 * CONNECTING -> OPEN -> (drop) RECONNECTING -> OPEN ... ; CLOSED from any state on shutdown.
 */
public enum ConnectivityState {
    CONNECTING,
    OPEN,
    RECONNECTING,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }

    public boolean isLive() {
        return this == OPEN;
    }
}
