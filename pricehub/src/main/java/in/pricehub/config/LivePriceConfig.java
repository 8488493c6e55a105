package in.pricehub.config;

import in.pricehub.infrastructure.upstream.common.ReconnectionPolicy;
import in.pricehub.util.Env;

import java.time.Duration;

/**
 * Runtime settings for the live price service.
 *
 * Environment variables (system properties as fallback):
 * <pre>
 * PORT                   HTTP/WS listen port                    (9090)
 * UPSTREAM_WS_URL        upstream feed WebSocket URL            (wss://socket.polygon.io/stocks)
 * UPSTREAM_API_KEY       upstream feed API key                  (none)
 * RECONNECT_INITIAL_MS   first reconnect delay                  (1000)
 * RECONNECT_MAX_MS       reconnect delay cap                    (30000)
 * RECONNECT_MULTIPLIER   backoff multiplier                     (2.0)
 * RECONNECT_JITTER       jitter fraction in [0, 1)              (0.2)
 * HEARTBEAT_INTERVAL_MS  upstream ping interval                 (20000)
 * HEARTBEAT_TIMEOUT_MS   silence before the feed counts as down (30000)
 * CONNECT_TIMEOUT_MS     socket connect timeout                 (10000)
 * AUTH_TIMEOUT_MS        connect to auth_success timeout        (15000)
 * PRODUCTION_MODE        strict startup validation              (false)
 * </pre>
 */
public record LivePriceConfig(
    int port,
    String upstreamUrl,
    String upstreamApiKey,
    long reconnectInitialMs,
    long reconnectMaxMs,
    double reconnectMultiplier,
    double reconnectJitter,
    long heartbeatIntervalMs,
    long heartbeatTimeoutMs,
    long connectTimeoutMs,
    long authTimeoutMs,
    boolean productionMode
) {
    public static final String DEFAULT_UPSTREAM_URL = "wss://socket.polygon.io/stocks";

    public static LivePriceConfig defaults() {
        return new LivePriceConfig(9090, DEFAULT_UPSTREAM_URL, null,
            1000, 30000, 2.0, 0.2, 20000, 30000, 10000, 15000, false);
    }

    public static LivePriceConfig fromEnv() {
        LivePriceConfig d = defaults();
        return new LivePriceConfig(
            Env.getInt("PORT", d.port()),
            Env.get("UPSTREAM_WS_URL", d.upstreamUrl()),
            Env.get("UPSTREAM_API_KEY", null),
            Env.getLong("RECONNECT_INITIAL_MS", d.reconnectInitialMs()),
            Env.getLong("RECONNECT_MAX_MS", d.reconnectMaxMs()),
            Env.getDouble("RECONNECT_MULTIPLIER", d.reconnectMultiplier()),
            Env.getDouble("RECONNECT_JITTER", d.reconnectJitter()),
            Env.getLong("HEARTBEAT_INTERVAL_MS", d.heartbeatIntervalMs()),
            Env.getLong("HEARTBEAT_TIMEOUT_MS", d.heartbeatTimeoutMs()),
            Env.getLong("CONNECT_TIMEOUT_MS", d.connectTimeoutMs()),
            Env.getLong("AUTH_TIMEOUT_MS", d.authTimeoutMs()),
            Env.getBool("PRODUCTION_MODE", d.productionMode()));
    }

    public ReconnectionPolicy reconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(reconnectInitialMs))
            .maxDelay(Duration.ofMillis(reconnectMaxMs))
            .multiplier(reconnectMultiplier)
            .jitter(reconnectJitter)
            .build();
    }

    public Duration heartbeatInterval() {
        return Duration.ofMillis(heartbeatIntervalMs);
    }

    public Duration heartbeatTimeout() {
        return Duration.ofMillis(heartbeatTimeoutMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration authTimeout() {
        return Duration.ofMillis(authTimeoutMs);
    }

    public boolean hasApiKey() {
        return upstreamApiKey != null && !upstreamApiKey.isBlank();
    }

    @Override
    public String toString() {
        return "LivePriceConfig[port=" + port + ", upstreamUrl=" + upstreamUrl
            + ", apiKey=" + (hasApiKey() ? "***" : "<none>")
            + ", reconnect=" + reconnectInitialMs + ".." + reconnectMaxMs + "ms x" + reconnectMultiplier
            + " jitter=" + reconnectJitter
            + ", heartbeat=" + heartbeatIntervalMs + "/" + heartbeatTimeoutMs + "ms"
            + ", productionMode=" + productionMode + "]";
    }
}
