package in.pricehub.bootstrap;

import in.pricehub.config.LivePriceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Startup configuration validator.
 *
 * Validates configuration at startup before anything connects.
 * Throws IllegalStateException if configuration is invalid; the process refuses to start.
 *
 * Production mode adds hard gates:
 * - UPSTREAM_API_KEY must be set
 * - UPSTREAM_WS_URL must use wss://
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration at startup.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(LivePriceConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", config.productionMode());

        validateCommon(config);
        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateCommon(LivePriceConfig config) {
        if (config.port() < 1 || config.port() > 65535) {
            fail("PORT must be between 1 and 65535, got " + config.port());
        }
        URI uri = parseUpstream(config.upstreamUrl());
        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            fail("UPSTREAM_WS_URL must be a ws:// or wss:// URL, got " + config.upstreamUrl());
        }
        if (config.reconnectInitialMs() <= 0) {
            fail("RECONNECT_INITIAL_MS must be positive");
        }
        if (config.reconnectMaxMs() < config.reconnectInitialMs()) {
            fail("RECONNECT_MAX_MS must not be below RECONNECT_INITIAL_MS");
        }
        if (config.reconnectMultiplier() <= 1.0) {
            fail("RECONNECT_MULTIPLIER must be greater than 1.0");
        }
        if (config.reconnectJitter() < 0.0 || config.reconnectJitter() >= 1.0) {
            fail("RECONNECT_JITTER must be in [0.0, 1.0)");
        }
        if (config.heartbeatIntervalMs() <= 0) {
            fail("HEARTBEAT_INTERVAL_MS must be positive");
        }
        if (config.heartbeatTimeoutMs() < config.heartbeatIntervalMs()) {
            fail("HEARTBEAT_TIMEOUT_MS must not be below HEARTBEAT_INTERVAL_MS");
        }
        if (config.connectTimeoutMs() <= 0) {
            fail("CONNECT_TIMEOUT_MS must be positive");
        }
        // the auth wait covers the socket connect as well
        if (config.authTimeoutMs() < config.connectTimeoutMs()) {
            fail("AUTH_TIMEOUT_MS must not be below CONNECT_TIMEOUT_MS");
        }
        log.info("✓ Connection settings valid");
    }

    /**
     * Validate production mode configuration (strict enforcement).
     */
    private static void validateProductionMode(LivePriceConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");
        if (!config.hasApiKey()) {
            fail("PRODUCTION MODE requires UPSTREAM_API_KEY");
        }
        log.info("✓ Upstream API key present");
        if (!config.upstreamUrl().toLowerCase().startsWith("wss://")) {
            fail("PRODUCTION MODE requires a wss:// UPSTREAM_WS_URL");
        }
        log.info("✓ Upstream uses TLS");
    }

    private static void warnNonProductionMode(LivePriceConfig config) {
        if (!config.hasApiKey()) {
            log.warn("⚠️ UPSTREAM_API_KEY not set - upstream authentication will fail and keep retrying");
        }
    }

    private static URI parseUpstream(String url) {
        if (url == null || url.isBlank()) {
            fail("UPSTREAM_WS_URL is required");
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: UPSTREAM_WS_URL is not a valid URI: " + url, e);
        }
    }

    private static void fail(String message) {
        throw new IllegalStateException("❌ INVALID CONFIG: " + message + "\nSystem refuses to start.");
    }

    private StartupConfigValidator() {}
}
