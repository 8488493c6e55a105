package in.pricehub.bootstrap;

import in.pricehub.config.LivePriceConfig;
import in.pricehub.infrastructure.metrics.PrometheusLivePriceMetrics;
import in.pricehub.infrastructure.metrics.PrometheusMetricsHandler;
import in.pricehub.infrastructure.upstream.PolygonMessageCodec;
import in.pricehub.infrastructure.upstream.WebSocketUpstreamTransport;
import in.pricehub.service.LivePriceService;
import in.pricehub.service.core.ExecutorEventLoop;
import in.pricehub.service.session.MarketSessionClock;
import in.pricehub.transport.http.LivePriceApiHandlers;
import in.pricehub.transport.ws.LivePriceWsHub;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires:
 * - One upstream WebSocket connection (Polygon-style feed) with reconnect + heartbeat
 * - Live price multiplexer and incremental portfolio aggregator
 * - Undertow HTTP API, price WebSocket and Prometheus /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== PriceHub Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        LivePriceConfig config = LivePriceConfig.fromEnv();
        StartupConfigValidator.validate(config);
        log.info("Config: {}", config);

        PrometheusLivePriceMetrics metrics = new PrometheusLivePriceMetrics();
        log.info("✓ Prometheus metrics initialized");

        PolygonMessageCodec codec = new PolygonMessageCodec();
        WebSocketUpstreamTransport transport = new WebSocketUpstreamTransport(
            config.upstreamUrl(), config.upstreamApiKey(),
            config.connectTimeout(), config.authTimeout(), codec);

        ExecutorEventLoop loop = new ExecutorEventLoop("live-price-loop");
        LivePriceService service = LivePriceService.builder()
            .eventLoop(loop)
            .transport(transport)
            .codec(codec)
            .reconnectionPolicy(config.reconnectionPolicy())
            .heartbeat(config.heartbeatInterval(), config.heartbeatTimeout())
            .metrics(metrics)
            .build();

        LivePriceApiHandlers api = new LivePriceApiHandlers(service, new MarketSessionClock());
        LivePriceWsHub wsHub = new LivePriceWsHub(service);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/v1/live-prices/snapshot/{ticker}", api::priceSnapshot)
            .get("/api/v1/live-prices/status", api::status)
            .get("/api/v1/live-prices/ws", wsHub.websocketHandler())
            .get("/api/v1/portfolio/snapshot", api::portfolioSnapshot)
            .get("/api/v1/portfolio/sectors", api::portfolioSectors)
            .put("/api/v1/portfolio/positions", api::replacePositions)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "PriceHub\n\n" +
                    "API: GET /api/health, /api/v1/live-prices/status, /api/v1/live-prices/snapshot/{ticker}\n" +
                    "     GET /api/v1/portfolio/snapshot, /api/v1/portfolio/sectors\n" +
                    "     PUT /api/v1/portfolio/positions\n" +
                    "WS:  ws://localhost:" + config.port() + "/api/v1/live-prices/ws\n"
                );
            });

        // CORS Handler
        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, PUT, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", config.port());

        service.start();
        log.info("✓ Live price service started (upstream {})", transport.describe());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            service.close();
            loop.shutdown();
            server.stop();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));
    }
}
