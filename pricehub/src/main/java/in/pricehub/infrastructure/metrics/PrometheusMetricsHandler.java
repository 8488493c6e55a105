package in.pricehub.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * HTTP handler for Prometheus /metrics endpoint.
 *
 * Example output:
 * <pre>
 * # HELP live_price_ticks_total Total number of ticks applied to the price cache
 * # TYPE live_price_ticks_total counter
 * live_price_ticks_total{outcome="changed",} 1234.0
 * live_price_ticks_total{outcome="unchanged",} 310.0
 * live_price_ticks_total{outcome="stale",} 12.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String metricsOutput = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(metricsOutput);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", metricsOutput.length());
        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
