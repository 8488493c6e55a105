package in.pricehub.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.domain.portfolio.PortfolioSnapshot;
import in.pricehub.domain.portfolio.Position;
import in.pricehub.domain.portfolio.PositionValuation;
import in.pricehub.domain.portfolio.SectorAllocation;
import in.pricehub.service.LivePriceService;
import in.pricehub.service.LivePriceStatus;
import in.pricehub.service.session.MarketSessionClock;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * HTTP API handlers for live prices and the in-memory portfolio.
 *
 * Routes:
 * - GET /api/v1/live-prices/snapshot/{ticker}
 * - GET /api/v1/live-prices/status
 * - GET /api/v1/portfolio/snapshot
 * - GET /api/v1/portfolio/sectors
 * - PUT /api/v1/portfolio/positions
 * - GET /api/health
 */
public final class LivePriceApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(LivePriceApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    // JSON Response Keys
    private static final String JSON_SUCCESS = "success";
    private static final String JSON_ERROR = "error";

    private final LivePriceService service;
    private final MarketSessionClock sessionClock;

    public LivePriceApiHandlers(LivePriceService service, MarketSessionClock sessionClock) {
        this.service = service;
        this.sessionClock = sessionClock;
    }

    /**
     * GET /api/health - Liveness plus connectivity.
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("connectivity", service.getConnectivity().name());
        health.put("ts", Instant.now().toString());
        sendJson(exchange, 200, health);
    }

    /**
     * GET /api/v1/live-prices/snapshot/{ticker} - Cached price, or a cache miss.
     */
    public void priceSnapshot(HttpServerExchange exchange) {
        Deque<String> tickerParam = exchange.getQueryParameters().get("ticker");
        if (tickerParam == null || tickerParam.isEmpty() || tickerParam.peekFirst().isBlank()) {
            badRequest(exchange, "ticker path parameter required");
            return;
        }
        Ticker ticker = Ticker.of(tickerParam.peekFirst());

        ObjectNode response = MAPPER.createObjectNode();
        response.put("ticker", ticker.symbol());
        Optional<PriceTick> cached = service.getPrice(ticker);
        if (cached.isPresent()) {
            PriceTick tick = cached.get();
            response.put("price", tick.price());
            response.put("timestamp", tick.timestamp());
            response.put("updated_at", tick.eventTime().toString());
            response.put("source", "live_cache");
        } else {
            response.putNull("price");
            response.put(JSON_ERROR, "Price not available. Subscribe to ticker for live updates.");
            response.put("source", "cache_miss");
        }
        sendJson(exchange, 200, response);
    }

    /**
     * GET /api/v1/live-prices/status - Connection and multiplexer state.
     */
    public void status(HttpServerExchange exchange) {
        LivePriceStatus status = service.status();
        ObjectNode response = MAPPER.createObjectNode();
        response.put("connectivity", status.state().name());
        response.put("connected", status.state().isLive());
        response.put("consumers", status.consumers());
        response.set("active_tickers", symbols(status.activeTickers()));
        response.set("upstream_tickers", symbols(status.upstreamTickers()));
        response.set("cached_tickers", symbols(status.cachedTickers()));
        response.put("market_hours", sessionClock.isMarketOpen());
        sendJson(exchange, 200, response);
    }

    /**
     * GET /api/v1/portfolio/snapshot - Current totals plus per-position valuations.
     */
    public void portfolioSnapshot(HttpServerExchange exchange) {
        PortfolioSnapshot snapshot = service.currentSnapshot();
        ObjectNode response = MAPPER.createObjectNode();
        response.put("total_value", snapshot.totalValue());
        response.put("total_cost", snapshot.totalCost());
        response.put("total_profit_loss", snapshot.totalProfitLoss());
        response.put("total_profit_loss_percent", snapshot.totalProfitLossPercent());
        response.put("position_count", snapshot.positionCount());
        response.put("version", snapshot.version());
        response.set("last_updated_at", MAPPER.valueToTree(snapshot.lastUpdatedAt()));

        ArrayNode positions = response.putArray("positions");
        for (PositionValuation v : service.valuations()) {
            ObjectNode p = positions.addObject();
            p.put("position_id", v.position().positionId());
            p.put("ticker", v.position().ticker().symbol());
            p.put("quantity", v.position().quantity());
            p.put("buy_price", v.position().buyPrice());
            p.put("current_price", v.currentPrice());
            p.put("value", v.value());
            p.put("profit_loss", v.profitLoss());
            p.put("profit_loss_percent", v.profitLossPercent());
            p.put("live", v.live());
        }
        sendJson(exchange, 200, response);
    }

    /**
     * GET /api/v1/portfolio/sectors - Sector breakdown by ticker count.
     */
    public void portfolioSectors(HttpServerExchange exchange) {
        ArrayNode sectors = MAPPER.createArrayNode();
        for (SectorAllocation s : service.sectorBreakdown()) {
            ObjectNode n = sectors.addObject();
            n.put("sector", s.sector());
            n.put("count", s.count());
            n.put("percentage", s.percentage());
            n.set("tickers", MAPPER.valueToTree(s.tickers()));
        }
        sendJson(exchange, 200, sectors);
    }

    /**
     * PUT /api/v1/portfolio/positions - Replace the in-memory position list.
     *
     * Body: {"positions":[{"position_id":"p1","ticker":"TSLA","quantity":10,"buy_price":200,
     *                      "last_known_price":215.5}]}  (last_known_price optional)
     */
    public void replacePositions(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            List<Position> positions;
            try {
                positions = parsePositions(MAPPER.readTree(body));
            } catch (IllegalArgumentException e) {
                badRequest(ex, e.getMessage());
                return;
            } catch (Exception e) {
                badRequest(ex, "Invalid JSON");
                return;
            }

            try {
                service.replacePositions(positions);
            } catch (IllegalArgumentException e) {
                badRequest(ex, e.getMessage());
                return;
            }

            log.info("Replaced portfolio positions: {} positions", positions.size());
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put("accepted", positions.size());
            sendJson(ex, 202, response);
        }, StandardCharsets.UTF_8);
    }

    static List<Position> parsePositions(JsonNode root) {
        JsonNode array = root == null ? null : (root.isArray() ? root : root.get("positions"));
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("'positions' array required");
        }
        List<Position> out = new ArrayList<>();
        for (JsonNode n : array) {
            String id = text(n, "position_id");
            String ticker = text(n, "ticker");
            if (id == null || ticker == null) {
                throw new IllegalArgumentException("position_id and ticker are required");
            }
            out.add(new Position(id, Ticker.of(ticker),
                decimal(n, "quantity"), decimal(n, "buy_price"), decimal(n, "last_known_price")));
        }
        return out;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static BigDecimal decimal(JsonNode n, String field) {
        String v = text(n, field);
        if (v == null) {
            return null;
        }
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + field + "' must be a number, got " + v);
        }
    }

    private static ArrayNode symbols(Collection<Ticker> tickers) {
        ArrayNode arr = MAPPER.createArrayNode();
        tickers.forEach(t -> arr.add(t.symbol()));
        return arr;
    }

    private void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private void badRequest(HttpServerExchange exchange, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put(JSON_ERROR, message);
        sendJson(exchange, 400, error);
    }
}
