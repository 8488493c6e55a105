package in.pricehub.infrastructure.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Wire format of the Polygon-style stocks feed.
 *
 * Client -> server:
 * <pre>
 * {"action":"auth","params":"API_KEY"}
 * {"action":"subscribe","params":"T.AAPL,T.MSFT"}
 * {"action":"unsubscribe","params":"T.MSFT"}
 * </pre>
 *
 * Server -> client: a JSON array of events.
 * <pre>
 * [{"ev":"status","status":"auth_success","message":"authenticated"},
 *  {"ev":"T","sym":"AAPL","p":185.43,"s":100,"t":1707229815000}]
 * </pre>
 */
public final class PolygonMessageCodec {
    private static final Logger log = LoggerFactory.getLogger(PolygonMessageCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public static final String TRADE_CHANNEL_PREFIX = "T.";
    private static final String EVENT_TRADE = "T";
    private static final String EVENT_STATUS = "status";

    public String encodeAuth(String apiKey) {
        JSONObject o = new JSONObject();
        o.put("action", "auth");
        o.put("params", apiKey);
        return o.toString();
    }

    public String encodeSubscribe(Collection<Ticker> tickers) {
        return encodeControl("subscribe", tickers);
    }

    public String encodeUnsubscribe(Collection<Ticker> tickers) {
        return encodeControl("unsubscribe", tickers);
    }

    private String encodeControl(String action, Collection<Ticker> tickers) {
        String params = new TreeSet<>(tickers).stream()
            .map(t -> TRADE_CHANNEL_PREFIX + t.symbol())
            .collect(Collectors.joining(","));
        JSONObject o = new JSONObject();
        o.put("action", action);
        o.put("params", params);
        return o.toString();
    }

    /**
     * Decode one text frame. Never throws: unreadable input is reported as malformed.
     */
    public DecodedFrame decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return DecodedFrame.unreadable();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable upstream frame: {}", e.getOriginalMessage());
            return DecodedFrame.unreadable();
        }

        List<JsonNode> events = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(events::add);
        } else if (root.isObject()) {
            events.add(root);
        } else {
            return DecodedFrame.unreadable();
        }

        List<PriceTick> ticks = new ArrayList<>();
        List<UpstreamStatus> statuses = new ArrayList<>();
        int malformed = 0;
        int ignored = 0;

        for (JsonNode ev : events) {
            if (!ev.isObject()) {
                malformed++;
                continue;
            }
            String type = ev.path("ev").asText("");
            if (EVENT_TRADE.equals(type)) {
                PriceTick tick = parseTrade(ev);
                if (tick == null) {
                    malformed++;
                } else {
                    ticks.add(tick);
                }
            } else if (EVENT_STATUS.equals(type)) {
                statuses.add(new UpstreamStatus(ev.path("status").asText(""), ev.path("message").asText("")));
            } else {
                ignored++;
            }
        }
        return new DecodedFrame(ticks, statuses, malformed, ignored);
    }

    private static PriceTick parseTrade(JsonNode ev) {
        String symbol = ev.path("sym").asText(null);
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        BigDecimal price = decimal(ev.get("p"));
        JsonNode ts = ev.get("t");
        if (price == null || ts == null || !ts.canConvertToLong()) {
            return null;
        }
        JsonNode size = ev.get("s");
        long qty = size != null && size.canConvertToLong() ? size.asLong() : 0L;
        try {
            return new PriceTick(Ticker.of(symbol), price, Math.max(0L, qty), ts.asLong());
        } catch (IllegalArgumentException e) {
            log.debug("Rejected trade event for {}: {}", symbol, e.getMessage());
            return null;
        }
    }

    /**
     * Numeric node or numeric string; anything else is null.
     */
    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String v = node.asText();
            if (v.isBlank()) return null;
            try {
                return new BigDecimal(v.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
