package in.pricehub.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.pricehub.domain.market.ConnectivityState;
import in.pricehub.domain.market.PriceTick;

import java.util.Collection;

/**
 * Server -> client message builders for the live price socket.
 *
 * Every message is {"type": ..., "data": ...}:
 * <pre>
 * {"type":"price_update","data":{"ticker":"AAPL","price":185.43,"size":100,
 *                                "timestamp":1707229815000,"updated_at":"2024-02-06T14:30:15Z"}}
 * {"type":"price_cache","data":[ ...price_update data... ]}
 * {"type":"connectivity","data":{"state":"RECONNECTING"}}
 * {"type":"error","data":{"error":"Unknown action: foo"}}
 * {"type":"pong"}
 * </pre>
 */
public final class PriceMessages {
    static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String PRICE_UPDATE = "price_update";
    public static final String PRICE_CACHE = "price_cache";
    public static final String CONNECTIVITY = "connectivity";
    public static final String ERROR = "error";
    public static final String PONG = "pong";

    private PriceMessages() {}

    public static String priceUpdate(PriceTick tick) {
        ObjectNode msg = envelope(PRICE_UPDATE);
        msg.set("data", tickNode(tick));
        return write(msg);
    }

    public static String priceCache(Collection<PriceTick> ticks) {
        ObjectNode msg = envelope(PRICE_CACHE);
        ArrayNode data = msg.putArray("data");
        for (PriceTick t : ticks) {
            data.add(tickNode(t));
        }
        return write(msg);
    }

    public static String connectivity(ConnectivityState state) {
        ObjectNode msg = envelope(CONNECTIVITY);
        msg.putObject("data").put("state", state.name());
        return write(msg);
    }

    public static String error(String error) {
        ObjectNode msg = envelope(ERROR);
        msg.putObject("data").put("error", error);
        return write(msg);
    }

    public static String pong() {
        return write(envelope(PONG));
    }

    static ObjectNode tickNode(PriceTick tick) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ticker", tick.ticker().symbol());
        n.put("price", tick.price());
        n.put("size", tick.size());
        n.put("timestamp", tick.timestamp());
        n.put("updated_at", tick.eventTime().toString());
        return n;
    }

    private static ObjectNode envelope(String type) {
        ObjectNode msg = MAPPER.createObjectNode();
        msg.put("type", type);
        return msg;
    }

    private static String write(ObjectNode msg) {
        try {
            return MAPPER.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize WS message", e);
        }
    }
}
