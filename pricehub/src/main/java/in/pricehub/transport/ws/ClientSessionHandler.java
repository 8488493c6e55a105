package in.pricehub.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Protocol logic for one price socket client, independent of the socket library.
 *
 * Client -> server:
 * <pre>
 * {"action":"subscribe","tickers":["AAPL","MSFT"]}
 * {"action":"unsubscribe","tickers":["MSFT"]}
 * {"action":"ping"}
 * </pre>
 */
public final class ClientSessionHandler {
    private static final Logger log = LoggerFactory.getLogger(ClientSessionHandler.class);

    private final ClientSession session;
    private final Consumer<String> sender;
    private final Supplier<List<PriceTick>> cachedPrices;

    /**
     * @param sender       writes one text frame to the client
     * @param cachedPrices current price cache contents, sent once on open
     */
    public ClientSessionHandler(ClientSession session, Consumer<String> sender,
                                Supplier<List<PriceTick>> cachedPrices) {
        this.session = session;
        this.sender = sender;
        this.cachedPrices = cachedPrices;
    }

    public void onOpen() {
        List<PriceTick> cached = cachedPrices.get();
        if (!cached.isEmpty()) {
            sender.accept(PriceMessages.priceCache(cached));
        }
        session.getConsumer().onPrice(tick -> sender.accept(PriceMessages.priceUpdate(tick)));
    }

    public void onMessage(String raw) {
        session.touch();

        ClientMessage msg;
        try {
            msg = PriceMessages.MAPPER.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            sender.accept(PriceMessages.error("Invalid JSON: " + e.getOriginalMessage()));
            return;
        }
        // a bare JSON null parses to no message at all
        if (msg == null || msg.action == null) {
            sender.accept(PriceMessages.error("Missing 'action'"));
            return;
        }

        switch (msg.action) {
            case "subscribe" -> {
                Set<Ticker> tickers = parseTickers(msg);
                if (tickers != null && !tickers.isEmpty()) {
                    session.getConsumer().subscribe(tickers);
                    log.debug("[WS HUB] {} subscribe {}", session.getSessionId(), tickers);
                }
            }
            case "unsubscribe" -> {
                Set<Ticker> tickers = parseTickers(msg);
                if (tickers != null && !tickers.isEmpty()) {
                    session.getConsumer().unsubscribe(tickers);
                    log.debug("[WS HUB] {} unsubscribe {}", session.getSessionId(), tickers);
                }
            }
            case "ping" -> sender.accept(PriceMessages.pong());
            default -> sender.accept(PriceMessages.error("Unknown action: " + msg.action));
        }
    }

    private Set<Ticker> parseTickers(ClientMessage msg) {
        try {
            return Ticker.setOf(msg.tickers);
        } catch (IllegalArgumentException e) {
            sender.accept(PriceMessages.error(e.getMessage()));
            return null;
        }
    }

    /**
     * Release the client's claims. Safe to call more than once.
     */
    public void onClose() {
        session.getConsumer().close();
    }

    public ClientSession getSession() {
        return session;
    }

    // Message model
    public static final class ClientMessage {
        public String action;
        public List<String> tickers;
    }
}
