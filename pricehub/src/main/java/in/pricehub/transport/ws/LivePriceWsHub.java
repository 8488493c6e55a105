package in.pricehub.transport.ws;

import in.pricehub.domain.market.ConnectivityState;
import in.pricehub.service.LivePriceService;
import in.pricehub.service.PriceConsumer;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Undertow-native WebSocket hub for live prices:
 * - One independent PriceConsumer per connected channel
 * - Cached prices pushed on connect, then changes of the channel's own tickers
 * - Connectivity changes broadcast to every channel
 * - Claims released when the channel closes or fails
 */
public final class LivePriceWsHub {
    private static final Logger log = LoggerFactory.getLogger(LivePriceWsHub.class);

    private final LivePriceService service;

    // Channel -> Session handler
    private final ConcurrentMap<WebSocketChannel, ClientSessionHandler> sessions = new ConcurrentHashMap<>();

    public LivePriceWsHub(LivePriceService service) {
        this.service = service;
        service.onConnectivityChange(this::broadcastConnectivity);
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String sessionId = UUID.randomUUID().toString();
                PriceConsumer consumer = service.openConsumer("ws-" + sessionId.substring(0, 8));
                ClientSession session = new ClientSession(sessionId, String.valueOf(channel.getSourceAddress()), consumer);
                ClientSessionHandler handler = new ClientSessionHandler(
                    session, text -> WebSockets.sendText(text, channel, null), service::cachedPrices);
                sessions.put(channel, handler);

                log.info("[WS HUB] Connected: {} (session={})", session.getRemoteAddress(), sessionId);

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handler.onMessage(message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS HUB] Channel error: {}", error.toString());
                        cleanup(ch);
                    }
                });
                channel.addCloseTask(ch -> cleanup(ch));

                channel.resumeReceives();
                handler.onOpen();
                WebSockets.sendText(PriceMessages.connectivity(service.getConnectivity()), channel, null);
            }
        });
    }

    private void broadcastConnectivity(ConnectivityState state) {
        String msg = PriceMessages.connectivity(state);
        for (WebSocketChannel channel : sessions.keySet()) {
            WebSockets.sendText(msg, channel, null);
        }
    }

    private void cleanup(WebSocketChannel channel) {
        ClientSessionHandler handler = sessions.remove(channel);
        if (handler == null) {
            return;
        }
        handler.onClose();
        log.info("[WS HUB] Disconnected: {} (session={})",
            handler.getSession().getRemoteAddress(), handler.getSession().getSessionId());
        if (channel.isOpen()) {
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("[WS HUB] Close failed: {}", e.toString());
            }
        }
    }

    /**
     * Get total connection count.
     */
    public int getConnectionCount() {
        return sessions.size();
    }
}
