package in.pricehub.infrastructure.upstream;

import in.pricehub.domain.market.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Upstream transport over java.net.http WebSocket.
 *
 * Handshake:
 *   connect -> send {"action":"auth"} -> wait for status auth_success -> session ready
 *
 * Usage:
 *   UPSTREAM_WS_URL=wss://socket.polygon.io/stocks
 *   UPSTREAM_API_KEY=...
 */
public final class WebSocketUpstreamTransport implements UpstreamTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpstreamTransport.class);

    private final URI endpoint;
    private final String apiKey;
    private final Duration authTimeout;
    private final HttpClient httpClient;
    private final PolygonMessageCodec codec;

    public WebSocketUpstreamTransport(String url, String apiKey, Duration connectTimeout,
                                      Duration authTimeout, PolygonMessageCodec codec) {
        this.endpoint = URI.create(url);
        this.apiKey = apiKey;
        this.authTimeout = authTimeout;
        this.codec = codec;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public String describe() {
        return maskUrl(endpoint.toString());
    }

    @Override
    public CompletableFuture<UpstreamSession> open(UpstreamListener listener) {
        log.info("[UPSTREAM] Connecting to {}", describe());

        CompletableFuture<UpstreamSession> ready = new CompletableFuture<>();
        FeedSocketListener socketListener = new FeedSocketListener(listener, ready);

        httpClient.newWebSocketBuilder()
            .buildAsync(endpoint, socketListener)
            .whenComplete((ws, error) -> {
                if (error != null) {
                    ready.completeExceptionally(
                        new UpstreamConnectionException(describe(), "WebSocket connect failed", error));
                }
            });

        return ready
            .orTimeout(authTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((session, error) -> {
                if (error instanceof TimeoutException) {
                    log.warn("[UPSTREAM] No auth response within {}ms", authTimeout.toMillis());
                    socketListener.abort();
                }
            });
    }

    /**
     * Socket callbacks for one session. Frames before auth_success are handshake traffic.
     */
    private final class FeedSocketListener implements WebSocket.Listener {
        private final UpstreamListener listener;
        private final CompletableFuture<UpstreamSession> ready;
        private final StringBuilder buf = new StringBuilder();

        private volatile WebSocket webSocket;
        private volatile FeedSession session;

        FeedSocketListener(UpstreamListener listener, CompletableFuture<UpstreamSession> ready) {
            this.listener = listener;
            this.ready = ready;
        }

        @Override
        public void onOpen(WebSocket ws) {
            this.webSocket = ws;
            ws.request(1);
            log.info("[UPSTREAM] Socket open, authenticating");
            ws.sendText(codec.encodeAuth(apiKey), true)
                .exceptionally(e -> {
                    ready.completeExceptionally(new UpstreamConnectionException(describe(), "Auth send failed", e));
                    return null;
                });
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                handleFrame(ws, msg);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket ws, ByteBuffer message) {
            if (session != null) {
                listener.onPong();
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            if (!ready.isDone()) {
                ready.completeExceptionally(new UpstreamConnectionException(describe(),
                    "Closed during handshake: " + statusCode + " " + reason));
            } else if (session != null && !session.closedLocally) {
                log.warn("[UPSTREAM] Disconnected: {} {}", statusCode, reason);
                listener.onClosed(statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            if (!ready.isDone()) {
                ready.completeExceptionally(new UpstreamConnectionException(describe(), "Handshake error", error));
            } else if (session != null && !session.closedLocally) {
                log.error("[UPSTREAM] WebSocket error", error);
                listener.onError(error);
            }
        }

        private void handleFrame(WebSocket ws, String msg) {
            if (session != null) {
                listener.onFrame(msg);
                return;
            }
            DecodedFrame frame = codec.decode(msg);
            for (UpstreamStatus status : frame.statuses()) {
                if (status.isAuthSuccess()) {
                    session = new FeedSession(ws, listener);
                    log.info("[UPSTREAM] ✅ Authenticated with {}", describe());
                    if (!ready.complete(session)) {
                        session.close();
                        return;
                    }
                    // ticks bundled with auth_success follow the session open
                    if (!frame.ticks().isEmpty()) {
                        listener.onFrame(msg);
                    }
                    return;
                }
                if (status.isAuthFailure()) {
                    ready.completeExceptionally(new UpstreamConnectionException(describe(),
                        "Authentication failed: " + status.message()));
                    ws.abort();
                    return;
                }
            }
        }

        void abort() {
            WebSocket ws = webSocket;
            if (ws != null) {
                ws.abort();
            }
        }
    }

    /**
     * Open session. Sends are chained so only one is outstanding at a time, as the JDK
     * WebSocket requires.
     */
    private final class FeedSession implements UpstreamSession {
        private final WebSocket ws;
        private final UpstreamListener listener;
        private CompletableFuture<WebSocket> lastSend;
        private volatile boolean closedLocally = false;

        FeedSession(WebSocket ws, UpstreamListener listener) {
            this.ws = ws;
            this.listener = listener;
            this.lastSend = CompletableFuture.completedFuture(ws);
        }

        @Override
        public void subscribe(Set<Ticker> tickers) {
            send(codec.encodeSubscribe(tickers));
        }

        @Override
        public void unsubscribe(Set<Ticker> tickers) {
            send(codec.encodeUnsubscribe(tickers));
        }

        @Override
        public synchronized void ping() {
            ensureWritable();
            lastSend = lastSend.thenCompose(w -> w.sendPing(ByteBuffer.allocate(0)));
            lastSend.exceptionally(this::onSendFailure);
        }

        private synchronized void send(String text) {
            ensureWritable();
            lastSend = lastSend.thenCompose(w -> w.sendText(text, true));
            lastSend.exceptionally(this::onSendFailure);
        }

        private void ensureWritable() {
            if (closedLocally || ws.isOutputClosed()) {
                throw new UpstreamConnectionException(describe(), "Session is closed");
            }
        }

        private WebSocket onSendFailure(Throwable e) {
            if (!closedLocally) {
                log.warn("[UPSTREAM] Send failed: {}", e.toString());
                listener.onError(e);
            }
            return null;
        }

        @Override
        public void close() {
            if (closedLocally) {
                return;
            }
            closedLocally = true;
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                .exceptionally(e -> {
                    log.debug("[UPSTREAM] Close handshake failed, aborting: {}", e.toString());
                    ws.abort();
                    return null;
                });
            log.info("[UPSTREAM] Session closed");
        }
    }

    /**
     * Mask credentials in URL for logging.
     */
    static String maskUrl(String url) {
        if (url == null) return "null";
        int tokenIdx = url.indexOf("apiKey=");
        if (tokenIdx < 0) return url;
        int endIdx = url.indexOf("&", tokenIdx);
        if (endIdx < 0) endIdx = url.length();
        return url.substring(0, tokenIdx + 7) + "***" + url.substring(endIdx);
    }
}
