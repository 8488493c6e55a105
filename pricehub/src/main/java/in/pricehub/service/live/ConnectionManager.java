package in.pricehub.service.live;

import in.pricehub.domain.market.ConnectivityState;
import in.pricehub.domain.market.Ticker;
import in.pricehub.infrastructure.metrics.LivePriceMetrics;
import in.pricehub.infrastructure.metrics.LivePriceMetrics.UpstreamAction;
import in.pricehub.infrastructure.upstream.UpstreamConnectionException;
import in.pricehub.infrastructure.upstream.UpstreamListener;
import in.pricehub.infrastructure.upstream.UpstreamSession;
import in.pricehub.infrastructure.upstream.UpstreamTransport;
import in.pricehub.infrastructure.upstream.common.HeartbeatMonitor;
import in.pricehub.infrastructure.upstream.common.ReconnectionPolicy;
import in.pricehub.service.core.EventLoop;
import in.pricehub.service.core.ListenerHandle;
import in.pricehub.service.core.ListenerList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owner of the single upstream price connection.
 *
 * State machine:
 * <pre>
 * CONNECTING --open--> OPEN --drop--> RECONNECTING --open--> OPEN ...
 *      \                                  |
 *       `--open failed--------------------'
 * any state --shutdown--> CLOSED (terminal)
 * </pre>
 *
 * Recovery:
 * - Every entry into OPEN discards buffered intents and sends one subscribe carrying the
 *   registry's full active set. Tickers released during the outage are therefore never
 *   resubscribed.
 * - Drops and failed opens retry with ReconnectionPolicy backoff, indefinitely.
 * - A heartbeat pings the session; silence past the timeout counts as a drop.
 *
 * Outbound intents are coalesced per ticker and flushed once at the end of the current loop
 * turn while OPEN. Callbacks from an earlier session generation are ignored.
 *
 * All state is confined to the event loop; state() and upstreamTickers() may be read from
 * any thread.
 */
public final class ConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final UpstreamTransport transport;
    private final EventLoop loop;
    private final ReconnectionPolicy policy;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final Supplier<Set<Ticker>> activeTickers;
    private final Consumer<String> frameHandler;
    private final LivePriceMetrics metrics;

    private final PendingIntents pending = new PendingIntents();
    private final ListenerList<ConnectivityState> stateListeners = new ListenerList<>("CONN STATE");

    private volatile ConnectivityState state = ConnectivityState.CONNECTING;
    private volatile Set<Ticker> upstreamView = Set.of();

    private final Set<Ticker> upstreamTickers = new TreeSet<>();
    private UpstreamSession session;
    private HeartbeatMonitor heartbeat;
    private EventLoop.Cancellable reconnectTask;
    private int generation = 0;
    private boolean started = false;
    private boolean flushScheduled = false;

    /**
     * @param activeTickers current registry active set, read on the loop
     * @param frameHandler  receives every inbound text frame of the live session, on the loop
     */
    public ConnectionManager(UpstreamTransport transport, EventLoop loop, ReconnectionPolicy policy,
                             Duration heartbeatInterval, Duration heartbeatTimeout,
                             Supplier<Set<Ticker>> activeTickers, Consumer<String> frameHandler,
                             LivePriceMetrics metrics) {
        this.transport = transport;
        this.loop = loop;
        this.policy = policy;
        this.heartbeatInterval = heartbeatInterval;
        this.heartbeatTimeout = heartbeatTimeout;
        this.activeTickers = activeTickers;
        this.frameHandler = frameHandler;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════════════

    public void start() {
        onLoop(() -> {
            if (started || state.isTerminal()) {
                return;
            }
            started = true;
            log.info("[CONN] Starting upstream connection to {}", transport.describe());
            metrics.recordConnectivity(state);
            connect();
        });
    }

    /**
     * Close the connection for good. Later calls and callbacks are ignored.
     */
    public void shutdown() {
        onLoop(() -> {
            if (state.isTerminal()) {
                return;
            }
            generation++;
            cancelReconnect();
            stopHeartbeat();
            closeSession();
            pending.clear();
            clearUpstream();
            transition(ConnectivityState.CLOSED);
            log.info("[CONN] Shut down");
        });
    }

    private void connect() {
        if (state.isTerminal()) {
            return;
        }
        reconnectTask = null;
        int gen = ++generation;
        log.debug("[CONN] Opening session (generation {})", gen);

        try {
            transport.open(new SessionListener(gen)).whenComplete((s, error) ->
                loop.execute(() -> onOpenResult(gen, s, error)));
        } catch (RuntimeException e) {
            log.warn("[CONN] Transport refused to open: {}", e.toString());
            scheduleReconnect();
        }
    }

    private void onOpenResult(int gen, UpstreamSession opened, Throwable error) {
        if (gen != generation || state.isTerminal()) {
            if (opened != null) {
                log.debug("[CONN] Discarding session from superseded generation {}", gen);
                opened.close();
            }
            return;
        }
        if (error != null) {
            log.warn("[CONN] Connect attempt failed: {}", rootMessage(error));
            scheduleReconnect();
            return;
        }

        session = opened;
        policy.recordSuccess();
        pending.clear();
        clearUpstream();
        transition(ConnectivityState.OPEN);
        log.info("[CONN] ✅ Upstream open (generation {})", gen);

        resubscribeAll();
        if (session != null) {
            startHeartbeat(gen);
        }
    }

    private void resubscribeAll() {
        Set<Ticker> all = activeTickers.get();
        if (all.isEmpty()) {
            return;
        }
        if (send(true, all)) {
            upstreamTickers.addAll(all);
            publishUpstream();
            metrics.recordUpstreamMessage(UpstreamAction.RESUBSCRIBE_ALL, all.size());
            log.info("[CONN] Resubscribed {} tickers", all.size());
        }
    }

    private void handleDrop(int gen, String reason) {
        if (gen != generation || state != ConnectivityState.OPEN) {
            return;
        }
        log.warn("[CONN] Upstream dropped: {}", reason);
        stopHeartbeat();
        closeSession();
        clearUpstream();
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (state.isTerminal()) {
            return;
        }
        transition(ConnectivityState.RECONNECTING);
        Duration delay = policy.getNextDelay();
        policy.recordFailure();
        metrics.recordReconnectAttempt(policy.getAttemptCount());
        log.info("[CONN] Reconnect attempt {} in {}ms", policy.getAttemptCount(), delay.toMillis());
        reconnectTask = loop.schedule(this::connect, delay);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Outbound intents
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Queue the zero crossings of one registry call. Must be called on the loop.
     */
    public void request(SubscriptionDelta delta) {
        if (delta.isEmpty() || state.isTerminal()) {
            return;
        }
        pending.unsubscribe(delta.removed());
        pending.subscribe(delta.added());
        if (state == ConnectivityState.OPEN && !flushScheduled) {
            flushScheduled = true;
            loop.execute(this::flush);
        }
    }

    private void flush() {
        flushScheduled = false;
        if (state != ConnectivityState.OPEN || pending.isEmpty()) {
            return;
        }
        PendingIntents.Batch batch = pending.drain();
        Set<Ticker> active = activeTickers.get();

        Set<Ticker> toRemove = new LinkedHashSet<>();
        for (Ticker t : batch.unsubscribe()) {
            if (upstreamTickers.contains(t) && !active.contains(t)) toRemove.add(t);
        }
        Set<Ticker> toAdd = new LinkedHashSet<>();
        for (Ticker t : batch.subscribe()) {
            if (!upstreamTickers.contains(t) && active.contains(t)) toAdd.add(t);
        }

        if (!toRemove.isEmpty() && send(false, toRemove)) {
            upstreamTickers.removeAll(toRemove);
            metrics.recordUpstreamMessage(UpstreamAction.UNSUBSCRIBE, toRemove.size());
            log.info("[CONN] Unsubscribed {}", toRemove);
        }
        if (!toAdd.isEmpty() && session != null && send(true, toAdd)) {
            upstreamTickers.addAll(toAdd);
            metrics.recordUpstreamMessage(UpstreamAction.SUBSCRIBE, toAdd.size());
            log.info("[CONN] Subscribed {}", toAdd);
        }
        publishUpstream();
    }

    private boolean send(boolean subscribe, Set<Ticker> tickers) {
        UpstreamSession s = session;
        if (s == null) {
            return false;
        }
        try {
            if (subscribe) {
                s.subscribe(tickers);
            } else {
                s.unsubscribe(tickers);
            }
            return true;
        } catch (UpstreamConnectionException e) {
            handleDrop(generation, "send failed: " + e.getMessage());
            return false;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Heartbeat
    // ═══════════════════════════════════════════════════════════════════════

    private void startHeartbeat(int gen) {
        UpstreamSession s = session;
        heartbeat = new HeartbeatMonitor("UPSTREAM HEARTBEAT", loop, heartbeatInterval, heartbeatTimeout,
            s::ping, () -> handleDrop(gen, "heartbeat timeout"));
        heartbeat.start();
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.stop();
            heartbeat = null;
        }
    }

    private void recordActivity() {
        if (heartbeat != null) {
            heartbeat.recordActivity();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // State
    // ═══════════════════════════════════════════════════════════════════════

    public ConnectivityState state() {
        return state;
    }

    /**
     * Tickers the live session currently carries upstream (empty when not OPEN).
     */
    public Set<Ticker> upstreamTickers() {
        return upstreamView;
    }

    /**
     * Buffered intents not yet sent. Loop only.
     */
    int pendingIntentCount() {
        return pending.size();
    }

    public ListenerHandle onStateChange(Consumer<ConnectivityState> listener) {
        return stateListeners.add(listener);
    }

    private void transition(ConnectivityState next) {
        if (state == next) {
            return;
        }
        ConnectivityState previous = state;
        state = next;
        log.info("[CONN] {} -> {}", previous, next);
        metrics.recordConnectivity(next);
        stateListeners.notifyAll(next);
    }

    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }

    private void clearUpstream() {
        upstreamTickers.clear();
        publishUpstream();
    }

    private void publishUpstream() {
        upstreamView = Collections.unmodifiableSet(new TreeSet<>(upstreamTickers));
    }

    private void onLoop(Runnable task) {
        if (loop.inEventLoop()) {
            task.run();
        } else {
            loop.execute(task);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable t = error;
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.toString();
    }

    /**
     * Transport callbacks for one session generation, re-dispatched onto the loop.
     */
    private final class SessionListener implements UpstreamListener {
        private final int gen;

        SessionListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onFrame(String text) {
            loop.execute(() -> {
                if (gen != generation || state != ConnectivityState.OPEN) {
                    return;
                }
                recordActivity();
                frameHandler.accept(text);
            });
        }

        @Override
        public void onPong() {
            loop.execute(() -> {
                if (gen == generation) {
                    recordActivity();
                }
            });
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            loop.execute(() -> handleDrop(gen, "closed " + statusCode + " " + reason));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> handleDrop(gen, "error " + error));
        }
    }
}
