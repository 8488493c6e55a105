package in.pricehub.infrastructure.upstream.common;

import in.pricehub.service.core.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Heartbeat for the upstream WebSocket session.
 *
 * Features:
 * - Periodic ping on the event loop
 * - Any inbound frame or pong counts as activity
 * - Silence longer than the timeout fires the timeout callback once and stops the monitor
 *
 * Usage:
 * <pre>
 * HeartbeatMonitor heartbeat = new HeartbeatMonitor(
 *     "polygon", loop,
 *     Duration.ofSeconds(20),   // ping every 20 seconds
 *     Duration.ofSeconds(30),   // drop after 30 seconds of silence
 *     session::ping,
 *     () -> handleDrop("heartbeat timeout"));
 *
 * heartbeat.start();
 * // on every inbound frame / pong:
 * heartbeat.recordActivity();
 * </pre>
 *
 * All methods must be called on the event loop.
 */
public final class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final String label;
    private final EventLoop loop;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Runnable timeoutCallback;

    private EventLoop.Cancellable nextCheck;
    private long lastActivityAt;
    private boolean running = false;

    public HeartbeatMonitor(String label, EventLoop loop,
                            Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Runnable timeoutCallback) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        if (timeout.compareTo(pingInterval) < 0) {
            throw new IllegalArgumentException("Timeout must not be shorter than the ping interval");
        }
        this.label = label;
        this.loop = loop;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.timeoutCallback = timeoutCallback;
    }

    public void start() {
        if (running) {
            log.warn("[{}] Heartbeat already running", label);
            return;
        }
        running = true;
        lastActivityAt = loop.currentTimeMillis();
        log.debug("[{}] Heartbeat started (ping every {}ms, timeout {}ms)",
            label, pingInterval.toMillis(), timeout.toMillis());
        scheduleNext();
    }

    public void stop() {
        running = false;
        if (nextCheck != null) {
            nextCheck.cancel();
            nextCheck = null;
        }
    }

    /**
     * Record an inbound frame or pong.
     */
    public void recordActivity() {
        lastActivityAt = loop.currentTimeMillis();
    }

    public boolean isRunning() {
        return running;
    }

    public long millisSinceActivity() {
        return loop.currentTimeMillis() - lastActivityAt;
    }

    private void scheduleNext() {
        nextCheck = loop.schedule(this::check, pingInterval);
    }

    private void check() {
        if (!running) {
            return;
        }
        long silence = millisSinceActivity();
        if (silence >= timeout.toMillis()) {
            log.warn("[{}] Heartbeat timeout - no inbound traffic for {}ms", label, silence);
            expire();
            return;
        }
        try {
            pingFunction.run();
        } catch (Exception e) {
            log.warn("[{}] Ping failed: {}", label, e.toString());
            expire();
            return;
        }
        scheduleNext();
    }

    private void expire() {
        stop();
        timeoutCallback.run();
    }
}
