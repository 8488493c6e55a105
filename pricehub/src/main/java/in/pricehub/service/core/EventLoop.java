package in.pricehub.service.core;

import java.time.Duration;

/**
 * Single logical thread on which all live-price state is mutated.
 *
 * Registry updates, cache writes, connection state transitions and aggregation all run here,
 * so none of that state needs locking. Tasks run in submission order.
 */
public interface EventLoop {

    /**
     * Queue a task to run after everything already queued.
     */
    void execute(Runnable task);

    /**
     * Run a task after a delay. The returned handle cancels it if it has not started.
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * @return true when called from the loop's own thread
     */
    boolean inEventLoop();

    /**
     * Current time as seen by the loop (virtual in tests).
     */
    long currentTimeMillis();

    void shutdown();

    /**
     * Handle to a scheduled task.
     */
    interface Cancellable {
        void cancel();
    }
}
