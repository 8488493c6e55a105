package in.pricehub.service.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Copy-on-write callback list. A callback that throws is logged and the remaining
 * callbacks still run.
 */
public final class ListenerList<T> {
    private static final Logger log = LoggerFactory.getLogger(ListenerList.class);

    private final String label;
    private final List<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

    public ListenerList(String label) {
        this.label = label;
    }

    public ListenerHandle add(Consumer<T> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void notifyAll(T value) {
        for (Consumer<T> l : listeners) {
            try {
                l.accept(value);
            } catch (Exception e) {
                log.warn("[{}] Listener failed: {}", label, e.toString());
            }
        }
    }

    public int size() {
        return listeners.size();
    }

    public boolean isEmpty() {
        return listeners.isEmpty();
    }
}
