package in.pricehub.service;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.service.core.ListenerHandle;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Scoped interest in live prices, held by one view or connection.
 *
 * subscribe() adds to the claimed set (claiming a ticker twice counts once), replaceInterest()
 * sets the full desired set, close() releases everything. Calls after close() are ignored.
 */
public final class PriceConsumer implements AutoCloseable {

    private final LivePriceService service;
    private final String id;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<ListenerHandle> handles = new CopyOnWriteArrayList<>();

    PriceConsumer(LivePriceService service, String id) {
        this.service = service;
        this.id = id;
    }

    public String id() {
        return id;
    }

    public void subscribe(Collection<Ticker> tickers) {
        if (!closed.get()) {
            service.subscribe(id, tickers);
        }
    }

    public void subscribe(String... symbols) {
        subscribe(Ticker.setOf(Arrays.asList(symbols)));
    }

    public void unsubscribe(Collection<Ticker> tickers) {
        if (!closed.get()) {
            service.unsubscribe(id, tickers);
        }
    }

    public void unsubscribe(String... symbols) {
        unsubscribe(Ticker.setOf(Arrays.asList(symbols)));
    }

    public void replaceInterest(Collection<Ticker> tickers) {
        if (!closed.get()) {
            service.replaceInterest(id, tickers);
        }
    }

    /**
     * Listener for changed prices of tickers this consumer claims. Removed on close().
     */
    public ListenerHandle onPrice(Consumer<PriceTick> listener) {
        if (closed.get()) {
            return () -> {};
        }
        ListenerHandle handle = service.addConsumerListener(id, listener);
        handles.add(handle);
        return handle;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        handles.forEach(ListenerHandle::close);
        handles.clear();
        service.release(id);
    }

    @Override
    public String toString() {
        return "PriceConsumer[" + id + "]";
    }
}
