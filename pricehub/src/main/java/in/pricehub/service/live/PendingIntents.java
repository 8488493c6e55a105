package in.pricehub.service.live;

import in.pricehub.domain.market.Ticker;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outbound subscribe/unsubscribe intents waiting to be sent upstream, coalesced by ticker.
 *
 * Registry transitions alternate per ticker (0->1, 1->0, ...), so an intent opposite to the
 * one already pending cancels it: an unsubscribe followed by a subscribe in the same turn
 * sends nothing.
 */
final class PendingIntents {

    enum Intent { SUBSCRIBE, UNSUBSCRIBE }

    record Batch(Set<Ticker> subscribe, Set<Ticker> unsubscribe) {
        boolean isEmpty() {
            return subscribe.isEmpty() && unsubscribe.isEmpty();
        }
    }

    private final Map<Ticker, Intent> pending = new LinkedHashMap<>();

    void subscribe(Collection<Ticker> tickers) {
        record(tickers, Intent.SUBSCRIBE);
    }

    void unsubscribe(Collection<Ticker> tickers) {
        record(tickers, Intent.UNSUBSCRIBE);
    }

    private void record(Collection<Ticker> tickers, Intent intent) {
        for (Ticker t : tickers) {
            Intent existing = pending.get(t);
            if (existing != null && existing != intent) {
                pending.remove(t);
            } else {
                pending.put(t, intent);
            }
        }
    }

    Batch drain() {
        Set<Ticker> subs = new LinkedHashSet<>();
        Set<Ticker> unsubs = new LinkedHashSet<>();
        pending.forEach((t, intent) -> {
            if (intent == Intent.SUBSCRIBE) subs.add(t);
            else unsubs.add(t);
        });
        pending.clear();
        return new Batch(subs, unsubs);
    }

    void clear() {
        pending.clear();
    }

    boolean isEmpty() {
        return pending.isEmpty();
    }

    int size() {
        return pending.size();
    }
}
