package in.pricehub.service.live;

import in.pricehub.domain.market.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reference-counted ticker interest across independent consumers.
 *
 * Each consumer has a claimed set; a ticker's refcount is the number of consumers whose
 * claimed set contains it. Claiming a ticker the consumer already holds does not count
 * twice, so re-sending the same interest set is a no-op. Every mutation returns the tickers
 * that crossed zero, which is all the upstream connection needs to hear about.
 *
 * Not thread-safe: only called from the event loop.
 */
public final class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<String, Set<Ticker>> claimsByConsumer = new HashMap<>();
    private final Map<Ticker, Set<String>> consumersByTicker = new HashMap<>();

    /**
     * Add tickers to a consumer's claimed set.
     */
    public SubscriptionDelta subscribe(String consumerId, Collection<Ticker> tickers) {
        Set<Ticker> desired = new LinkedHashSet<>(claimedBy(consumerId));
        desired.addAll(tickers);
        return replace(consumerId, desired);
    }

    /**
     * Remove tickers from a consumer's claimed set. Tickers it never claimed are ignored.
     */
    public SubscriptionDelta unsubscribe(String consumerId, Collection<Ticker> tickers) {
        Set<Ticker> current = claimsByConsumer.get(consumerId);
        if (current == null) {
            return SubscriptionDelta.NONE;
        }
        Set<Ticker> desired = new LinkedHashSet<>(current);
        desired.removeAll(tickers);
        return replace(consumerId, desired);
    }

    /**
     * Set a consumer's full desired interest, diffing against what it claimed before.
     */
    public SubscriptionDelta replace(String consumerId, Collection<Ticker> tickers) {
        if (consumerId == null) {
            throw new IllegalArgumentException("consumerId cannot be null");
        }
        Set<Ticker> previous = claimsByConsumer.getOrDefault(consumerId, Set.of());
        Set<Ticker> desired = new LinkedHashSet<>(tickers);

        Set<Ticker> added = new LinkedHashSet<>();
        Set<Ticker> removed = new LinkedHashSet<>();

        for (Ticker t : desired) {
            if (previous.contains(t)) continue;
            Set<String> holders = consumersByTicker.computeIfAbsent(t, k -> new HashSet<>());
            holders.add(consumerId);
            if (holders.size() == 1) {
                added.add(t);
            }
        }
        for (Ticker t : previous) {
            if (desired.contains(t)) continue;
            Set<String> holders = consumersByTicker.get(t);
            if (holders == null) continue;
            holders.remove(consumerId);
            if (holders.isEmpty()) {
                consumersByTicker.remove(t);
                removed.add(t);
            }
        }

        if (desired.isEmpty()) {
            claimsByConsumer.remove(consumerId);
        } else {
            claimsByConsumer.put(consumerId, desired);
        }

        if (!added.isEmpty() || !removed.isEmpty()) {
            log.debug("[REGISTRY] {}: +{} -{} (active={})", consumerId, added, removed, consumersByTicker.size());
        }
        return new SubscriptionDelta(added, removed);
    }

    /**
     * Drop every claim of a consumer.
     */
    public SubscriptionDelta release(String consumerId) {
        if (!claimsByConsumer.containsKey(consumerId)) {
            return SubscriptionDelta.NONE;
        }
        return replace(consumerId, Set.of());
    }

    /**
     * Tickers with refcount > 0, sorted.
     */
    public Set<Ticker> activeTickers() {
        return Collections.unmodifiableSet(new TreeSet<>(consumersByTicker.keySet()));
    }

    public int refCount(Ticker ticker) {
        Set<String> holders = consumersByTicker.get(ticker);
        return holders == null ? 0 : holders.size();
    }

    public Set<String> consumersOf(Ticker ticker) {
        Set<String> holders = consumersByTicker.get(ticker);
        return holders == null ? Set.of() : Set.copyOf(holders);
    }

    public Set<Ticker> claimedBy(String consumerId) {
        Set<Ticker> claimed = claimsByConsumer.get(consumerId);
        return claimed == null ? Set.of() : Collections.unmodifiableSet(claimed);
    }

    public boolean isActive(Ticker ticker) {
        return consumersByTicker.containsKey(ticker);
    }

    public int consumerCount() {
        return claimsByConsumer.size();
    }
}
