package in.pricehub.service.live;

import in.pricehub.domain.market.Ticker;

import java.util.Set;

/**
 * Tickers whose refcount crossed zero in one registry call.
 *
 * @param added   tickers that went 0 -> 1 (newly needed upstream)
 * @param removed tickers that went 1 -> 0 (no longer needed upstream)
 */
public record SubscriptionDelta(Set<Ticker> added, Set<Ticker> removed) {

    public static final SubscriptionDelta NONE = new SubscriptionDelta(Set.of(), Set.of());

    public SubscriptionDelta {
        added = Set.copyOf(added);
        removed = Set.copyOf(removed);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
