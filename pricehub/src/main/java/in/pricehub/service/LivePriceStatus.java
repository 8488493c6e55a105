package in.pricehub.service;

import in.pricehub.domain.market.ConnectivityState;
import in.pricehub.domain.market.Ticker;

import java.util.Set;

/**
 * Point-in-time view of the live price service for status endpoints.
 */
public record LivePriceStatus(
    ConnectivityState state,
    int consumers,
    Set<Ticker> activeTickers,
    Set<Ticker> upstreamTickers,
    Set<Ticker> cachedTickers
) {}
