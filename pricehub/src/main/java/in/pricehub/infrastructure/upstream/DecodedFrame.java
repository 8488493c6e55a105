package in.pricehub.infrastructure.upstream;

import in.pricehub.domain.market.PriceTick;

import java.util.List;

/**
 * Result of decoding one upstream text frame.
 *
 * @param ticks     valid trade ticks, in frame order
 * @param statuses  control events
 * @param malformed entries dropped because they could not be parsed or validated
 * @param ignored   well-formed entries of event types this feed does not use
 */
public record DecodedFrame(
    List<PriceTick> ticks,
    List<UpstreamStatus> statuses,
    int malformed,
    int ignored
) {
    public DecodedFrame {
        ticks = List.copyOf(ticks);
        statuses = List.copyOf(statuses);
    }

    public static DecodedFrame unreadable() {
        return new DecodedFrame(List.of(), List.of(), 1, 0);
    }
}
