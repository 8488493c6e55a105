package in.pricehub.service.portfolio;

import in.pricehub.domain.market.Ticker;

/**
 * Maps a ticker to its sector name.
 */
@FunctionalInterface
public interface SectorClassifier {

    String OTHER = "Other";

    /**
     * @return sector name, or OTHER when the ticker is unknown
     */
    String sectorOf(Ticker ticker);
}
