package in.pricehub.service.portfolio;

import in.pricehub.domain.market.Ticker;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StaticSectorClassifierTest {

    @Test
    void testKnownAndUnknownTickers() {
        SectorClassifier classifier = new StaticSectorClassifier();

        assertEquals("Technology", classifier.sectorOf(Ticker.of("AAPL")));
        assertEquals("Consumer Cyclical", classifier.sectorOf(Ticker.of("tsla")));
        assertEquals(SectorClassifier.OTHER, classifier.sectorOf(Ticker.of("XYZQ")));
    }

    @Test
    void testCustomTableIsNormalised() {
        SectorClassifier classifier = new StaticSectorClassifier(Map.of(" shop ", "Technology"));

        assertEquals("Technology", classifier.sectorOf(Ticker.of("SHOP")));
        assertEquals(SectorClassifier.OTHER, classifier.sectorOf(Ticker.of("AAPL")));
    }
}
