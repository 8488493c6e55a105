package in.pricehub.service.live;

import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.infrastructure.metrics.LivePriceMetrics;
import in.pricehub.infrastructure.metrics.LivePriceMetrics.TickOutcome;
import in.pricehub.infrastructure.upstream.PolygonMessageCodec;
import in.pricehub.service.core.ListenerHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DispatcherTest {

    @Mock
    private LivePriceMetrics metrics;

    private PriceCache cache;
    private SubscriptionRegistry registry;
    private Dispatcher dispatcher;

    private final List<PriceTick> heardByA = new ArrayList<>();
    private final List<PriceTick> heardByB = new ArrayList<>();

    @BeforeEach
    void setUp() {
        cache = new PriceCache();
        registry = new SubscriptionRegistry();
        dispatcher = new Dispatcher(cache, registry, new PolygonMessageCodec(), metrics);

        registry.subscribe("A", List.of(Ticker.of("AAPL")));
        registry.subscribe("B", List.of(Ticker.of("MSFT")));
        dispatcher.addConsumerListener("A", heardByA::add);
        dispatcher.addConsumerListener("B", heardByB::add);
    }

    @Test
    void testTicksRouteOnlyToClaimingConsumer() {
        dispatcher.onFrame("[{\"ev\":\"T\",\"sym\":\"AAPL\",\"p\":185.43,\"s\":100,\"t\":1000},"
            + "{\"ev\":\"T\",\"sym\":\"MSFT\",\"p\":410.1,\"s\":5,\"t\":1000}]");

        assertEquals(1, heardByA.size());
        assertEquals(Ticker.of("AAPL"), heardByA.get(0).ticker());
        assertEquals(1, heardByB.size());
        assertEquals(Ticker.of("MSFT"), heardByB.get(0).ticker());
        verify(metrics, times(2)).recordTick(TickOutcome.CHANGED);
    }

    @Test
    void testUnchangedAndStaleTicksAreNotDelivered() {
        dispatcher.dispatch(PriceTick.of("AAPL", "185.43", 10L));

        assertEquals(PriceCache.ApplyResult.UNCHANGED, dispatcher.dispatch(PriceTick.of("AAPL", "185.430", 11L)));
        assertEquals(PriceCache.ApplyResult.STALE, dispatcher.dispatch(PriceTick.of("AAPL", "190", 9L)));

        assertEquals(1, heardByA.size(), "only the first tick changed the price");
        verify(metrics).recordTick(TickOutcome.UNCHANGED);
        verify(metrics).recordTick(TickOutcome.STALE);
    }

    @Test
    void testMalformedFrameIsCountedAndDropped() {
        dispatcher.onFrame("not json at all");

        verify(metrics).recordMalformed(1);
        verify(metrics, never()).recordTick(any());
        assertEquals(0, cache.size());
    }

    @Test
    void testMalformedEntryDoesNotBlockValidOnes() {
        dispatcher.onFrame("[{\"ev\":\"T\",\"sym\":\"AAPL\",\"p\":\"abc\",\"t\":1},"
            + "{\"ev\":\"status\",\"status\":\"auth_success\",\"message\":\"authenticated\"},"
            + "{\"ev\":\"T\",\"sym\":\"AAPL\",\"p\":186,\"t\":2}]");

        verify(metrics).recordMalformed(1);
        assertEquals(1, heardByA.size());
        assertEquals("186", heardByA.get(0).price().toPlainString());
    }

    @Test
    void testGlobalListenerHearsEveryChange() {
        List<PriceTick> all = new ArrayList<>();
        ListenerHandle handle = dispatcher.onPriceUpdate(all::add);

        dispatcher.dispatch(PriceTick.of("TSLA", "250", 1L));
        handle.close();
        dispatcher.dispatch(PriceTick.of("TSLA", "251", 2L));

        assertEquals(1, all.size(), "unclaimed tickers still reach global listeners until detached");
        assertTrue(heardByA.isEmpty());
    }

    @Test
    void testRemovedConsumerHearsNothing() {
        dispatcher.removeConsumer("A");

        dispatcher.dispatch(PriceTick.of("AAPL", "185", 1L));

        assertTrue(heardByA.isEmpty());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        dispatcher.addConsumerListener("A", tick -> {
            throw new IllegalStateException("boom");
        });
        List<PriceTick> second = new ArrayList<>();
        dispatcher.addConsumerListener("A", second::add);

        dispatcher.dispatch(PriceTick.of("AAPL", "185", 1L));

        assertEquals(1, heardByA.size());
        assertEquals(1, second.size());
    }
}
