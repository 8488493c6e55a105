package in.pricehub.service;

import in.pricehub.domain.market.ConnectivityState;
import in.pricehub.domain.market.PriceTick;
import in.pricehub.domain.market.Ticker;
import in.pricehub.domain.portfolio.DeltaDirection;
import in.pricehub.domain.portfolio.PortfolioSnapshot;
import in.pricehub.domain.portfolio.Position;
import in.pricehub.infrastructure.upstream.common.ReconnectionPolicy;
import in.pricehub.testing.FakeUpstreamTransport;
import in.pricehub.testing.FakeUpstreamTransport.FakeSession;
import in.pricehub.testing.FakeUpstreamTransport.FakeSession.Kind;
import in.pricehub.testing.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of the multiplexer and the portfolio aggregator over a scripted upstream.
 */
@DisplayName("Live price service")
class LivePriceServiceTest {

    private static final Ticker AAPL = Ticker.of("AAPL");
    private static final Ticker MSFT = Ticker.of("MSFT");
    private static final Ticker TSLA = Ticker.of("TSLA");

    private ManualEventLoop loop;
    private FakeUpstreamTransport transport;
    private LivePriceService service;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeUpstreamTransport();
        service = LivePriceService.builder()
            .eventLoop(loop)
            .transport(transport)
            .reconnectionPolicy(ReconnectionPolicy.builder()
                .initialDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(30))
                .build())
            .clock(Clock.fixed(Instant.parse("2024-02-06T15:00:00Z"), ZoneOffset.UTC))
            .build();
    }

    private FakeSession startAndOpen() {
        service.start();
        loop.runPending();
        FakeSession session = transport.acceptLast();
        loop.runPending();
        return session;
    }

    private void deliverTrade(String symbol, String price, long timestamp) {
        transport.lastAttempt().deliver("[{\"ev\":\"T\",\"sym\":\"" + symbol + "\",\"p\":" + price
            + ",\"s\":1,\"t\":" + timestamp + "}]");
        loop.runPending();
    }

    @Test
    void testBuilderRequiresLoopAndTransport() {
        assertThrows(IllegalStateException.class, () -> LivePriceService.builder().transport(transport).build());
        assertThrows(IllegalStateException.class, () -> LivePriceService.builder().eventLoop(loop).build());
    }

    @Test
    @DisplayName("Two consumers share MSFT; it stays upstream until both release it")
    void testSharedTickerAcrossConsumers() {
        FakeSession session = startAndOpen();
        PriceConsumer a = service.openConsumer("a");
        PriceConsumer b = service.openConsumer("b");

        a.subscribe("AAPL", "MSFT");
        b.subscribe("MSFT");
        loop.runPending();

        assertEquals(1, session.sent().size());
        assertEquals(Set.of(AAPL, MSFT), session.upstreamTickers());

        a.close();
        loop.runPending();
        assertEquals(Set.of(MSFT), session.upstreamTickers());
        assertEquals(Set.of(MSFT), service.status().activeTickers());

        b.close();
        loop.runPending();
        assertTrue(session.upstreamTickers().isEmpty());
        assertEquals(0, service.status().consumers());
    }

    @Test
    void testConsumerHearsOnlyItsOwnTickers() {
        startAndOpen();
        PriceConsumer a = service.openConsumer("a");
        PriceConsumer b = service.openConsumer("b");
        List<PriceTick> heardByA = new ArrayList<>();
        List<PriceTick> heardByB = new ArrayList<>();
        a.onPrice(heardByA::add);
        b.onPrice(heardByB::add);
        a.subscribe("AAPL");
        b.subscribe("MSFT");
        loop.runPending();

        deliverTrade("AAPL", "185.5", 1000);
        deliverTrade("MSFT", "410.5", 1000);

        assertEquals(List.of(AAPL), heardByA.stream().map(PriceTick::ticker).toList());
        assertEquals(List.of(MSFT), heardByB.stream().map(PriceTick::ticker).toList());
        assertTrue(service.getPrice(AAPL).isPresent());
    }

    @Test
    void testClosedConsumerHearsNothingAndIgnoresCalls() {
        FakeSession session = startAndOpen();
        PriceConsumer a = service.openConsumer("a");
        List<PriceTick> heard = new ArrayList<>();
        a.onPrice(heard::add);
        a.subscribe("AAPL");
        loop.runPending();

        a.close();
        a.close();
        a.subscribe("TSLA");
        loop.runPending();
        deliverTrade("AAPL", "190", 2000);

        assertTrue(heard.isEmpty());
        assertTrue(a.isClosed());
        assertTrue(session.upstreamTickers().isEmpty(), "TSLA never requested after close");
    }

    @Test
    @DisplayName("Tearing down one view and opening another for the same ticker sends nothing upstream")
    void testViewSwapDoesNotChurnUpstream() {
        FakeSession session = startAndOpen();
        PriceConsumer oldView = service.openConsumer("watchlist");
        oldView.subscribe("AAPL");
        loop.runPending();
        assertEquals(1, session.sent().size());

        oldView.close();
        PriceConsumer newView = service.openConsumer("watchlist");
        newView.subscribe("AAPL");
        loop.runPending();

        assertEquals(1, session.sent().size());
        assertEquals(Set.of(AAPL), service.status().upstreamTickers());
        assertNotEquals(oldView.id(), newView.id());
    }

    @Test
    @DisplayName("Unsubscribe during an outage is honoured by the reconnect replay")
    void testUnsubscribeDuringOutage() {
        startAndOpen();
        PriceConsumer a = service.openConsumer("a");
        a.subscribe("AAPL", "MSFT");
        loop.runPending();

        transport.lastAttempt().drop();
        loop.runPending();
        assertEquals(ConnectivityState.RECONNECTING, service.getConnectivity());

        a.unsubscribe("MSFT");
        loop.runPending();
        loop.advance(Duration.ofSeconds(1));
        FakeSession second = transport.acceptLast();
        loop.runPending();

        assertEquals(ConnectivityState.OPEN, service.getConnectivity());
        assertEquals(1, second.sent().size());
        assertEquals(Kind.SUBSCRIBE, second.sent().get(0).kind());
        assertEquals(Set.of(AAPL), second.upstreamTickers());
    }

    @Test
    void testConnectivityListener() {
        List<ConnectivityState> states = new ArrayList<>();
        service.onConnectivityChange(states::add);

        startAndOpen();
        transport.lastAttempt().drop();
        loop.runPending();
        service.close();
        loop.runPending();

        assertEquals(List.of(ConnectivityState.OPEN, ConnectivityState.RECONNECTING, ConnectivityState.CLOSED), states);
    }

    @Test
    @DisplayName("Portfolio positions become upstream interest and are revalued by ticks")
    void testPortfolioFollowsLivePrices() {
        FakeSession session = startAndOpen();
        List<DeltaDirection> deltas = new ArrayList<>();
        service.onDelta(deltas::add);

        service.replacePositions(List.of(Position.of("p1", "TSLA", "10", "200")));
        loop.runPending();

        assertEquals(Set.of(TSLA), session.upstreamTickers());
        assertEquals(0, service.currentSnapshot().totalValue().compareTo(new BigDecimal("2000")));

        deliverTrade("TSLA", "220", 1000);

        PortfolioSnapshot snapshot = service.currentSnapshot();
        assertEquals(0, snapshot.totalValue().compareTo(new BigDecimal("2200")));
        assertEquals(0, snapshot.totalProfitLoss().compareTo(new BigDecimal("200")));
        assertEquals("10.0000", snapshot.totalProfitLossPercent().toPlainString());
        assertEquals(List.of(DeltaDirection.INCREASED), deltas);

        service.replacePositions(List.of(Position.of("p2", "AAPL", "1", "100")));
        loop.runPending();
        assertEquals(Set.of(AAPL), session.upstreamTickers());
        assertEquals("Technology", service.sectorBreakdown().get(0).sector());
    }

    @Test
    void testPortfolioAndConsumerShareTicker() {
        FakeSession session = startAndOpen();
        PriceConsumer view = service.openConsumer("view");
        view.subscribe("TSLA");
        service.replacePositions(List.of(Position.of("p1", "TSLA", "10", "200")));
        loop.runPending();

        service.replacePositions(List.of());
        loop.runPending();

        assertEquals(Set.of(TSLA), session.upstreamTickers(), "view still holds TSLA");
        assertEquals(1, session.sent().size());
    }

    @Test
    @DisplayName("A call made from a listener on the loop applies before queued work")
    void testLoopThreadCallsApplyInline() {
        PriceConsumer follower = service.openConsumer("follower");
        List<Set<Ticker>> seenInListener = new ArrayList<>();
        service.onPriceUpdate(tick -> {
            follower.subscribe(Set.of(MSFT));
            seenInListener.add(service.status().activeTickers());
        });

        service.publishTick(PriceTick.of("AAPL", "185", 1L));
        loop.runPending();

        assertEquals(List.of(Set.of(MSFT)), seenInListener);
    }

    @Test
    void testDuplicatePositionIdsRejectedSynchronously() {
        List<Position> dupes = List.of(Position.of("p1", "AAPL", "1", "100"), Position.of("p1", "MSFT", "1", "100"));

        assertThrows(IllegalArgumentException.class, () -> service.replacePositions(dupes));
        loop.runPending();
        assertEquals(0L, service.currentSnapshot().version());
    }

    @Test
    void testPublishTickFeedsCacheAndListeners() {
        List<PriceTick> all = new ArrayList<>();
        service.onPriceUpdate(all::add);

        service.publishTick(PriceTick.of("NVDA", "900", 10L));
        service.publishTick(PriceTick.of("NVDA", "899", 9L));
        loop.runPending();

        assertEquals(1, all.size());
        assertEquals(1, service.cachedPrices().size());
        assertEquals(Set.of(Ticker.of("NVDA")), service.status().cachedTickers());
    }

    @Test
    void testInterestBeforeConnectIsSentOnOpen() {
        PriceConsumer a = service.openConsumer("a");
        a.replaceInterest(Ticker.setOf(List.of("AAPL", "MSFT")));
        loop.runPending();
        assertEquals(ConnectivityState.CONNECTING, service.getConnectivity());

        FakeSession session = startAndOpen();

        assertEquals(Set.of(AAPL, MSFT), session.upstreamTickers());
        assertEquals(Set.of(AAPL, MSFT), service.status().upstreamTickers());
        assertEquals(1, service.status().consumers());
    }
}
