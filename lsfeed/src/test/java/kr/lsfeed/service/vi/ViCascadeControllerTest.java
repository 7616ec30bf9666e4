package kr.lsfeed.service.vi;

import kr.lsfeed.config.StreamConfig;
import kr.lsfeed.domain.stream.Market;
import kr.lsfeed.domain.stream.SubscriptionKey;
import kr.lsfeed.domain.stream.TradeTick;
import kr.lsfeed.domain.vi.ViState;
import kr.lsfeed.domain.vi.ViStatus;
import kr.lsfeed.domain.vi.ViType;
import kr.lsfeed.infrastructure.stream.codec.EnvelopeCodec;
import kr.lsfeed.infrastructure.stream.common.ReconnectionPolicy;
import kr.lsfeed.infrastructure.stream.metrics.StreamMetrics;
import kr.lsfeed.infrastructure.stream.session.StreamSession;
import kr.lsfeed.service.subscription.SubscriptionRegistry;
import kr.lsfeed.support.FakeTransport;
import kr.lsfeed.support.Frames;
import kr.lsfeed.support.MutableClock;
import kr.lsfeed.support.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ViCascadeController.
 *
 * Tests:
 * - Activation subscribes the symbol's trade channel, release schedules teardown
 * - Trades forwarded while active and during the grace period only
 * - Duplicate activations and releases ignored
 * - Re-activation within the grace period cancels the teardown
 * - Market lookup for KOSDAQ symbols and symbols missing from the stock master
 * - Stop removes every subscription the controller created
 * - Teardown timers suspended on stop and re-armed when the session is ready
 * - Observer failures contained
 */
class ViCascadeControllerTest {

    private static final String SAMSUNG = "005930";
    private static final String KAKAO = "035720";
    private static final Duration GRACE = Duration.ofMinutes(3);

    private final FakeTransport transport = new FakeTransport();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T00:15:00Z"));
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final MarketDirectory directory = new MarketDirectory(Market.KOSPI);
    private final RecordingObserver observer = new RecordingObserver();
    private StreamMetrics metrics = StreamMetrics.NONE;

    private StreamSession session;
    private SubscriptionRegistry registry;
    private ViCascadeController controller;

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.close();
        }
        if (session != null) {
            session.close();
        }
    }

    private void create(StreamConfig config) throws Exception {
        session = new StreamSession(config, transport, ReconnectionPolicy.forStream(config), metrics, clock);
        registry = new SubscriptionRegistry(config, session, codec, metrics, clock);
        // Router thread not started: frames dispatch on the delivering thread
        session.addListener(registry);
        session.start().get(2, TimeUnit.SECONDS);

        controller = new ViCascadeController(config, session, registry, codec, directory, metrics, clock, null);
        controller.addObserver(observer);
        controller.start();
    }

    private void create() throws Exception {
        create(TestConfigs.config(100, 5, Duration.ofMillis(20), Duration.ofMillis(100), GRACE));
    }

    // ════════════════════════════════════════════════════════════════════════
    // CASCADE
    // ════════════════════════════════════════════════════════════════════════

    @Test
    void testStartSubscribesViForAllSymbols() throws Exception {
        create();

        assertEquals(List.of("3:VI_:000000"), transport.sentSummary());
        assertTrue(registry.contains(SubscriptionKey.allSymbols("VI_")));
    }

    @Test
    void testFullCascade() throws Exception {
        create();

        transport.deliver(Frames.vi(SAMSUNG, 1));
        assertEquals(List.of("3:VI_:000000", "3:S3_:005930"), transport.sentSummary(),
            "Activation subscribes the trade channel");
        ViState active = controller.getState(SAMSUNG).orElseThrow();
        assertEquals(ViStatus.ACTIVE, active.status());
        assertEquals(ViType.STATIC, active.type());
        assertEquals(new BigDecimal("77600"), active.triggerPrice());
        assertEquals(List.of("activated:005930"), observer.events);

        transport.deliver(Frames.trade("S3_", SAMSUNG, "77600"));
        assertEquals("trade:005930:77600", observer.last());

        clock.advance(Duration.ofSeconds(90));
        transport.deliver(Frames.vi(SAMSUNG, 0));
        ViState released = controller.getState(SAMSUNG).orElseThrow();
        assertEquals(ViStatus.INACTIVE, released.status());
        assertEquals(Duration.ofSeconds(90), released.duration());
        assertEquals("released:005930:90", observer.last());
        assertTrue(controller.getActiveSymbols().isEmpty());
        assertEquals(1, controller.getPendingUnsubscribes().size());
        assertEquals(clock.instant().plus(GRACE), controller.getPendingUnsubscribes().get(0).fireAt());

        clock.advance(Duration.ofSeconds(60));
        transport.deliver(Frames.trade("S3_", SAMSUNG, "78000"));
        assertEquals("trade:005930:78000", observer.last(), "Trades still forwarded during grace");
        assertEquals(0, controller.runDueUnsubscribes(), "Nothing due before the grace period ends");

        clock.advance(Duration.ofSeconds(120));
        assertEquals(1, controller.runDueUnsubscribes());
        assertEquals("4:S3_:005930", transport.sentSummary().get(transport.sentSummary().size() - 1),
            "Trade channel unsubscribed after grace");
        assertFalse(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)));
        assertTrue(controller.getTrackedSymbols().isEmpty());

        int before = observer.events.size();
        transport.deliver(Frames.trade("S3_", SAMSUNG, "78100"));
        assertEquals(before, observer.events.size(), "Trades after teardown are not forwarded");
    }

    @Test
    void testDuplicateEventsIgnored() throws Exception {
        create();

        transport.deliver(Frames.vi(SAMSUNG, 1));
        transport.deliver(Frames.vi(SAMSUNG, 2));
        transport.deliver(Frames.vi(SAMSUNG, 0));
        transport.deliver(Frames.vi(SAMSUNG, 0));

        assertEquals(List.of("activated:005930", "released:005930:0"), observer.events);
        assertEquals(1, transport.sentSummary().stream().filter(s -> s.equals("3:S3_:005930")).count(),
            "One trade subscription per activation");
        assertEquals(1, controller.getPendingUnsubscribes().size());
    }

    @Test
    void testReleaseForUntrackedSymbolIgnored() throws Exception {
        create();

        transport.deliver(Frames.vi(SAMSUNG, 0));

        assertTrue(observer.events.isEmpty());
        assertTrue(controller.getPendingUnsubscribes().isEmpty());
        assertTrue(controller.getState(SAMSUNG).isEmpty());
    }

    @Test
    void testReactivationCancelsTeardown() throws Exception {
        create();
        transport.deliver(Frames.vi(SAMSUNG, 1));
        transport.deliver(Frames.vi(SAMSUNG, 0));
        assertEquals(1, controller.armedTimerCount());

        clock.advance(Duration.ofSeconds(60));
        transport.deliver(Frames.vi(SAMSUNG, 2));

        assertTrue(controller.getPendingUnsubscribes().isEmpty(), "Pending teardown cancelled");
        assertEquals(0, controller.armedTimerCount());
        assertEquals(ViType.DYNAMIC, controller.getState(SAMSUNG).orElseThrow().type());

        clock.advance(GRACE);
        assertEquals(0, controller.runDueUnsubscribes());
        assertTrue(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)), "Trades still followed");
        assertEquals(1, transport.sentSummary().stream().filter(s -> s.equals("3:S3_:005930")).count(),
            "Re-activation reuses the existing subscription");
    }

    @Test
    void testKosdaqSymbolUsesKosdaqChannel() throws Exception {
        directory.register(KAKAO, Market.KOSDAQ);
        create();

        transport.deliver(Frames.vi(KAKAO, 3));
        transport.deliver(Frames.trade("K3_", KAKAO, "51000"));

        assertTrue(registry.contains(SubscriptionKey.of("K3_", KAKAO)));
        assertEquals(Market.KOSDAQ, controller.getState(KAKAO).orElseThrow().market());
        assertEquals("trade:035720:51000", observer.last());
        assertEquals("51000", controller.getLastTrade(KAKAO).map(TradeTick::price).orElse(null));
    }

    @Test
    void testSymbolMissingFromStockMasterIsSkipped() throws Exception {
        directory.registerAll(Map.of(SAMSUNG, Market.KOSPI));
        create();
        transport.clearSent();

        transport.deliver(Frames.vi(KAKAO, 1));

        assertTrue(transport.sentFrames().isEmpty(), "No trade subscription for an unlisted symbol");
        assertFalse(registry.contains(SubscriptionKey.of("S3_", KAKAO)));
        assertFalse(registry.contains(SubscriptionKey.of("K3_", KAKAO)));
        assertTrue(controller.getState(KAKAO).isEmpty(), "Unlisted symbol is not tracked");
        assertTrue(observer.events.isEmpty(), "No activation reported");

        transport.deliver(Frames.vi(SAMSUNG, 1));
        assertTrue(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)), "Listed symbols still cascade");
    }

    @Test
    void testStopRemovesDerivedSubscriptions() throws Exception {
        create();
        transport.deliver(Frames.vi(SAMSUNG, 1));
        directory.register(KAKAO, Market.KOSDAQ);
        transport.deliver(Frames.vi(KAKAO, 1));
        transport.deliver(Frames.vi(KAKAO, 0));
        transport.clearSent();
        int before = observer.events.size();

        controller.stop();

        assertEquals(List.of("4:S3_:005930", "4:K3_:035720", "4:VI_:000000"), transport.sentSummary());
        assertEquals(0, registry.size());
        assertTrue(controller.getTrackedSymbols().isEmpty());
        assertTrue(controller.getPendingUnsubscribes().isEmpty());
        assertEquals(0, controller.armedTimerCount());

        transport.deliver(Frames.vi(SAMSUNG, 1));
        assertEquals(before, observer.events.size(), "No events after stop");
    }

    @Test
    void testSharedTradeKeyKeptForOtherConsumer() throws Exception {
        create();
        List<String> strategyTicks = new CopyOnWriteArrayList<>();
        registry.subscribe(SubscriptionKey.of("S3_", SAMSUNG), message -> strategyTicks.add(message.bodyText("price")));

        transport.deliver(Frames.vi(SAMSUNG, 1));
        transport.deliver(Frames.vi(SAMSUNG, 0));
        clock.advance(GRACE);
        controller.runDueUnsubscribes();

        assertTrue(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)),
            "Teardown removes only the controller's callback");
        assertFalse(transport.sentSummary().contains("4:S3_:005930"));
        transport.deliver(Frames.trade("S3_", SAMSUNG, "77000"));
        assertEquals(List.of("77000"), strategyTicks);
    }

    @Test
    void testCapacityFailureKeepsViActive() throws Exception {
        create(TestConfigs.config(1, 5, Duration.ofMillis(20), Duration.ofMillis(100), GRACE));

        transport.deliver(Frames.vi(SAMSUNG, 1));

        assertTrue(controller.getState(SAMSUNG).orElseThrow().isActive(), "VI is tracked without trades");
        assertFalse(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)));
        assertEquals(List.of("activated:005930"), observer.events);
    }

    // ════════════════════════════════════════════════════════════════════════
    // TIMERS
    // ════════════════════════════════════════════════════════════════════════

    @Test
    void testTimerRemovesSubscriptionAfterGrace() throws Exception {
        create(TestConfigs.config(100, 5, Duration.ofMillis(20), Duration.ofMillis(100), Duration.ofMillis(100)));
        transport.deliver(Frames.vi(SAMSUNG, 1));
        transport.deliver(Frames.vi(SAMSUNG, 0));

        clock.advance(Duration.ofMillis(100));

        assertTrue(transport.awaitSent(f -> f.contains("\"tr_type\":\"4\""), 1, 2, TimeUnit.SECONDS),
            "Timer should send the unsubscribe");
        assertFalse(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)));
        assertTrue(controller.getTrackedSymbols().isEmpty());
    }

    @Test
    void testTimersSuspendedOnStopAndRearmedOnReady() throws Exception {
        create();
        transport.deliver(Frames.vi(SAMSUNG, 1));
        transport.deliver(Frames.vi(SAMSUNG, 0));
        assertEquals(1, controller.armedTimerCount());

        session.stop();
        assertEquals(0, controller.armedTimerCount(), "Stop-requested close suspends timers");
        assertEquals(1, controller.getPendingUnsubscribes().size(), "Pending teardown is kept");

        session.start().get(2, TimeUnit.SECONDS);
        assertEquals(1, controller.armedTimerCount(), "Ready session re-arms timers");
    }

    @Test
    void testUnexpectedDropKeepsTimers() throws Exception {
        create();
        transport.deliver(Frames.vi(SAMSUNG, 1));
        transport.deliver(Frames.vi(SAMSUNG, 0));

        transport.drop("network blip");
        assertTrue(transport.awaitSent(f -> f.contains("VI_"), 2, 2, TimeUnit.SECONDS), "Replay after reconnect");

        assertEquals(1, controller.armedTimerCount());
        assertTrue(registry.contains(SubscriptionKey.of("S3_", SAMSUNG)), "Trade subscription replayed");
    }

    @Test
    void testObserverFailureContained() throws Exception {
        metrics = mock(StreamMetrics.class);
        create();
        controller.addObserver(new ViObserver() {
            @Override
            public void onActivated(String symbol, ViState state) {
                throw new IllegalStateException("observer bug");
            }
        });
        RecordingObserver late = new RecordingObserver();
        controller.addObserver(late);

        transport.deliver(Frames.vi(SAMSUNG, 1));

        assertEquals(List.of("activated:005930"), late.events, "Observers after a failing one still run");
        verify(metrics).recordCallbackFailure("VI_");
        verify(metrics).recordViActivation();
    }

    /**
     * Records observer calls as compact strings.
     */
    private static final class RecordingObserver implements ViObserver {
        final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public void onActivated(String symbol, ViState state) {
            events.add("activated:" + symbol);
        }

        @Override
        public void onReleased(String symbol, ViState state) {
            events.add("released:" + symbol + ":" + state.durationSeconds());
        }

        @Override
        public void onTrade(String symbol, TradeTick tick) {
            events.add("trade:" + symbol + ":" + tick.price());
        }

        String last() {
            return events.get(events.size() - 1);
        }
    }
}
