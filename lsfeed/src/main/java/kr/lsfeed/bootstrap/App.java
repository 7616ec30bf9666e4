package kr.lsfeed.bootstrap;

import io.undertow.Handlers;
import io.undertow.Undertow;
import kr.lsfeed.config.StreamConfig;
import kr.lsfeed.domain.stream.TradeTick;
import kr.lsfeed.domain.vi.ViState;
import kr.lsfeed.infrastructure.stream.codec.EnvelopeCodec;
import kr.lsfeed.infrastructure.stream.metrics.PrometheusMetricsHandler;
import kr.lsfeed.infrastructure.stream.metrics.PrometheusStreamMetrics;
import kr.lsfeed.infrastructure.stream.session.SessionEvent;
import kr.lsfeed.infrastructure.stream.session.SessionListener;
import kr.lsfeed.infrastructure.stream.session.SessionState;
import kr.lsfeed.infrastructure.stream.session.StreamSession;
import kr.lsfeed.infrastructure.stream.transport.WebSocketTransport;
import kr.lsfeed.service.order.OrderLifecycleMonitor;
import kr.lsfeed.service.subscription.SubscriptionRegistry;
import kr.lsfeed.service.vi.MarketDirectory;
import kr.lsfeed.service.vi.ViCascadeController;
import kr.lsfeed.service.vi.ViObserver;
import kr.lsfeed.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Process root: one session, one registry, one VI controller and one order monitor,
 * wired together and stopped in reverse order on shutdown.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== LS feed client starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        StreamConfig config = StreamConfig.fromEnv();
        try {
            config.validate();
        } catch (IllegalStateException e) {
            log.error("Startup aborted: {}", e.getMessage());
            System.exit(1);
            return;
        }
        log.info("Endpoint {} (token {}), max subscriptions {}, VI grace {}s",
            config.endpoint(), config.maskedToken(), config.maxSubscriptions(),
            config.viUnsubscribeGrace().getSeconds());

        // ═══════════════════════════════════════════════════════════════
        // Stock master
        // ═══════════════════════════════════════════════════════════════
        MarketDirectory directory = new MarketDirectory(config.defaultMarket());
        String marketFile = Env.get("VI_MARKET_FILE", "");
        if (marketFile.isBlank()) {
            log.warn("VI_MARKET_FILE not set, VI symbols default to {}", config.defaultMarket());
        } else {
            try {
                int count = directory.load(Path.of(marketFile));
                log.info("✓ Stock master {} ({} symbols)", marketFile, count);
            } catch (IOException e) {
                log.error("Startup aborted: cannot read stock master {}: {}", marketFile, e.getMessage());
                System.exit(1);
                return;
            }
        }

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusStreamMetrics metrics = new PrometheusStreamMetrics();
        Undertow metricsServer = null;
        if (config.metricsPort() > 0) {
            metricsServer = Undertow.builder()
                .addHttpListener(config.metricsPort(), "0.0.0.0")
                .setHandler(Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
                .build();
            metricsServer.start();
            log.info("✓ Metrics on http://0.0.0.0:{}/metrics", config.metricsPort());
        }

        // ═══════════════════════════════════════════════════════════════
        // Streaming stack
        // ═══════════════════════════════════════════════════════════════
        Clock clock = Clock.systemDefaultZone();
        EnvelopeCodec codec = new EnvelopeCodec();
        StreamSession session = new StreamSession(config, new WebSocketTransport(config), metrics);
        SubscriptionRegistry registry = new SubscriptionRegistry(config, session, codec, metrics, clock);
        ViCascadeController viController = new ViCascadeController(
            config, session, registry, codec, directory, metrics, clock, null);
        OrderLifecycleMonitor orderMonitor = new OrderLifecycleMonitor(registry, codec);

        CountDownLatch terminated = new CountDownLatch(1);
        session.addListener(new ExhaustionWatcher(terminated));
        viController.addObserver(new LoggingViObserver());
        orderMonitor.addListener((type, event) -> log.info("[ORDER] {} {} {} {}@{}",
            type, event.orderNo(), event.instrumentName(), event.executedQuantity(), event.executedPrice()));

        registry.start();
        viController.start();
        if (Env.getBool("ORDER_MONITOR_ENABLED", true)) {
            orderMonitor.start();
        }

        Undertow server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            orderMonitor.stop();
            viController.close();
            session.close();
            registry.stop();
            if (server != null) {
                server.stop();
            }
            terminated.countDown();
            log.info("Shutdown complete");
        }, "shutdown"));

        session.start().whenComplete((v, error) -> {
            if (error == null) {
                log.info("✓ Streaming session connected");
            }
        });

        terminated.await();
        if (session.getState() == SessionState.ERROR) {
            System.exit(2);
        }
    }

    /**
     * Logs VI transitions and the trades that follow them.
     */
    private static final class LoggingViObserver implements ViObserver {

        @Override
        public void onActivated(String symbol, ViState state) {
            log.info("[VI] ▲ {} {} trigger={} static={} dynamic={}", symbol, state.type(),
                state.triggerPrice(), state.staticBasePrice(), state.dynamicBasePrice());
        }

        @Override
        public void onReleased(String symbol, ViState state) {
            log.info("[VI] ▼ {} released after {}s", symbol, state.durationSeconds());
        }

        @Override
        public void onTrade(String symbol, TradeTick tick) {
            log.info("[VI] {} price={} ({}{}, {}%) vol={} strength={}", symbol, tick.price(),
                tick.sign(), tick.change(), tick.changeRate(), tick.tradeVolume(), tick.tradeStrength());
        }
    }

    /**
     * Releases the main thread once reconnect attempts are exhausted.
     */
    private static final class ExhaustionWatcher implements SessionListener {
        private final CountDownLatch terminated;

        ExhaustionWatcher(CountDownLatch terminated) {
            this.terminated = terminated;
        }

        @Override
        public void onSessionEvent(SessionEvent event) {
            if (event.type() == SessionEvent.Type.EXHAUSTED) {
                log.error("Streaming session gave up: {}", event.reason());
                terminated.countDown();
            }
        }
    }
}
