package kr.lsfeed.infrastructure.stream.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import kr.lsfeed.domain.stream.ChannelFamily;
import kr.lsfeed.infrastructure.stream.session.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of StreamMetrics.
 *
 * Key Metrics:
 * - lsfeed_session_events_total{event} - session lifecycle events
 * - lsfeed_reconnect_attempts_total / lsfeed_reconnect_delay_seconds - backoff behaviour
 * - lsfeed_inbound_messages_total{family} - routed frames per channel family
 * - lsfeed_protocol_errors_total - dropped malformed frames
 * - lsfeed_callback_failures_total{channel} - contained callback exceptions
 * - lsfeed_subscriptions_live - size of the desired subscription set
 * - lsfeed_vi_events_total{kind}, lsfeed_vi_duration_seconds - VI activations and releases
 * - lsfeed_vi_pending_unsubscribes - derived subscriptions waiting for their grace period
 */
public class PrometheusStreamMetrics implements StreamMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusStreamMetrics.class);

    private final CollectorRegistry registry;

    private final Counter sessionEvents;
    private final Counter reconnectAttempts;
    private final Histogram reconnectDelay;
    private final Counter inboundMessages;
    private final Counter protocolErrors;
    private final Counter callbackFailures;
    private final Counter subscriptionRejections;
    private final Gauge liveSubscriptions;
    private final Counter viEvents;
    private final Histogram viDuration;
    private final Gauge pendingViUnsubscribes;

    public PrometheusStreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.sessionEvents = Counter.build()
            .name("lsfeed_session_events_total")
            .help("Session lifecycle events")
            .labelNames("event")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("lsfeed_reconnect_attempts_total")
            .help("Scheduled reconnect attempts")
            .register(registry);

        this.reconnectDelay = Histogram.build()
            .name("lsfeed_reconnect_delay_seconds")
            .help("Backoff delay before each reconnect attempt")
            .buckets(1, 5, 10, 20, 30, 60, 120)
            .register(registry);

        this.inboundMessages = Counter.build()
            .name("lsfeed_inbound_messages_total")
            .help("Inbound frames routed, by channel family")
            .labelNames("family")
            .register(registry);

        this.protocolErrors = Counter.build()
            .name("lsfeed_protocol_errors_total")
            .help("Inbound frames dropped as malformed")
            .register(registry);

        this.callbackFailures = Counter.build()
            .name("lsfeed_callback_failures_total")
            .help("Application callbacks that threw during dispatch")
            .labelNames("channel")
            .register(registry);

        this.subscriptionRejections = Counter.build()
            .name("lsfeed_subscription_rejections_total")
            .help("Subscriptions rejected by the broker or by capacity")
            .labelNames("channel")
            .register(registry);

        this.liveSubscriptions = Gauge.build()
            .name("lsfeed_subscriptions_live")
            .help("Subscriptions in the desired set")
            .register(registry);

        this.viEvents = Counter.build()
            .name("lsfeed_vi_events_total")
            .help("VI state transitions")
            .labelNames("kind")
            .register(registry);

        this.viDuration = Histogram.build()
            .name("lsfeed_vi_duration_seconds")
            .help("Time between VI activation and release")
            .buckets(30, 60, 120, 150, 300, 600)
            .register(registry);

        this.pendingViUnsubscribes = Gauge.build()
            .name("lsfeed_vi_pending_unsubscribes")
            .help("Derived trade subscriptions waiting for their grace period")
            .register(registry);

        log.info("[METRICS] Prometheus stream metrics registered");
    }

    @Override
    public void recordSessionEvent(SessionEvent.Type type) {
        sessionEvents.labels(type.name()).inc();
    }

    @Override
    public void recordReconnectAttempt(int attempt, Duration delay) {
        reconnectAttempts.inc();
        reconnectDelay.observe(delay.toMillis() / 1000.0);
    }

    @Override
    public void recordInboundMessage(ChannelFamily family) {
        inboundMessages.labels(family.name()).inc();
    }

    @Override
    public void recordProtocolError() {
        protocolErrors.inc();
    }

    @Override
    public void recordCallbackFailure(String channel) {
        callbackFailures.labels(channel).inc();
    }

    @Override
    public void recordSubscriptionRejected(String channel) {
        subscriptionRejections.labels(channel).inc();
    }

    @Override
    public void updateLiveSubscriptions(int count) {
        liveSubscriptions.set(count);
    }

    @Override
    public void recordViActivation() {
        viEvents.labels("activated").inc();
    }

    @Override
    public void recordViRelease(Duration duration) {
        viEvents.labels("released").inc();
        if (duration != null && !duration.isNegative()) {
            viDuration.observe(duration.toMillis() / 1000.0);
        }
    }

    @Override
    public void updatePendingViUnsubscribes(int count) {
        pendingViUnsubscribes.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
