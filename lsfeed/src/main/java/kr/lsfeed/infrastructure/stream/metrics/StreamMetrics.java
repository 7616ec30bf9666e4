package kr.lsfeed.infrastructure.stream.metrics;

import kr.lsfeed.domain.stream.ChannelFamily;
import kr.lsfeed.infrastructure.stream.session.SessionEvent;

import java.time.Duration;

/**
 * Metrics for the streaming session, router and VI cascade.
 *
 * Implementations can publish to Prometheus or any other backend.
 * Calls must be cheap and non-blocking: they run on the router and session threads.
 */
public interface StreamMetrics {

    /**
     * Record a session lifecycle event (OPENED, READY, RECONNECTED, ...).
     */
    void recordSessionEvent(SessionEvent.Type type);

    /**
     * Record a scheduled reconnect.
     *
     * @param attempt 1-based attempt number since the last successful connection
     * @param delay   backoff delay before the attempt
     */
    void recordReconnectAttempt(int attempt, Duration delay);

    void recordInboundMessage(ChannelFamily family);

    /**
     * Record an inbound frame dropped because it was not a valid envelope.
     */
    void recordProtocolError();

    /**
     * Record an application callback that threw during dispatch.
     *
     * @param channel channel code of the message being dispatched
     */
    void recordCallbackFailure(String channel);

    void recordSubscriptionRejected(String channel);

    void updateLiveSubscriptions(int count);

    void recordViActivation();

    void recordViRelease(Duration duration);

    void updatePendingViUnsubscribes(int count);

    /**
     * Metrics sink that records nothing. Used when metrics are disabled and in tests.
     */
    StreamMetrics NONE = new StreamMetrics() {
        @Override public void recordSessionEvent(SessionEvent.Type type) {}
        @Override public void recordReconnectAttempt(int attempt, Duration delay) {}
        @Override public void recordInboundMessage(ChannelFamily family) {}
        @Override public void recordProtocolError() {}
        @Override public void recordCallbackFailure(String channel) {}
        @Override public void recordSubscriptionRejected(String channel) {}
        @Override public void updateLiveSubscriptions(int count) {}
        @Override public void recordViActivation() {}
        @Override public void recordViRelease(Duration duration) {}
        @Override public void updatePendingViUnsubscribes(int count) {}
    };
}
