package kr.lsfeed.service.order;

import kr.lsfeed.domain.stream.OrderEvent;
import kr.lsfeed.domain.stream.OrderEventType;
import kr.lsfeed.domain.stream.StreamMessage;
import kr.lsfeed.domain.stream.SubscriptionKey;
import kr.lsfeed.infrastructure.stream.codec.EnvelopeCodec;
import kr.lsfeed.infrastructure.stream.data.StreamProtocolException;
import kr.lsfeed.infrastructure.stream.data.StreamSubscriptionException;
import kr.lsfeed.service.subscription.StreamCallback;
import kr.lsfeed.service.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Follows the account's order lifecycle channels (accepted, filled, amended,
 * cancelled, rejected) and fans each event out to listeners.
 *
 * Account channels take an empty routing key and the account tr_type pair (1/2).
 */
public class OrderLifecycleMonitor {
    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleMonitor.class);

    private final SubscriptionRegistry registry;
    private final EnvelopeCodec codec;
    private final List<OrderEventListener> listeners = new CopyOnWriteArrayList<>();
    private final StreamCallback callback = new OrderCallback();

    private volatile boolean started = false;

    public OrderLifecycleMonitor(SubscriptionRegistry registry, EnvelopeCodec codec) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        for (OrderEventType type : OrderEventType.values()) {
            registry.subscribe(keyOf(type), callback);
        }
        log.info("[ORDER] Monitoring {} order channels", OrderEventType.values().length);
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        for (OrderEventType type : OrderEventType.values()) {
            registry.unsubscribe(keyOf(type), callback);
        }
        log.info("[ORDER] Monitoring stopped");
    }

    public boolean isStarted() {
        return started;
    }

    public void addListener(OrderEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(OrderEventListener listener) {
        listeners.remove(listener);
    }

    static SubscriptionKey keyOf(OrderEventType type) {
        return SubscriptionKey.of(type.channel(), "");
    }

    private void handle(StreamMessage message) {
        OrderEventType type = OrderEventType.fromChannel(message.channel()).orElse(null);
        if (type == null) {
            log.warn("[ORDER] Unexpected channel {}", message.channel());
            return;
        }

        OrderEvent event;
        try {
            event = codec.bodyAs(message, OrderEvent.class);
        } catch (StreamProtocolException e) {
            log.warn("[ORDER] Dropping {} frame: {}", type, e.getMessage());
            return;
        }

        log.info("[ORDER] {} ordno={} symbol={} qty={} exec={}@{}", type, event.orderNo(), event.symbol(),
            event.orderQuantityValue(), event.executedQuantityValue(), event.executedPrice());

        for (OrderEventListener listener : listeners) {
            try {
                listener.onOrderEvent(type, event);
            } catch (Exception e) {
                log.error("[ORDER] Listener {} failed on {} ordno={}",
                    listener.getClass().getName(), type, event.orderNo(), e);
            }
        }
    }

    private final class OrderCallback implements StreamCallback {

        @Override
        public void onMessage(StreamMessage message) {
            handle(message);
        }

        @Override
        public void onError(StreamSubscriptionException error) {
            log.error("[ORDER] Subscription rejected for {}: {} {}",
                error.getKey(), error.getResponseCode(), error.getResponseMessage());
        }
    }
}
