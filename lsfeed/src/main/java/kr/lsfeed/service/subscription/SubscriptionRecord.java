package kr.lsfeed.service.subscription;

import kr.lsfeed.domain.stream.Envelope;
import kr.lsfeed.domain.stream.SubscriptionKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One desired subscription: its request template and callbacks in registration order.
 *
 * Owned by {@link SubscriptionRegistry}; mutated only under the registry lock.
 * Survives reconnects.
 */
public final class SubscriptionRecord {

    private final SubscriptionKey key;
    private final Envelope request;
    private final List<StreamCallback> callbacks = new ArrayList<>();
    private final Instant subscribedAt;
    private volatile Instant lastDeliveredAt;

    SubscriptionRecord(SubscriptionKey key, Envelope request, StreamCallback callback, Instant subscribedAt) {
        this.key = key;
        this.request = request;
        this.subscribedAt = subscribedAt;
        this.callbacks.add(callback);
    }

    public SubscriptionKey getKey() {
        return key;
    }

    public Envelope getRequest() {
        return request;
    }

    /**
     * Snapshot of the callbacks, in registration order.
     */
    public List<StreamCallback> getCallbacks() {
        return List.copyOf(callbacks);
    }

    public Instant getSubscribedAt() {
        return subscribedAt;
    }

    /**
     * @return time of the last routed message, or null if none yet
     */
    public Instant getLastDeliveredAt() {
        return lastDeliveredAt;
    }

    /**
     * @return false if the callback (by identity) was already registered
     */
    boolean addCallback(StreamCallback callback) {
        if (contains(callback)) {
            return false;
        }
        callbacks.add(callback);
        return true;
    }

    boolean removeCallback(StreamCallback callback) {
        for (int i = 0; i < callbacks.size(); i++) {
            if (callbacks.get(i) == callback) {
                callbacks.remove(i);
                return true;
            }
        }
        return false;
    }

    boolean contains(StreamCallback callback) {
        for (StreamCallback c : callbacks) {
            if (c == callback) return true;
        }
        return false;
    }

    boolean isEmpty() {
        return callbacks.isEmpty();
    }

    void markDelivered(Instant at) {
        this.lastDeliveredAt = at;
    }

    @Override
    public String toString() {
        return "SubscriptionRecord{" + key + ", callbacks=" + callbacks.size() + "}";
    }
}
