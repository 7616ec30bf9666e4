package kr.lsfeed.service.subscription;

import kr.lsfeed.domain.stream.StreamMessage;
import kr.lsfeed.infrastructure.stream.data.StreamSubscriptionException;

/**
 * Consumer of routed messages for one subscription.
 *
 * Runs on the router thread: implementations must return quickly or hand work
 * off to their own executor.
 */
@FunctionalInterface
public interface StreamCallback {

    void onMessage(StreamMessage message);

    /**
     * Called when the broker rejects the subscription this callback is registered on.
     */
    default void onError(StreamSubscriptionException error) {
    }
}
