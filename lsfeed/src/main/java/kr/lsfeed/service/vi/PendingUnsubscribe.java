package kr.lsfeed.service.vi;

import kr.lsfeed.domain.stream.SubscriptionKey;

import java.time.Instant;
import java.util.Comparator;

/**
 * Derived trade subscription waiting for its grace period to end.
 */
public record PendingUnsubscribe(
    SubscriptionKey key,
    String symbol,
    Instant scheduledAt,
    Instant fireAt
) {
    public static final Comparator<PendingUnsubscribe> BY_DEADLINE =
        Comparator.comparing(PendingUnsubscribe::fireAt).thenComparing(PendingUnsubscribe::symbol);

    public boolean isDue(Instant now) {
        return !fireAt.isAfter(now);
    }
}
