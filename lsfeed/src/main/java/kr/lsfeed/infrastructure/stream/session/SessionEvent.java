package kr.lsfeed.infrastructure.stream.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Event emitted by a {@link StreamSession}.
 *
 * @param type       event type
 * @param timestamp  when the session emitted the event
 * @param attempt    reconnect attempt number the event relates to (0 when none)
 * @param retryDelay delay before the next attempt, or null when no retry is scheduled
 * @param closeCode  close code for CLOSED events (0 otherwise)
 * @param reason     close reason or error message, may be null
 * @param cause      failure for ERROR events, may be null
 * @param requested  true for a CLOSED event caused by {@code stop()}
 */
public record SessionEvent(
    Type type,
    Instant timestamp,
    int attempt,
    Duration retryDelay,
    int closeCode,
    String reason,
    Throwable cause,
    boolean requested
) {
    public enum Type {
        OPENED,
        READY,
        RECONNECTED,
        ERROR,
        CLOSED,
        EXHAUSTED
    }

    public static SessionEvent of(Type type, Instant timestamp) {
        return new SessionEvent(type, timestamp, 0, null, 0, null, null, false);
    }

    public static SessionEvent error(Instant timestamp, Throwable cause, int attempt, Duration retryDelay) {
        return new SessionEvent(Type.ERROR, timestamp, attempt, retryDelay, 0,
            cause == null ? null : cause.getMessage(), cause, false);
    }

    public static SessionEvent closed(Instant timestamp, int closeCode, String reason,
                                      int attempt, Duration retryDelay, boolean requested) {
        return new SessionEvent(Type.CLOSED, timestamp, attempt, retryDelay, closeCode, reason, null, requested);
    }

    public static SessionEvent exhausted(Instant timestamp, int attempts) {
        return new SessionEvent(Type.EXHAUSTED, timestamp, attempts, null, 0,
            "Reconnect attempts exhausted after " + attempts + " tries", null, false);
    }

    /**
     * READY or RECONNECTED: a connection is up and subscriptions may be (re)sent.
     */
    public boolean isReady() {
        return type == Type.READY || type == Type.RECONNECTED;
    }
}
