package kr.lsfeed.infrastructure.stream.common;

import kr.lsfeed.config.StreamConfig;

import java.time.Duration;

/**
 * Exponential backoff for reconnecting the streaming session.
 *
 * The delay before retry {@code n} (zero-based) is {@code min(initialDelay * multiplier^n, maxDelay)}.
 * After {@code maxAttempts} consecutive failures the circuit opens and
 * {@link #shouldRetry()} returns false until {@link #recordSuccess()} or {@link #reset()}.
 *
 * Usage:
 * <pre>
 * if (policy.shouldRetry()) {
 *     Duration delay = policy.getNextDelay();
 *     policy.recordFailure();
 *     scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                              double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return true while fewer than maxAttempts consecutive failures have been recorded
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt, given the failures recorded so far.
     */
    public synchronized Duration getNextDelay() {
        return delayForAttempt(attemptCount);
    }

    /**
     * Delay for a zero-based attempt number, capped at maxDelay.
     */
    public Duration delayForAttempt(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Record a failed attempt. Opens the circuit once maxAttempts is reached.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a successful connection. Resets the attempt count and closes the circuit.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        circuitOpen = false;
    }

    /**
     * Manual reset, e.g. when the session is started again after exhaustion.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return number of failed attempts since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy for the streaming session built from its configuration
     * (base and cap delay, max attempts, doubling backoff).
     */
    public static ReconnectionPolicy forStream(StreamConfig config) {
        return builder()
            .initialDelay(config.reconnectBaseDelay())
            .maxDelay(config.reconnectMaxDelay())
            .multiplier(2.0)
            .maxAttempts(config.maxReconnectAttempts())
            .build();
    }

    /**
     * Builder for ReconnectionPolicy. Defaults: 5s base, 30s cap, x2, 5 attempts.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
