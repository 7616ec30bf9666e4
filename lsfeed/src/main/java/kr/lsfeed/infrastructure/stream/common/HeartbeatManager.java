package kr.lsfeed.infrastructure.stream.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keepalive for one streaming connection.
 *
 * Sends a ping every {@code pingInterval}; if no pong is recorded within
 * {@code timeout} of a ping, the connection is reported unhealthy through the
 * health callback. The callback fires only on a change of health.
 *
 * A manager is bound to a single connection: once stopped it cannot be restarted.
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String name;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPingTime;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String name, Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Consumer<Boolean> healthCallback) {
        this.name = name;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start pinging. The first ping is sent after one interval.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[HEARTBEAT:{}] Already running", name);
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Heartbeat " + name + " was stopped and cannot be restarted");
        }

        log.debug("[HEARTBEAT:{}] Starting (interval={}ms, timeout={}ms)",
            name, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        healthy = true;

        pingTask = scheduler.scheduleAtFixedRate(this::sendPing,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop probing and release the scheduler thread.
     */
    public synchronized void stop() {
        if (!running && scheduler.isShutdown()) {
            return;
        }

        running = false;
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
        scheduler.shutdownNow();
        log.debug("[HEARTBEAT:{}] Stopped", name);
    }

    /**
     * Record a pong. Cancels the pending timeout check and restores health.
     */
    public synchronized void recordPong() {
        lastPongTime = Instant.now();

        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        if (!healthy) {
            log.info("[HEARTBEAT:{}] Pong received, connection healthy again", name);
            setHealth(true);
        }
    }

    public boolean isHealthy() {
        return healthy;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return time since the last pong, or null if none was received yet
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        return lastPong == null ? null : Duration.between(lastPong, Instant.now());
    }

    private synchronized void sendPing() {
        if (!running) {
            return;
        }

        try {
            pingFunction.run();
        } catch (Exception e) {
            log.warn("[HEARTBEAT:{}] Ping failed: {}", name, e.getMessage());
            setHealth(false);
            return;
        }
        lastPingTime = Instant.now();
        log.trace("[HEARTBEAT:{}] Ping sent", name);

        // One outstanding timeout check at a time, measured from the oldest unanswered ping
        if (timeoutTask == null) {
            Instant pingedAt = lastPingTime;
            timeoutTask = scheduler.schedule(() -> checkTimeout(pingedAt),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private synchronized void checkTimeout(Instant pingedAt) {
        timeoutTask = null;
        if (!running) {
            return;
        }
        Instant lastPong = lastPongTime;
        if (lastPong != null && !lastPong.isBefore(pingedAt)) {
            return;
        }
        log.warn("[HEARTBEAT:{}] No pong within {}ms", name, timeout.toMillis());
        setHealth(false);
    }

    private void setHealth(boolean newHealth) {
        if (healthy == newHealth) {
            return;
        }
        healthy = newHealth;
        if (healthCallback != null) {
            try {
                healthCallback.accept(newHealth);
            } catch (Exception e) {
                log.error("[HEARTBEAT:{}] Health callback threw exception", name, e);
            }
        }
    }
}
