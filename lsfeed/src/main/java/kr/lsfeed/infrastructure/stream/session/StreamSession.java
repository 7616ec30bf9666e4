package kr.lsfeed.infrastructure.stream.session;

import kr.lsfeed.config.StreamConfig;
import kr.lsfeed.infrastructure.stream.common.ReconnectionPolicy;
import kr.lsfeed.infrastructure.stream.data.NotConnectedException;
import kr.lsfeed.infrastructure.stream.data.StreamConnectionException;
import kr.lsfeed.infrastructure.stream.metrics.StreamMetrics;
import kr.lsfeed.infrastructure.stream.transport.StreamTransport;
import kr.lsfeed.infrastructure.stream.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Streaming session: a transport wrapped in a connection state machine with
 * exponential-backoff reconnection.
 *
 * This is the only component that retries. Everything above it reacts to
 * {@code READY} (first connection) and {@code RECONNECTED} (any later one).
 *
 * All state transitions run on one scheduler thread; listeners receive session
 * events on that thread and must not block it.
 */
public class StreamSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private static final long STOP_TIMEOUT_SECONDS = 10;

    private final StreamConfig config;
    private final StreamTransport transport;
    private final ReconnectionPolicy policy;
    private final StreamMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService executor;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile String token;
    private volatile Thread sessionThread;

    // Session-thread only
    private boolean everConnected = false;
    private ScheduledFuture<?> reconnectTask;
    private CompletableFuture<Void> startFuture = new CompletableFuture<>();

    public StreamSession(StreamConfig config, StreamTransport transport, StreamMetrics metrics) {
        this(config, transport, ReconnectionPolicy.forStream(config), metrics, Clock.systemUTC());
    }

    public StreamSession(StreamConfig config, StreamTransport transport, ReconnectionPolicy policy,
                         StreamMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.metrics = metrics == null ? StreamMetrics.NONE : metrics;
        this.clock = clock;
        this.token = config.token();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stream-session");
            t.setDaemon(true);
            sessionThread = t;
            return t;
        });
        this.transport.setListener(new TransportEvents());
    }

    // ════════════════════════════════════════════════════════════════════════
    // PUBLIC API
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Begin connecting. Accepted from DISCONNECTED, CLOSED and ERROR; ignored otherwise.
     *
     * @return future completed when the session first reaches CONNECTED, or exceptionally
     *         when reconnect attempts are exhausted or the session is stopped first
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<CompletableFuture<Void>> result = new CompletableFuture<>();
        executor.execute(() -> {
            if (!state.canStart()) {
                log.debug("[SESSION] start() ignored in state {}", state);
                result.complete(state == SessionState.CONNECTED
                    ? CompletableFuture.completedFuture(null) : startFuture);
                return;
            }
            log.info("[SESSION] Starting (endpoint={}, token={})", config.endpoint(), maskedToken());
            if (startFuture.isDone()) {
                startFuture = new CompletableFuture<>();
            }
            policy.reset();
            result.complete(startFuture);
            connect();
        });
        return result.thenCompose(f -> f);
    }

    /**
     * Stop reconnecting and close the transport. Idempotent; blocks until the session
     * is CLOSED unless called from the session thread itself.
     */
    public void stop() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                doStop();
            } finally {
                done.complete(null);
            }
        });
        if (Thread.currentThread() == sessionThread) {
            return;
        }
        try {
            done.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[SESSION] stop() did not complete cleanly: {}", e.getMessage());
        }
    }

    /**
     * Stop and release the session thread. The session cannot be started again.
     */
    @Override
    public void close() {
        if (executor.isShutdown()) {
            return;
        }
        stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Send one frame. Frames are not buffered across disconnects.
     *
     * @return future failing with {@link NotConnectedException} unless the session is CONNECTED
     */
    public CompletableFuture<Void> send(String frame) {
        SessionState current = state;
        if (!current.canSend()) {
            return CompletableFuture.failedFuture(
                new NotConnectedException(current.name(), "Session is not connected"));
        }
        return transport.send(frame);
    }

    public SessionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == SessionState.CONNECTED;
    }

    public String getToken() {
        return token;
    }

    /**
     * Replace the access token. Used on the next handshake and stamped on every
     * request frame sent from now on.
     */
    public void updateToken(String newToken) {
        if (newToken == null || newToken.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
        this.token = newToken;
        log.info("[SESSION] Access token updated ({})", maskedToken());
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // ════════════════════════════════════════════════════════════════════════
    // STATE MACHINE (session thread)
    // ════════════════════════════════════════════════════════════════════════

    private void connect() {
        state = SessionState.CONNECTING;
        reconnectTask = null;
        log.info("[SESSION] Connecting to {} (attempt {})", config.endpoint(), policy.getAttemptCount() + 1);

        CompletableFuture<Void> handshake;
        try {
            handshake = transport.connect(config.endpoint(), token, config.handshakeTimeout());
        } catch (RuntimeException e) {
            handshake = CompletableFuture.failedFuture(e);
        }
        handshake.whenComplete((v, error) -> {
            if (error != null) {
                executor.execute(() -> onHandshakeFailed(error));
            }
        });
    }

    private void onOpened() {
        if (state != SessionState.CONNECTING) {
            log.debug("[SESSION] Ignoring open in state {}", state);
            return;
        }
        state = SessionState.CONNECTED;
        policy.recordSuccess();

        boolean reconnect = everConnected;
        everConnected = true;
        log.info("[SESSION] Connected to {}{}", config.endpoint(), reconnect ? " (reconnect)" : "");

        emit(SessionEvent.of(SessionEvent.Type.OPENED, clock.instant()));
        emit(SessionEvent.of(reconnect ? SessionEvent.Type.RECONNECTED : SessionEvent.Type.READY, clock.instant()));
        startFuture.complete(null);
    }

    private void onHandshakeFailed(Throwable error) {
        if (state != SessionState.CONNECTING) {
            log.debug("[SESSION] Ignoring handshake failure in state {}", state);
            return;
        }
        Throwable cause = error instanceof java.util.concurrent.CompletionException && error.getCause() != null
            ? error.getCause() : error;
        state = SessionState.ERROR;
        log.warn("[SESSION] Handshake failed: {}", cause.getMessage());

        Duration delay = planRetry();
        emit(SessionEvent.error(clock.instant(), cause, policy.getAttemptCount(), delay));
        if (delay == null) {
            exhaust();
        }
    }

    private void onTransportError(Throwable cause) {
        if (state != SessionState.CONNECTED && state != SessionState.CONNECTING) {
            return;
        }
        state = SessionState.ERROR;
        log.warn("[SESSION] Transport error: {}", cause.getMessage());
        emit(SessionEvent.error(clock.instant(), cause, policy.getAttemptCount(), null));
    }

    private void onTransportClosed(int code, String reason) {
        if (state == SessionState.CLOSING || state == SessionState.CLOSED
                || state == SessionState.DISCONNECTED || reconnectTask != null
                || (state == SessionState.ERROR && policy.isCircuitOpen())) {
            log.debug("[SESSION] Ignoring close {} in state {}", code, state);
            return;
        }
        log.warn("[SESSION] Connection closed unexpectedly: {} {}", code, reason);
        state = SessionState.ERROR;

        Duration delay = planRetry();
        emit(SessionEvent.closed(clock.instant(), code, reason, policy.getAttemptCount(), delay, false));
        if (delay == null) {
            exhaust();
        }
    }

    /**
     * Schedule the next connect if the policy allows it.
     *
     * @return the backoff delay, or null when attempts are exhausted
     */
    private Duration planRetry() {
        if (!policy.shouldRetry()) {
            return null;
        }
        Duration delay = policy.getNextDelay();
        policy.recordFailure();
        int attempt = policy.getAttemptCount();

        state = SessionState.CONNECTING;
        metrics.recordReconnectAttempt(attempt, delay);
        log.info("[SESSION] Reconnecting in {}ms (attempt {}/{})",
            delay.toMillis(), attempt, policy.getMaxAttempts());

        reconnectTask = executor.schedule(() -> {
            if (state == SessionState.CONNECTING) {
                connect();
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return delay;
    }

    private void exhaust() {
        state = SessionState.ERROR;
        int attempts = policy.getAttemptCount();
        log.error("[SESSION] Giving up after {} reconnect attempts", attempts);
        emit(SessionEvent.exhausted(clock.instant(), attempts));
        startFuture.completeExceptionally(new StreamConnectionException(config.endpoint().toString(),
            "Reconnect attempts exhausted after " + attempts + " tries"));
    }

    private void doStop() {
        if (state == SessionState.CLOSED || state == SessionState.DISCONNECTED) {
            log.debug("[SESSION] stop() ignored in state {}", state);
            return;
        }
        log.info("[SESSION] Stopping (state={})", state);
        state = SessionState.CLOSING;

        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("[SESSION] Transport close failed: {}", e.getMessage());
        }

        state = SessionState.CLOSED;
        emit(SessionEvent.closed(clock.instant(), 1000, "stopped", 0, null, true));
        if (!startFuture.isDone()) {
            startFuture.completeExceptionally(new StreamConnectionException(config.endpoint().toString(),
                "Session stopped before connecting"));
        }
    }

    private void emit(SessionEvent event) {
        metrics.recordSessionEvent(event.type());
        for (SessionListener listener : listeners) {
            try {
                listener.onSessionEvent(event);
            } catch (Exception e) {
                log.error("[SESSION] Listener {} failed on {}", listener.getClass().getSimpleName(), event.type(), e);
            }
        }
    }

    private String maskedToken() {
        String t = token;
        if (t == null || t.length() <= 4) return "***";
        return t.substring(0, 4) + "***";
    }

    /**
     * Bridges transport callbacks onto the session thread. Frames are passed
     * straight through on the reader thread so listeners can apply backpressure.
     */
    private final class TransportEvents implements TransportListener {

        @Override
        public void onOpened() {
            executor.execute(StreamSession.this::onOpened);
        }

        @Override
        public void onMessage(String frame) {
            SessionState current = state;
            if (current == SessionState.CLOSING || current == SessionState.CLOSED) {
                return;
            }
            for (SessionListener listener : listeners) {
                try {
                    listener.onMessage(frame);
                } catch (Exception e) {
                    log.error("[SESSION] Listener {} failed on inbound frame",
                        listener.getClass().getSimpleName(), e);
                }
            }
        }

        @Override
        public void onError(Throwable cause) {
            executor.execute(() -> onTransportError(cause));
        }

        @Override
        public void onClosed(int code, String reason) {
            executor.execute(() -> onTransportClosed(code, reason));
        }
    }
}
