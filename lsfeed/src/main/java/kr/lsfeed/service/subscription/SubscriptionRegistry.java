package kr.lsfeed.service.subscription;

import kr.lsfeed.config.StreamConfig;
import kr.lsfeed.domain.stream.ChannelFamily;
import kr.lsfeed.domain.stream.Envelope;
import kr.lsfeed.domain.stream.StreamMessage;
import kr.lsfeed.domain.stream.SubscriptionKey;
import kr.lsfeed.infrastructure.stream.codec.EnvelopeCodec;
import kr.lsfeed.infrastructure.stream.data.CallbackException;
import kr.lsfeed.infrastructure.stream.data.StreamProtocolException;
import kr.lsfeed.infrastructure.stream.data.StreamSubscriptionException;
import kr.lsfeed.infrastructure.stream.metrics.StreamMetrics;
import kr.lsfeed.infrastructure.stream.session.SessionEvent;
import kr.lsfeed.infrastructure.stream.session.SessionListener;
import kr.lsfeed.infrastructure.stream.session.StreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Authoritative set of desired subscriptions and the router for inbound frames.
 *
 * Desired state:
 * - subscribe/unsubscribe mutate the map under one lock and, when the wire is ready,
 *   send the request while still holding it
 * - on READY/RECONNECTED every record is replayed under the same lock before the wire
 *   is marked ready, so replay frames reach the writer queue ahead of any new request
 * - records survive disconnects; only unsubscribe removes them
 *
 * Routing: one router thread consumes a bounded inbound queue. Each frame goes to the
 * exact (channel, key) record, then to all-symbols records of the same channel family,
 * and to the default handlers only when no record matched. Callbacks run outside the
 * lock; a callback that throws is logged and does not affect the others.
 */
public class SubscriptionRegistry implements SessionListener {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final StreamSession session;
    private final EnvelopeCodec codec;
    private final StreamMetrics metrics;
    private final Clock clock;
    private final int maxSubscriptions;

    private final Object lock = new Object();
    private final Map<SubscriptionKey, SubscriptionRecord> records = new LinkedHashMap<>();
    private final List<StreamCallback> defaultHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<StreamSubscriptionException>> errorHandlers = new CopyOnWriteArrayList<>();

    private final BlockingQueue<String> inbound;
    private volatile Thread router;
    private volatile boolean running = false;
    private volatile boolean wireReady = false;

    public SubscriptionRegistry(StreamConfig config, StreamSession session, EnvelopeCodec codec,
                                StreamMetrics metrics, Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = metrics == null ? StreamMetrics.NONE : metrics;
        this.clock = clock;
        this.maxSubscriptions = config.maxSubscriptions();
        this.inbound = new ArrayBlockingQueue<>(config.inboundQueueCapacity());
    }

    // ════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Attach to the session and start the router thread.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[ROUTER] Already running");
            return;
        }
        running = true;
        session.addListener(this);

        Thread t = new Thread(this::routeLoop, "stream-router");
        t.setDaemon(true);
        router = t;
        t.start();
        log.info("[ROUTER] Started (inbound capacity={}, max subscriptions={})",
            inbound.remainingCapacity(), maxSubscriptions);

        // Restarted on a live session: no READY event will come for this connection.
        if (session.isConnected()) {
            replay("START");
        }
    }

    /**
     * Detach from the session and stop the router. Desired subscriptions are kept.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        session.removeListener(this);
        wireReady = false;

        Thread t = router;
        router = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int dropped = inbound.size();
        inbound.clear();
        log.info("[ROUTER] Stopped ({} queued frames dropped, {} subscriptions kept)", dropped, size());
    }

    // ════════════════════════════════════════════════════════════════════════
    // DESIRED STATE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Subscribe with the default register request for the key.
     */
    public CompletableFuture<Void> subscribe(SubscriptionKey key, StreamCallback callback) {
        return subscribe(key, Envelope.subscribeRequest(key), callback);
    }

    public CompletableFuture<Void> subscribe(String channel, String routingKey, Envelope request,
                                             StreamCallback callback) {
        return subscribe(SubscriptionKey.of(channel, routingKey), request, callback);
    }

    /**
     * Add a callback for a key. The first callback creates the record and sends the
     * request if the wire is ready; later callbacks are appended (deduplicated by identity)
     * without any wire traffic.
     *
     * @return future completed once the request is written (immediately when nothing is sent)
     * @throws StreamSubscriptionException if the key is new and the registry is full
     */
    public CompletableFuture<Void> subscribe(SubscriptionKey key, Envelope request, StreamCallback callback) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(callback, "callback");

        synchronized (lock) {
            SubscriptionRecord existing = records.get(key);
            if (existing != null) {
                if (existing.addCallback(callback)) {
                    log.debug("[ROUTER] Added callback to {}", key);
                } else {
                    log.debug("[ROUTER] Callback already registered on {}", key);
                }
                return CompletableFuture.completedFuture(null);
            }

            if (records.size() >= maxSubscriptions) {
                metrics.recordSubscriptionRejected(key.channel());
                throw new StreamSubscriptionException(key, "CAPACITY",
                    "Subscription limit reached (" + maxSubscriptions + ")");
            }

            records.put(key, new SubscriptionRecord(key, request, callback, clock.instant()));
            metrics.updateLiveSubscriptions(records.size());
            log.info("[ROUTER] Subscribed {} ({} total)", key, records.size());

            if (!wireReady) {
                log.debug("[ROUTER] {} will be sent when the session is ready", key);
                return CompletableFuture.completedFuture(null);
            }
            return sendRequest(key, request, "subscribe");
        }
    }

    /**
     * Remove a subscription and all its callbacks. The unregister request is
     * best-effort: failures are logged and the returned future still completes normally.
     */
    public CompletableFuture<Void> unsubscribe(SubscriptionKey key) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            return removeRecord(key);
        }
    }

    /**
     * Remove one callback; the subscription itself goes when its last callback does.
     */
    public CompletableFuture<Void> unsubscribe(SubscriptionKey key, StreamCallback callback) {
        Objects.requireNonNull(key, "key");
        if (callback == null) {
            return unsubscribe(key);
        }
        synchronized (lock) {
            SubscriptionRecord record = records.get(key);
            if (record == null || !record.removeCallback(callback)) {
                return CompletableFuture.completedFuture(null);
            }
            if (!record.isEmpty()) {
                log.debug("[ROUTER] Removed callback from {} ({} left)", key, record.getCallbacks().size());
                return CompletableFuture.completedFuture(null);
            }
            return removeRecord(key);
        }
    }

    public CompletableFuture<Void> unsubscribe(String channel, String routingKey, StreamCallback callback) {
        return unsubscribe(SubscriptionKey.of(channel, routingKey), callback);
    }

    private CompletableFuture<Void> removeRecord(SubscriptionKey key) {
        SubscriptionRecord record = records.remove(key);
        if (record == null) {
            return CompletableFuture.completedFuture(null);
        }
        metrics.updateLiveSubscriptions(records.size());
        log.info("[ROUTER] Unsubscribed {} ({} total)", key, records.size());

        if (!wireReady) {
            return CompletableFuture.completedFuture(null);
        }
        return sendRequest(key, record.getRequest().toUnsubscribe(), "unsubscribe")
            .exceptionally(e -> null);
    }

    /**
     * Encode and send a request with the session's current token. Caller holds the lock.
     */
    private CompletableFuture<Void> sendRequest(SubscriptionKey key, Envelope request, String action) {
        String frame = codec.encode(request.withToken(session.getToken()));
        CompletableFuture<Void> sent = session.send(frame);
        sent.whenComplete((v, error) -> {
            if (error != null) {
                log.warn("[ROUTER] Failed to send {} for {}: {}", action, key, error.getMessage());
            } else {
                log.debug("[ROUTER] Sent {} for {}", action, key);
            }
        });
        return sent;
    }

    public void addDefaultHandler(StreamCallback handler) {
        defaultHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public void removeDefaultHandler(StreamCallback handler) {
        defaultHandlers.remove(handler);
    }

    /**
     * Receives broker rejections that no subscription callback claimed.
     */
    public void addErrorHandler(Consumer<StreamSubscriptionException> handler) {
        errorHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    /**
     * True once the desired set has been replayed on the current connection.
     */
    public boolean isConnected() {
        return wireReady;
    }

    public List<SubscriptionKey> getKeys() {
        synchronized (lock) {
            return List.copyOf(records.keySet());
        }
    }

    public Optional<SubscriptionRecord> find(SubscriptionKey key) {
        synchronized (lock) {
            return Optional.ofNullable(records.get(key));
        }
    }

    public boolean contains(SubscriptionKey key) {
        synchronized (lock) {
            return records.containsKey(key);
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // SESSION EVENTS
    // ════════════════════════════════════════════════════════════════════════

    @Override
    public void onSessionEvent(SessionEvent event) {
        switch (event.type()) {
            case READY, RECONNECTED -> replay(event.type().name());
            case ERROR, CLOSED, EXHAUSTED -> {
                if (wireReady) {
                    log.info("[ROUTER] Wire down ({}), {} subscriptions kept for replay", event.type(), size());
                }
                wireReady = false;
            }
            default -> {
            }
        }
    }

    private void replay(String trigger) {
        synchronized (lock) {
            int count = 0;
            for (SubscriptionRecord record : records.values()) {
                try {
                    sendRequest(record.getKey(), record.getRequest(), "replay");
                    count++;
                } catch (RuntimeException e) {
                    log.warn("[ROUTER] Replay of {} failed: {}", record.getKey(), e.getMessage());
                }
            }
            wireReady = true;
            log.info("[ROUTER] {}: replayed {} subscriptions", trigger, count);
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // ROUTING
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Queue an inbound frame for the router. Blocks while the queue is full, which
     * stops the transport from requesting more frames.
     */
    @Override
    public void onMessage(String frame) {
        if (!running) {
            dispatch(frame);
            return;
        }
        try {
            inbound.put(frame);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ROUTER] Interrupted while queueing inbound frame");
        }
    }

    private void routeLoop() {
        while (running) {
            String frame;
            try {
                frame = inbound.take();
            } catch (InterruptedException e) {
                break;
            }
            try {
                dispatch(frame);
            } catch (RuntimeException e) {
                log.error("[ROUTER] Unexpected dispatch failure", e);
            }
        }
        log.debug("[ROUTER] Router loop exited");
    }

    /**
     * Decode and route one frame on the calling thread.
     */
    public void dispatch(String frame) {
        StreamMessage message;
        try {
            message = codec.decode(frame);
        } catch (StreamProtocolException e) {
            metrics.recordProtocolError();
            log.warn("[ROUTER] Dropping malformed frame: {}", e.getMessage());
            return;
        }
        metrics.recordInboundMessage(message.family());

        if (message.isErrorResponse()) {
            routeError(message);
            return;
        }
        if (message.isAcknowledgement()) {
            log.debug("[ROUTER] Ack for {}: {} {}", message.key(),
                message.header().rspCd(), message.header().rspMsg());
            return;
        }

        List<StreamCallback> targets = collectTargets(message);
        if (targets.isEmpty()) {
            if (defaultHandlers.isEmpty()) {
                log.trace("[ROUTER] No subscriber for {}", message.key());
            }
            invoke(defaultHandlers, message, "default");
            return;
        }
        invoke(targets, message, message.key().toString());
    }

    private List<StreamCallback> collectTargets(StreamMessage message) {
        SubscriptionKey key = message.key();
        ChannelFamily family = message.family();
        Instant now = clock.instant();
        List<StreamCallback> targets = new ArrayList<>();

        synchronized (lock) {
            SubscriptionRecord exact = records.get(key);
            if (exact != null) {
                exact.markDelivered(now);
                targets.addAll(exact.getCallbacks());
            }
            if (key.isAllSymbols() || family == ChannelFamily.UNKNOWN) {
                return targets;
            }
            // All-symbols records of the family also get frames that matched an exact key,
            // so a wildcard feed (VI alerts) keeps seeing every symbol while one is also
            // subscribed on its own. Each callback runs once per frame.
            for (SubscriptionRecord record : records.values()) {
                SubscriptionKey k = record.getKey();
                if (record == exact || !k.isAllSymbols() || k.family() != family) {
                    continue;
                }
                record.markDelivered(now);
                for (StreamCallback callback : record.getCallbacks()) {
                    if (!containsIdentity(targets, callback)) {
                        targets.add(callback);
                    }
                }
            }
        }
        return targets;
    }

    private void routeError(StreamMessage message) {
        SubscriptionKey key = message.key();
        StreamSubscriptionException error = new StreamSubscriptionException(key,
            message.header().rspCd(), message.header().rspMsg());
        metrics.recordSubscriptionRejected(key.channel());
        log.warn("[ROUTER] Broker rejected {}: {} {}", key, message.header().rspCd(), message.header().rspMsg());

        List<StreamCallback> owners;
        synchronized (lock) {
            SubscriptionRecord record = records.get(key);
            owners = record == null ? List.of() : record.getCallbacks();
        }

        if (owners.isEmpty()) {
            for (Consumer<StreamSubscriptionException> handler : errorHandlers) {
                try {
                    handler.accept(error);
                } catch (Exception e) {
                    reportCallbackFailure(handler, "error-handler", key.channel(), e);
                }
            }
            return;
        }
        for (StreamCallback callback : owners) {
            try {
                callback.onError(error);
            } catch (Exception e) {
                reportCallbackFailure(callback, key.toString(), key.channel(), e);
            }
        }
    }

    private void invoke(List<StreamCallback> callbacks, StreamMessage message, String target) {
        for (StreamCallback callback : callbacks) {
            try {
                callback.onMessage(message);
            } catch (Exception e) {
                reportCallbackFailure(callback, target, message.channel(), e);
            }
        }
    }

    private void reportCallbackFailure(Object callback, String target, String channel, Exception e) {
        CallbackException failure = new CallbackException(callback.getClass().getName(), target, e);
        metrics.recordCallbackFailure(channel);
        log.error("[ROUTER] {}", failure.getMessage(), failure);
    }

    private static boolean containsIdentity(List<StreamCallback> list, StreamCallback callback) {
        for (StreamCallback c : list) {
            if (c == callback) return true;
        }
        return false;
    }
}
