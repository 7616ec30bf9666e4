package kr.lsfeed.service.vi;

import kr.lsfeed.config.StreamConfig;
import kr.lsfeed.domain.stream.ChannelCodes;
import kr.lsfeed.domain.stream.Market;
import kr.lsfeed.domain.stream.StreamMessage;
import kr.lsfeed.domain.stream.SubscriptionKey;
import kr.lsfeed.domain.stream.TradeTick;
import kr.lsfeed.domain.stream.ViEvent;
import kr.lsfeed.domain.vi.ViState;
import kr.lsfeed.domain.vi.ViType;
import kr.lsfeed.infrastructure.stream.codec.EnvelopeCodec;
import kr.lsfeed.infrastructure.stream.data.StreamProtocolException;
import kr.lsfeed.infrastructure.stream.data.StreamSubscriptionException;
import kr.lsfeed.infrastructure.stream.metrics.StreamMetrics;
import kr.lsfeed.infrastructure.stream.session.SessionEvent;
import kr.lsfeed.infrastructure.stream.session.SessionListener;
import kr.lsfeed.infrastructure.stream.session.StreamSession;
import kr.lsfeed.service.subscription.StreamCallback;
import kr.lsfeed.service.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * VI cascade: watches VI events for every symbol and follows each interrupted
 * symbol's trade ticks for the length of the interruption plus a grace period.
 *
 * Per symbol:
 * - activation (vi_gubun != 0) while inactive: ACTIVE, subscribe the symbol's trade
 *   channel, cancel any pending teardown
 * - release (vi_gubun == 0) while active: INACTIVE, report the duration, schedule the
 *   trade unsubscribe at release + grace
 * - duplicates in either direction are ignored
 *
 * Teardowns wait in a deadline-ordered queue; each one has a scheduler task that sweeps
 * due entries, so nothing ever sleeps on the router thread. A stop-requested session
 * close suspends the timers and the next READY/RECONNECTED re-arms them.
 *
 * Lock order: controller, then registry. Observers are called outside the lock.
 */
public class ViCascadeController implements SessionListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ViCascadeController.class);

    private static final SubscriptionKey VI_ALL = SubscriptionKey.allSymbols(ChannelCodes.VI);

    private final StreamSession session;
    private final SubscriptionRegistry registry;
    private final EnvelopeCodec codec;
    private final MarketDirectory directory;
    private final StreamMetrics metrics;
    private final Clock clock;
    private final Duration grace;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Object lock = new Object();
    private final Map<String, ViState> states = new LinkedHashMap<>();
    private final Map<String, PendingUnsubscribe> pendingBySymbol = new HashMap<>();
    private final PriorityQueue<PendingUnsubscribe> pendingQueue = new PriorityQueue<>(PendingUnsubscribe.BY_DEADLINE);
    private final Map<String, ScheduledFuture<?>> timers = new HashMap<>();
    private final Map<String, TradeTick> lastTrades = new HashMap<>();
    private final List<ViObserver> observers = new CopyOnWriteArrayList<>();

    // One instance each, so repeated subscribes are idempotent in the registry
    private final StreamCallback viCallback = this::onViFrame;
    private final StreamCallback tradeCallback = this::onTradeFrame;

    private boolean started = false;
    private boolean timersArmed = true;

    public ViCascadeController(StreamConfig config, StreamSession session, SubscriptionRegistry registry,
                               EnvelopeCodec codec, MarketDirectory directory, StreamMetrics metrics) {
        this(config, session, registry, codec, directory, metrics, Clock.systemUTC(), null);
    }

    /**
     * @param scheduler timer executor; when null the controller creates and owns one
     */
    public ViCascadeController(StreamConfig config, StreamSession session, SubscriptionRegistry registry,
                               EnvelopeCodec codec, MarketDirectory directory, StreamMetrics metrics,
                               Clock clock, ScheduledExecutorService scheduler) {
        this.session = session;
        this.registry = registry;
        this.codec = codec;
        this.directory = directory;
        this.metrics = metrics == null ? StreamMetrics.NONE : metrics;
        this.clock = clock;
        this.grace = config.viUnsubscribeGrace();
        this.ownsScheduler = scheduler == null;
        this.scheduler = scheduler != null ? scheduler : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vi-unsubscribe");
            t.setDaemon(true);
            return t;
        });
    }

    // ════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Subscribe to VI events for all symbols.
     */
    public void start() {
        synchronized (lock) {
            if (started) {
                log.warn("[VI] Already started");
                return;
            }
            started = true;
            timersArmed = true;
            session.addListener(this);
            registry.subscribe(VI_ALL, viCallback);
        }
        log.info("[VI] Monitoring started (grace={}s)", grace.getSeconds());
    }

    /**
     * Cancel pending teardowns and remove the VI subscription and every derived trade
     * subscription. Tracked state is cleared.
     */
    public void stop() {
        synchronized (lock) {
            if (!started) {
                return;
            }
            started = false;
            session.removeListener(this);
            cancelTimers();

            int derived = 0;
            for (ViState state : states.values()) {
                registry.unsubscribe(state.market().tradeKey(state.symbol()), tradeCallback);
                derived++;
            }
            registry.unsubscribe(VI_ALL, viCallback);

            states.clear();
            pendingBySymbol.clear();
            pendingQueue.clear();
            lastTrades.clear();
            metrics.updatePendingViUnsubscribes(0);
            log.info("[VI] Monitoring stopped ({} derived subscriptions removed)", derived);
        }
    }

    @Override
    public void close() {
        stop();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    public void addObserver(ViObserver observer) {
        observers.add(observer);
    }

    public void removeObserver(ViObserver observer) {
        observers.remove(observer);
    }

    // ════════════════════════════════════════════════════════════════════════
    // VI EVENTS
    // ════════════════════════════════════════════════════════════════════════

    private void onViFrame(StreamMessage message) {
        ViEvent event;
        try {
            event = codec.bodyAs(message, ViEvent.class);
        } catch (StreamProtocolException e) {
            log.warn("[VI] Dropping VI frame: {}", e.getMessage());
            return;
        }
        onViMessage(event);
    }

    /**
     * Apply one VI event.
     */
    public void onViMessage(ViEvent event) {
        String symbol = event.symbol();
        int code = event.activationCode();
        if (symbol == null || symbol.isEmpty() || code < 0) {
            log.warn("[VI] Ignoring VI event without symbol or code: symbol={}, vi_gubun={}",
                symbol, event.viGubun());
            return;
        }

        ViState changed;
        boolean activation = code != 0;
        synchronized (lock) {
            if (!started) {
                log.debug("[VI] Not started, ignoring VI event for {}", symbol);
                return;
            }
            changed = activation ? activate(symbol, code, event) : release(symbol);
        }
        if (changed == null) {
            return;
        }

        if (activation) {
            notifyObservers(o -> o.onActivated(symbol, changed));
        } else {
            notifyObservers(o -> o.onReleased(symbol, changed));
        }
    }

    private ViState activate(String symbol, int code, ViEvent event) {
        ViState current = states.get(symbol);
        if (current != null && current.isActive()) {
            log.debug("[VI] Duplicate activation for {}", symbol);
            return null;
        }

        Market market = current != null ? current.market() : directory.lookup(symbol).orElse(null);
        if (market == null) {
            log.warn("[VI] Unknown symbol {}, not in the stock master; trades not followed", symbol);
            return null;
        }

        Instant now = clock.instant();
        if (cancelPending(symbol)) {
            log.info("[VI] {} re-activated within grace period, teardown cancelled", symbol);
        }

        ViType type = ViType.fromCode(code).orElse(null);
        ViState active = ViState.activated(symbol, type, market, event.triggerPriceValue(),
            event.staticBasePriceValue(), event.dynamicBasePriceValue(), now);
        states.put(symbol, active);

        SubscriptionKey tradeKey = market.tradeKey(symbol);
        try {
            registry.subscribe(tradeKey, tradeCallback);
        } catch (StreamSubscriptionException e) {
            log.error("[VI] Cannot follow trades for {}: {}", symbol, e.getMessage());
        }

        metrics.recordViActivation();
        log.info("[VI] Activated {} ({}, trigger={}, market={})", symbol, type, active.triggerPrice(), market);
        return active;
    }

    private ViState release(String symbol) {
        ViState current = states.get(symbol);
        if (current == null || !current.isActive()) {
            log.debug("[VI] Release for untracked or inactive {}", symbol);
            return null;
        }

        Instant now = clock.instant();
        ViState released = current.release(now);
        states.put(symbol, released);
        schedulePending(symbol, current.market().tradeKey(symbol), now);

        metrics.recordViRelease(released.duration());
        log.info("[VI] Released {} after {}s, trades followed until {}",
            symbol, released.durationSeconds(), now.plus(grace));
        return released;
    }

    // ════════════════════════════════════════════════════════════════════════
    // TRADES
    // ════════════════════════════════════════════════════════════════════════

    private void onTradeFrame(StreamMessage message) {
        TradeTick tick;
        try {
            tick = codec.bodyAs(message, TradeTick.class);
        } catch (StreamProtocolException e) {
            log.warn("[VI] Dropping trade frame: {}", e.getMessage());
            return;
        }
        if (tick.symbol() == null || tick.symbol().isBlank()) {
            tick = new TradeTick(message.routingKey(), tick.tradeTime(), tick.price(), tick.sign(), tick.change(),
                tick.changeRate(), tick.tradeVolume(), tick.cumulativeVolume(), tick.tradeStrength());
        }
        onTradeMessage(tick);
    }

    /**
     * Forward a tick to observers if its symbol is active or in its grace period.
     */
    public void onTradeMessage(TradeTick tick) {
        String symbol = tick.symbol() == null ? null : tick.symbol().trim();
        synchronized (lock) {
            if (symbol == null || !states.containsKey(symbol)) {
                log.trace("[VI] Dropping trade for untracked {}", symbol);
                return;
            }
            lastTrades.put(symbol, tick);
        }
        notifyObservers(o -> o.onTrade(symbol, tick));
    }

    // ════════════════════════════════════════════════════════════════════════
    // DELAYED UNSUBSCRIBE
    // ════════════════════════════════════════════════════════════════════════

    private void schedulePending(String symbol, SubscriptionKey key, Instant now) {
        cancelPending(symbol);
        PendingUnsubscribe pending = new PendingUnsubscribe(key, symbol, now, now.plus(grace));
        pendingBySymbol.put(symbol, pending);
        pendingQueue.add(pending);
        if (timersArmed) {
            arm(pending);
        }
        metrics.updatePendingViUnsubscribes(pendingBySymbol.size());
    }

    private boolean cancelPending(String symbol) {
        PendingUnsubscribe pending = pendingBySymbol.remove(symbol);
        if (pending == null) {
            return false;
        }
        pendingQueue.remove(pending);
        ScheduledFuture<?> timer = timers.remove(symbol);
        if (timer != null) {
            timer.cancel(false);
        }
        metrics.updatePendingViUnsubscribes(pendingBySymbol.size());
        return true;
    }

    private void arm(PendingUnsubscribe pending) {
        long delayMillis = Math.max(0, Duration.between(clock.instant(), pending.fireAt()).toMillis());
        ScheduledFuture<?> previous = timers.put(pending.symbol(),
            scheduler.schedule(this::runDueUnsubscribes, delayMillis, TimeUnit.MILLISECONDS));
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void cancelTimers() {
        for (ScheduledFuture<?> timer : timers.values()) {
            timer.cancel(false);
        }
        timers.clear();
    }

    /**
     * Unsubscribe every derived trade feed whose grace period has ended and forget
     * its symbol. Called by the timers; safe to call at any time.
     *
     * @return number of subscriptions removed
     */
    public int runDueUnsubscribes() {
        synchronized (lock) {
            Instant now = clock.instant();
            int removed = 0;
            while (!pendingQueue.isEmpty() && pendingQueue.peek().isDue(now)) {
                PendingUnsubscribe due = pendingQueue.poll();
                String symbol = due.symbol();
                pendingBySymbol.remove(symbol);
                ScheduledFuture<?> timer = timers.remove(symbol);
                if (timer != null) {
                    timer.cancel(false);
                }

                registry.unsubscribe(due.key(), tradeCallback);
                ViState state = states.get(symbol);
                if (state != null && !state.isActive()) {
                    states.remove(symbol);
                    lastTrades.remove(symbol);
                }
                removed++;
                log.info("[VI] Stopped following trades for {} ({}s after release)",
                    symbol, Duration.between(due.scheduledAt(), now).getSeconds());
            }
            if (removed > 0) {
                metrics.updatePendingViUnsubscribes(pendingBySymbol.size());
            }
            return removed;
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // SESSION EVENTS
    // ════════════════════════════════════════════════════════════════════════

    @Override
    public void onSessionEvent(SessionEvent event) {
        synchronized (lock) {
            if (event.type() == SessionEvent.Type.CLOSED && event.requested()) {
                if (timersArmed && !timers.isEmpty()) {
                    log.info("[VI] Session stopped, suspending {} teardown timers", timers.size());
                }
                cancelTimers();
                timersArmed = false;
            } else if (event.isReady() && !timersArmed) {
                timersArmed = true;
                for (PendingUnsubscribe pending : pendingQueue) {
                    arm(pending);
                }
                if (!pendingQueue.isEmpty()) {
                    log.info("[VI] Session ready, re-armed {} teardown timers", pendingQueue.size());
                }
            }
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // QUERIES
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Symbols currently under VI, with their state.
     */
    public Map<String, ViState> getActiveSymbols() {
        synchronized (lock) {
            Map<String, ViState> active = new LinkedHashMap<>();
            for (ViState state : states.values()) {
                if (state.isActive()) {
                    active.put(state.symbol(), state);
                }
            }
            return active;
        }
    }

    /**
     * Symbols whose trades are followed: active ones and those in their grace period.
     */
    public Set<String> getTrackedSymbols() {
        synchronized (lock) {
            return Set.copyOf(states.keySet());
        }
    }

    public Optional<ViState> getState(String symbol) {
        synchronized (lock) {
            return Optional.ofNullable(states.get(symbol));
        }
    }

    /**
     * Pending teardowns ordered by deadline.
     */
    public List<PendingUnsubscribe> getPendingUnsubscribes() {
        synchronized (lock) {
            List<PendingUnsubscribe> pending = new ArrayList<>(pendingQueue);
            pending.sort(PendingUnsubscribe.BY_DEADLINE);
            return pending;
        }
    }

    /**
     * Last trade tick seen for a tracked symbol.
     */
    public Optional<TradeTick> getLastTrade(String symbol) {
        synchronized (lock) {
            return Optional.ofNullable(lastTrades.get(symbol));
        }
    }

    int armedTimerCount() {
        synchronized (lock) {
            return timers.size();
        }
    }

    private void notifyObservers(Consumer<ViObserver> action) {
        for (ViObserver observer : observers) {
            try {
                action.accept(observer);
            } catch (Exception e) {
                metrics.recordCallbackFailure(ChannelCodes.VI);
                log.error("[VI] Observer {} failed", observer.getClass().getName(), e);
            }
        }
    }
}
