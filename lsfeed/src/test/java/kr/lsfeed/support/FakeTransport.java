package kr.lsfeed.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.lsfeed.infrastructure.stream.data.NotConnectedException;
import kr.lsfeed.infrastructure.stream.data.StreamConnectionException;
import kr.lsfeed.infrastructure.stream.transport.StreamTransport;
import kr.lsfeed.infrastructure.stream.transport.TransportListener;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * In-memory transport. Connects immediately unless told to fail, records every
 * frame sent, and lets tests inject inbound frames and drops.
 */
public final class FakeTransport implements StreamTransport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private volatile TransportListener listener;
    private volatile boolean open = false;
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final AtomicInteger connectCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final List<String> tokens = new CopyOnWriteArrayList<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> connect(URI endpoint, String token, Duration handshakeTimeout) {
        connectCount.incrementAndGet();
        tokens.add(token);
        if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return CompletableFuture.failedFuture(
                new StreamConnectionException(endpoint.toString(), "handshake rejected (fake)"));
        }
        open = true;
        listener.onOpened();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> send(String frame) {
        if (!open) {
            return CompletableFuture.failedFuture(new NotConnectedException("CLOSED", "fake transport closed"));
        }
        sent.add(frame);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        open = false;
        closeCount.incrementAndGet();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Make the next {@code count} handshakes fail.
     */
    public void failNextConnects(int count) {
        failuresToInject.set(count);
    }

    /**
     * Simulate a socket error: Error then Closed(1006).
     */
    public void drop(String reason) {
        open = false;
        listener.onError(new StreamConnectionException("fake", reason));
        listener.onClosed(1006, reason);
    }

    public void deliver(String frame) {
        listener.onMessage(frame);
    }

    public int connectCount() {
        return connectCount.get();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public List<String> tokens() {
        return List.copyOf(tokens);
    }

    public List<String> sentFrames() {
        return new ArrayList<>(sent);
    }

    /**
     * Sent frames parsed as JSON, in send order.
     */
    public List<JsonNode> sentRequests() {
        List<JsonNode> parsed = new ArrayList<>();
        for (String frame : sent) {
            try {
                parsed.add(MAPPER.readTree(frame));
            } catch (JsonProcessingException e) {
                throw new AssertionError("Sent frame is not JSON: " + frame, e);
            }
        }
        return parsed;
    }

    /**
     * Sent requests rendered as "tr_type:tr_cd:tr_key" for compact assertions.
     */
    public List<String> sentSummary() {
        List<String> summary = new ArrayList<>();
        for (JsonNode request : sentRequests()) {
            summary.add(request.at("/header/tr_type").asText() + ":" + request.at("/body/tr_cd").asText()
                + ":" + request.at("/body/tr_key").asText());
        }
        return summary;
    }

    public void clearSent() {
        sent.clear();
    }

    /**
     * Wait until at least {@code count} sent frames match.
     */
    public boolean awaitSent(Predicate<String> filter, int count, long timeout, TimeUnit unit)
            throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (sent.stream().filter(filter).count() >= count) {
                return true;
            }
            Thread.sleep(5);
        }
        return sent.stream().filter(filter).count() >= count;
    }
}
