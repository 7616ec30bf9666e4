package kr.lsfeed.infrastructure.stream.transport;

import kr.lsfeed.config.StreamConfig;
import kr.lsfeed.infrastructure.stream.common.HeartbeatManager;
import kr.lsfeed.infrastructure.stream.data.NotConnectedException;
import kr.lsfeed.infrastructure.stream.data.StreamConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link StreamTransport} over the JDK WebSocket client.
 *
 * Each connection owns:
 * - a bounded outbound queue drained by one writer thread, so frames never interleave
 * - a {@link HeartbeatManager} sending WebSocket pings; a missed pong aborts the connection
 * - a reassembly buffer for fragmented text frames
 *
 * Inbound pings are answered by the JDK client and never forwarded. Events from a
 * connection that has been replaced or closed locally are dropped.
 */
public final class WebSocketTransport implements StreamTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    static final int ABNORMAL_CLOSURE = 1006;

    private static final AtomicInteger CONNECTION_IDS = new AtomicInteger();

    private final HttpClient httpClient;
    private final Duration keepaliveInterval;
    private final Duration keepaliveTimeout;
    private final Duration writeTimeout;
    private final int outboundCapacity;

    private final AtomicReference<Connection> current = new AtomicReference<>(null);
    private volatile TransportListener listener;

    public WebSocketTransport(StreamConfig config) {
        this(HttpClient.newHttpClient(), config.keepaliveInterval(), config.keepaliveTimeout(),
            config.keepaliveTimeout(), config.outboundQueueCapacity());
    }

    public WebSocketTransport(HttpClient httpClient, Duration keepaliveInterval, Duration keepaliveTimeout,
                              Duration writeTimeout, int outboundCapacity) {
        this.httpClient = httpClient;
        this.keepaliveInterval = keepaliveInterval;
        this.keepaliveTimeout = keepaliveTimeout;
        this.writeTimeout = writeTimeout;
        this.outboundCapacity = outboundCapacity;
    }

    @Override
    public void setListener(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> connect(URI endpoint, String token, Duration handshakeTimeout) {
        Connection previous = current.getAndSet(null);
        if (previous != null) {
            log.info("[TRANSPORT] Replacing connection #{}", previous.id);
            previous.shutdown("replaced");
        }

        Connection conn = new Connection(endpoint);
        current.set(conn);
        log.info("[TRANSPORT] Connecting #{} to {}", conn.id, endpoint);

        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
            .connectTimeout(handshakeTimeout);
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        builder.buildAsync(endpoint, conn)
            .orTimeout(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((ws, error) -> {
                if (error == null) {
                    return;
                }
                if (conn.failHandshake()) {
                    current.compareAndSet(conn, null);
                    Throwable cause = unwrap(error);
                    String message = cause instanceof TimeoutException
                        ? "Handshake timed out after " + handshakeTimeout.toMillis() + "ms"
                        : "Handshake failed: " + cause.getMessage();
                    log.warn("[TRANSPORT] #{} {}", conn.id, message);
                    conn.opened.completeExceptionally(
                        new StreamConnectionException(endpoint.toString(), message, cause));
                }
            });

        return conn.opened;
    }

    @Override
    public CompletableFuture<Void> send(String frame) {
        Connection conn = current.get();
        if (conn == null || !conn.isOpen()) {
            return CompletableFuture.failedFuture(
                new NotConnectedException("CLOSED", "No live connection for outbound frame"));
        }
        return conn.enqueue(frame);
    }

    @Override
    public void close() {
        Connection conn = current.getAndSet(null);
        if (conn != null) {
            conn.shutdown("client closing");
        }
    }

    @Override
    public boolean isOpen() {
        Connection conn = current.get();
        return conn != null && conn.isOpen();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t.getCause() != null && (t instanceof java.util.concurrent.CompletionException
                || t instanceof java.util.concurrent.ExecutionException)) {
            t = t.getCause();
        }
        return t;
    }

    private record OutboundFrame(String text, CompletableFuture<Void> written) {}

    /**
     * State of one physical connection.
     */
    private final class Connection implements WebSocket.Listener {
        private static final int HANDSHAKE = 0;
        private static final int OPEN = 1;
        private static final int FAILED = 2;

        private final int id = CONNECTION_IDS.incrementAndGet();
        private final URI endpoint;
        private final CompletableFuture<Void> opened = new CompletableFuture<>();
        private final AtomicInteger phase = new AtomicInteger(HANDSHAKE);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final BlockingQueue<OutboundFrame> outbound = new ArrayBlockingQueue<>(outboundCapacity);
        private final StringBuilder buf = new StringBuilder();

        private volatile WebSocket ws;
        private volatile Thread writer;
        private volatile HeartbeatManager heartbeat;

        Connection(URI endpoint) {
            this.endpoint = endpoint;
        }

        boolean failHandshake() {
            return phase.compareAndSet(HANDSHAKE, FAILED);
        }

        boolean isOpen() {
            return phase.get() == OPEN && !closed.get();
        }

        private boolean isCurrent() {
            return current.get() == this && !closed.get();
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            if (!phase.compareAndSet(HANDSHAKE, OPEN) || current.get() != this) {
                log.debug("[TRANSPORT] #{} opened after being abandoned, aborting", id);
                webSocket.abort();
                return;
            }
            this.ws = webSocket;

            writer = new Thread(this::drainOutbound, "ws-writer-" + id);
            writer.setDaemon(true);
            writer.start();

            heartbeat = new HeartbeatManager("ws-" + id, keepaliveInterval, keepaliveTimeout,
                this::sendPing, this::onHealthChange);
            heartbeat.start();

            log.info("[TRANSPORT] #{} connected to {}", id, endpoint);
            TransportListener l = listener;
            if (l != null) {
                l.onOpened();
            }
            opened.complete(null);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String frame = buf.toString();
                buf.setLength(0);
                TransportListener l = listener;
                if (l != null && isCurrent()) {
                    l.onMessage(frame);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            log.debug("[TRANSPORT] #{} ignoring binary frame ({} bytes)", id, data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            log.trace("[TRANSPORT] #{} ping received", id);
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            HeartbeatManager hb = heartbeat;
            if (hb != null) {
                hb.recordPong();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            terminate(statusCode, reason, null);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            terminate(ABNORMAL_CLOSURE, String.valueOf(error.getMessage()), error);
        }

        CompletableFuture<Void> enqueue(String frame) {
            CompletableFuture<Void> written = new CompletableFuture<>();
            try {
                if (!outbound.offer(new OutboundFrame(frame, written), writeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    written.completeExceptionally(new StreamConnectionException(endpoint.toString(),
                        "Outbound queue full (" + outboundCapacity + " frames)"));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                written.completeExceptionally(e);
            }
            return written;
        }

        private void drainOutbound() {
            while (!closed.get()) {
                OutboundFrame frame;
                try {
                    frame = outbound.take();
                } catch (InterruptedException e) {
                    break;
                }
                try {
                    ws.sendText(frame.text(), true).get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
                    frame.written().complete(null);
                } catch (InterruptedException e) {
                    frame.written().completeExceptionally(
                        new NotConnectedException("CLOSED", "Connection closed before frame was written"));
                    break;
                } catch (Exception e) {
                    Throwable cause = unwrap(e);
                    StreamConnectionException failure = new StreamConnectionException(endpoint.toString(),
                        "Write failed: " + cause.getMessage(), cause);
                    frame.written().completeExceptionally(failure);
                    terminate(ABNORMAL_CLOSURE, "write failed", failure);
                    ws.abort();
                    break;
                }
            }
            failPending();
        }

        private void sendPing() {
            WebSocket socket = ws;
            if (socket == null || closed.get()) {
                throw new IllegalStateException("connection #" + id + " is not open");
            }
            socket.sendPing(ByteBuffer.allocate(0));
        }

        private void onHealthChange(boolean healthy) {
            if (healthy) {
                return;
            }
            terminate(ABNORMAL_CLOSURE, "keepalive timeout", new StreamConnectionException(endpoint.toString(),
                "No pong within " + keepaliveTimeout.toMillis() + "ms"));
            WebSocket socket = ws;
            if (socket != null) {
                socket.abort();
            }
        }

        /**
         * Tear down and emit Error (when there is a cause) then Closed, once.
         */
        private void terminate(int code, String reason, Throwable cause) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            release();
            boolean wasCurrent = current.compareAndSet(this, null);
            TransportListener l = listener;
            if (!wasCurrent || l == null) {
                log.debug("[TRANSPORT] #{} closed ({} {}) after being detached", id, code, reason);
                return;
            }
            if (cause != null) {
                log.warn("[TRANSPORT] #{} error: {}", id, cause.getMessage());
                l.onError(cause);
            }
            log.info("[TRANSPORT] #{} closed: {} {}", id, code, reason);
            l.onClosed(code, reason);
        }

        /**
         * Local close: tear down without emitting events.
         */
        void shutdown(String reason) {
            if (phase.compareAndSet(HANDSHAKE, FAILED)) {
                opened.completeExceptionally(new StreamConnectionException(endpoint.toString(),
                    "Closed during handshake"));
            }
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            release();
            WebSocket socket = ws;
            if (socket != null) {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, reason)
                    .orTimeout(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((w, error) -> {
                        if (error != null) {
                            log.debug("[TRANSPORT] #{} close frame not sent: {}", id, error.getMessage());
                            socket.abort();
                        }
                    });
            }
            log.info("[TRANSPORT] #{} closed locally ({})", id, reason);
        }

        private void release() {
            HeartbeatManager hb = heartbeat;
            if (hb != null) {
                hb.stop();
            }
            Thread w = writer;
            if (w != null && w != Thread.currentThread()) {
                w.interrupt();
            } else {
                failPending();
            }
        }

        private void failPending() {
            OutboundFrame frame;
            while ((frame = outbound.poll()) != null) {
                frame.written().completeExceptionally(
                    new NotConnectedException("CLOSED", "Connection closed before frame was written"));
            }
        }
    }
}
