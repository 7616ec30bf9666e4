package kr.lsfeed.infrastructure.stream.transport;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import kr.lsfeed.infrastructure.stream.data.NotConnectedException;
import kr.lsfeed.infrastructure.stream.data.StreamConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WebSocketTransport against an embedded Undertow WebSocket server.
 *
 * Tests:
 * - Handshake with bearer token, Opened before any frame
 * - Outbound frames written in order, inbound frames delivered
 * - Server close reported once
 * - Failed handshake fails the connect future without events
 * - Local close emits no events
 */
class WebSocketTransportTest {

    private static final int TEST_PORT = 19092;
    private static final URI ENDPOINT = URI.create("ws://localhost:" + TEST_PORT + "/websocket");

    private Undertow server;
    private final List<WebSocketChannel> serverChannels = new CopyOnWriteArrayList<>();
    private final List<String> serverReceived = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();

    private WebSocketTransport transport;
    private final RecordingListener events = new RecordingListener();

    @BeforeEach
    void setUp() {
        WebSocketConnectionCallback callback = new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                authorization.set(exchange.getRequestHeader("Authorization"));
                serverChannels.add(channel);
                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        serverReceived.add(message.getData());
                    }
                });
                channel.resumeReceives();
            }
        };
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addExactPath("/websocket", new WebSocketProtocolHandshakeHandler(callback)))
            .build();
        server.start();

        transport = new WebSocketTransport(HttpClient.newHttpClient(), Duration.ofSeconds(30),
            Duration.ofSeconds(10), Duration.ofSeconds(2), 100);
        transport.setListener(events);
    }

    @AfterEach
    void tearDown() {
        transport.close();
        if (server != null) {
            server.stop();
        }
    }

    private void pushFromServer(String text) {
        for (WebSocketChannel channel : serverChannels) {
            WebSockets.sendText(text, channel, null);
        }
    }

    @Test
    void testConnectSendsBearerToken() throws Exception {
        transport.connect(ENDPOINT, "token-abc", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        assertTrue(transport.isOpen());
        assertEquals("Bearer token-abc", authorization.get());
        assertEquals(1, events.opened.get(), "Opened reported once");
    }

    @Test
    void testFramesFlowBothWays() throws Exception {
        transport.connect(ENDPOINT, "token-abc", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        for (int i = 0; i < 20; i++) {
            transport.send("{\"seq\":" + i + "}");
        }
        transport.send("{\"seq\":\"last\"}").get(2, TimeUnit.SECONDS);
        long deadline = System.currentTimeMillis() + 2_000;
        while (serverReceived.size() < 21 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(21, serverReceived.size());
        for (int i = 0; i < 20; i++) {
            assertEquals("{\"seq\":" + i + "}", serverReceived.get(i), "Outbound order preserved");
        }

        pushFromServer("{\"header\":{\"tr_cd\":\"VI_\"}}");
        assertTrue(events.messageLatch.await(2, TimeUnit.SECONDS), "Inbound frame delivered");
        assertEquals("{\"header\":{\"tr_cd\":\"VI_\"}}", events.messages.get(0));
    }

    @Test
    void testServerCloseReportedOnce() throws Exception {
        transport.connect(ENDPOINT, "token-abc", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        for (WebSocketChannel channel : serverChannels) {
            WebSockets.sendClose(1001, "going away", channel, null);
        }

        assertTrue(events.closedLatch.await(5, TimeUnit.SECONDS), "Close should be reported");
        Thread.sleep(200);
        assertEquals(1, events.closed.get(), "Closed reported exactly once");
        assertFalse(transport.isOpen());

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.send("{}").get(1, TimeUnit.SECONDS));
        assertInstanceOf(NotConnectedException.class, e.getCause());
    }

    @Test
    void testHandshakeFailure() {
        URI nowhere = URI.create("ws://localhost:" + TEST_PORT + "/no-such-path");

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.connect(nowhere, "token-abc", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(StreamConnectionException.class, e.getCause());
        assertEquals(0, events.opened.get());
        assertEquals(0, events.closed.get(), "Failed handshake emits no close");
        assertFalse(transport.isOpen());
    }

    @Test
    void testLocalCloseEmitsNoEvents() throws Exception {
        transport.connect(ENDPOINT, "token-abc", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        transport.close();
        Thread.sleep(300);

        assertFalse(transport.isOpen());
        assertEquals(0, events.closed.get(), "Requested close is not reported as a drop");
        assertEquals(0, events.errors.get());
    }

    @Test
    void testSendBeforeConnectFails() {
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> transport.send("{}").get(1, TimeUnit.SECONDS));

        assertInstanceOf(NotConnectedException.class, e.getCause());
    }

    private static final class RecordingListener implements TransportListener {
        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final List<String> messages = new CopyOnWriteArrayList<>();
        final CountDownLatch messageLatch = new CountDownLatch(1);
        final CountDownLatch closedLatch = new CountDownLatch(1);

        @Override
        public void onOpened() {
            opened.incrementAndGet();
        }

        @Override
        public void onMessage(String frame) {
            messages.add(frame);
            messageLatch.countDown();
        }

        @Override
        public void onError(Throwable cause) {
            errors.incrementAndGet();
        }

        @Override
        public void onClosed(int code, String reason) {
            closed.incrementAndGet();
            closedLatch.countDown();
        }
    }
}
