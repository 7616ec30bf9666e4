package kr.lsfeed.infrastructure.stream.transport;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * One physical streaming connection with raw text framing.
 *
 * A transport knows nothing about subscriptions and never retries; a failed
 * handshake completes the connect future exceptionally and emits no events.
 */
public interface StreamTransport {

    void setListener(TransportListener listener);

    /**
     * Open a connection, replacing any previous one.
     *
     * @return future completed when the handshake succeeds, or exceptionally with
     *         {@code StreamConnectionException} on timeout or rejection
     */
    CompletableFuture<Void> connect(URI endpoint, String token, Duration handshakeTimeout);

    /**
     * Queue a frame for the connection's single writer.
     *
     * @return future completed once the frame is written, or exceptionally with
     *         {@code NotConnectedException} when there is no live connection
     */
    CompletableFuture<Void> send(String frame);

    /**
     * Close the current connection, if any. Emits no events.
     */
    void close();

    boolean isOpen();
}
