package kr.lsfeed.infrastructure.stream.data;

/**
 * Exception thrown when the streaming connection cannot be established or is lost.
 *
 * Covers rejected handshakes, handshake timeouts, keepalive timeouts and write failures.
 * The session recovers from these by reconnecting; they are fatal only once the
 * reconnect budget is exhausted.
 */
public class StreamConnectionException extends RuntimeException {

    private final String endpoint;

    public StreamConnectionException(String endpoint, String message) {
        super(String.format("[%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public StreamConnectionException(String endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
