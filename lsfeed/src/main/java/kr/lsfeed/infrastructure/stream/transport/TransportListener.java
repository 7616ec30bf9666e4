package kr.lsfeed.infrastructure.stream.transport;

/**
 * Events emitted by a {@link StreamTransport}, in connection order:
 * {@code onOpened}, any number of {@code onMessage}, then at most one
 * {@code onError} followed by exactly one {@code onClosed}.
 */
public interface TransportListener {

    void onOpened();

    /**
     * One complete inbound text frame. May block to apply backpressure.
     */
    void onMessage(String frame);

    void onError(Throwable cause);

    void onClosed(int code, String reason);
}
