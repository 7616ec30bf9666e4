package kr.lsfeed.infrastructure.stream.session;

/**
 * Connection state of a {@link StreamSession}.
 *
 * DISCONNECTED -> CONNECTING -> CONNECTED -> CLOSING -> CLOSED, plus ERROR from any
 * non-terminal state. CONNECTING also covers the backoff wait before a retry.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING,
    CLOSED,
    ERROR;

    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * Only a connected session accepts outbound frames.
     */
    public boolean canSend() {
        return this == CONNECTED;
    }

    /**
     * States from which {@code start()} begins a new connection cycle.
     */
    public boolean canStart() {
        return this == DISCONNECTED || this == CLOSED || this == ERROR;
    }
}
