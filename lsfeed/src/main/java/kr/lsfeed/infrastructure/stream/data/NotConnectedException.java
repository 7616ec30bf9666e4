package kr.lsfeed.infrastructure.stream.data;

/**
 * Exception thrown when a frame is sent while there is no live connection.
 */
public class NotConnectedException extends RuntimeException {

    private final String state;

    public NotConnectedException(String state, String message) {
        super(String.format("[%s] %s", state, message));
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
