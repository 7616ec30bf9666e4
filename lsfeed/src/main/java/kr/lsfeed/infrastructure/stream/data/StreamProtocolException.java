package kr.lsfeed.infrastructure.stream.data;

/**
 * Exception thrown when an inbound frame is not a valid envelope.
 */
public class StreamProtocolException extends RuntimeException {

    private static final int MAX_FRAME_CHARS = 200;

    private final String frame;

    public StreamProtocolException(String frame, String message) {
        super(String.format("%s: %s", message, truncate(frame)));
        this.frame = truncate(frame);
    }

    public StreamProtocolException(String frame, String message, Throwable cause) {
        super(String.format("%s: %s", message, truncate(frame)), cause);
        this.frame = truncate(frame);
    }

    /**
     * Offending frame, truncated for logging.
     */
    public String getFrame() {
        return frame;
    }

    private static String truncate(String frame) {
        if (frame == null) return "null";
        return frame.length() <= MAX_FRAME_CHARS ? frame : frame.substring(0, MAX_FRAME_CHARS) + "...";
    }
}
