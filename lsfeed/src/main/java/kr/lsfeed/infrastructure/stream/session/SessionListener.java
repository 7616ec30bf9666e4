package kr.lsfeed.infrastructure.stream.session;

/**
 * Receiver of session events and inbound frames.
 *
 * Events are delivered on the session thread; frames on the transport's reader
 * thread. {@link #onMessage} may block to slow the reader down.
 */
public interface SessionListener {

    void onSessionEvent(SessionEvent event);

    default void onMessage(String frame) {
    }
}
