package kr.lsfeed.support;

import kr.lsfeed.infrastructure.stream.session.SessionEvent;
import kr.lsfeed.infrastructure.stream.session.SessionListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Collects session events so tests can wait for them.
 */
public final class RecordingSessionListener implements SessionListener {

    private final List<SessionEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onSessionEvent(SessionEvent event) {
        events.add(event);
    }

    public List<SessionEvent> events() {
        return List.copyOf(events);
    }

    public List<SessionEvent.Type> types() {
        return events.stream().map(SessionEvent::type).collect(Collectors.toList());
    }

    public long count(SessionEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    /**
     * Wait until {@code count} events of a type have been seen.
     */
    public boolean await(SessionEvent.Type type, int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (count(type) >= count) {
                return true;
            }
            Thread.sleep(5);
        }
        return count(type) >= count;
    }
}
