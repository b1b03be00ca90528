package stitcher.taskcenter.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of task events. Listeners run on the publishing thread;
 * a failing listener is logged and skipped.
 */
public final class TaskEventBus implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(TaskEventBus.class);

    private final CopyOnWriteArrayList<EventSink> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(EventSink listener) {
        listeners.add(listener);
    }

    public boolean unsubscribe(EventSink listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public void notify(TaskEvent event) {
        for (EventSink listener : listeners) {
            try {
                listener.notify(event);
            } catch (RuntimeException e) {
                log.warn("Event listener {} failed on {} of task {}", listener, event.type(), event.taskId(), e);
            }
        }
    }
}
