package stitcher.taskcenter.event;

/**
 * Receiver of task events. Fire-and-forget: implementations must not throw back into the caller.
 */
@FunctionalInterface
public interface EventSink {

    void notify(TaskEvent event);

    static EventSink discarding() {
        return event -> {
        };
    }
}
