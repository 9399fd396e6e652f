package dev.holdem.events;

/**
 * Receives game notifications.
 */
@FunctionalInterface
public interface EventSink {

    void onEvent(GameEvent event);

    /**
     * A sink that ignores everything.
     */
    static EventSink none() {
        return event -> { };
    }
}
