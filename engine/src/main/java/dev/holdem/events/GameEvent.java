package dev.holdem.events;

/**
 * Marker for immutable notifications published by the engine.
 *
 * <p>The engine makes no assumption about delivery: sinks may render, transmit or ignore them.
 */
public interface GameEvent {
}
