package dev.holdem.events;

/**
 * A player left the table because their bank roll no longer covers the blind.
 */
public record PlayerEliminated(String name, long chipsCashedOut) implements GameEvent {
}
