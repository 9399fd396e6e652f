package dev.holdem.events;

/**
 * The last player standing.
 */
public record GameWon(String name, long bankRoll) implements GameEvent {
}
