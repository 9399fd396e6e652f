package dev.holdem.events;

/**
 * A player took a seat with the buy-in as bank roll.
 */
public record PlayerJoined(String name, long bankRoll) implements GameEvent {
}
