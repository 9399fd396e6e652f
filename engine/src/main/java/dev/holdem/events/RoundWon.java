package dev.holdem.events;

import dev.holdem.hand.Winner;

/**
 * The showdown result of a round.
 */
public record RoundWon(Winner winner) implements GameEvent {
}
