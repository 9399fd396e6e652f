package dev.holdem.events;

import dev.holdem.table.Bet;

/**
 * A bet was applied. {@code pot} is the total of the main pot and every side pot afterwards.
 */
public record BetPlaced(String player, Bet bet, long pot) implements GameEvent {
}
