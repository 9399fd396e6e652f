package dev.holdem.events;

import dev.holdem.cards.Card;

import java.util.List;

/**
 * Private notification of a player's hole cards. Only that player's sink receives it.
 */
public record HoleCardsDealt(String player, List<Card> cards) implements GameEvent {

    public HoleCardsDealt {
        cards = List.copyOf(cards);
    }
}
