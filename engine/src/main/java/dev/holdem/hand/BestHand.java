package dev.holdem.hand;

import dev.holdem.cards.Card;

import java.util.List;

/**
 * The best hand found in a set of cards, with the five cards that make it.
 */
public record BestHand(Hand hand, List<Card> cards) {

    public BestHand {
        cards = List.copyOf(cards);
    }

    public HandCategory category() {
        return hand.category();
    }

    @Override
    public String toString() {
        return hand.toString();
    }
}
