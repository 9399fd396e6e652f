package dev.holdem.hand;

import dev.holdem.cards.Card;

import java.util.List;

/**
 * A player's best hand together with the full set of cards it was chosen from.
 */
public record PlayerHand(String name, BestHand bestHand, List<Card> cards) {

    public PlayerHand {
        cards = List.copyOf(cards);
    }

    /**
     * Evaluate {@code cards} and wrap the result.
     */
    public static PlayerHand of(String name, List<Card> cards) {
        return new PlayerHand(name, HandEvaluator.bestHand(cards), cards);
    }

    public Hand hand() {
        return bestHand.hand();
    }

    @Override
    public String toString() {
        return name + " (" + bestHand + ")";
    }
}
