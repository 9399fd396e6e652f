package dev.holdem.pots;

import dev.holdem.hand.PlayerHand;

/**
 * A player still in the hand at showdown.
 */
public record Contender(PlayerHand hand, boolean allIn) {

    public String name() {
        return hand.name();
    }
}
