package dev.holdem.decision;

import dev.holdem.cards.Card;
import dev.holdem.table.Stage;

import java.util.List;

/**
 * Everything a player sees when asked to bet.
 *
 * @param call           chips needed to stay in the hand, zero when checking is allowed
 * @param min            minimum raise size (the big blind)
 * @param stage          current betting stage
 * @param cycle          number of raises made so far in this stage
 * @param communityCards cards on the board
 * @param holeCards      the player's own cards
 * @param bankRoll       chips the player still holds
 */
public record BetRequest(long call, long min, Stage stage, int cycle,
                         List<Card> communityCards, List<Card> holeCards, long bankRoll) {

    public BetRequest {
        communityCards = List.copyOf(communityCards);
        holeCards = List.copyOf(holeCards);
    }

    public boolean canCheck() {
        return call == 0;
    }
}
