package dev.holdem.table.handlers;

import dev.holdem.Errors;
import dev.holdem.cards.Card;
import dev.holdem.hand.HandComparator;
import dev.holdem.hand.PlayerHand;
import dev.holdem.hand.Winner;
import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Decides the round winner from the players who did not fold.
 */
public final class ShowdownHandler {
    private static final Logger logger = LoggerFactory.getLogger(ShowdownHandler.class);

    private ShowdownHandler() {}

    /**
     * Evaluate every remaining hand and record the winner on the table.
     *
     * @throws Errors.InvariantViolationError if nobody is left in the hand
     */
    public static Winner showdown(TableState state) {
        List<PlayerHand> hands = hands(state);
        if (hands.isEmpty()) {
            throw new Errors.InvariantViolationError("Showdown with no players");
        }
        Winner winner = hands.size() == 1 ? Winner.sole(hands.get(0)) : HandComparator.determineWinner(hands);
        state.setWinner(winner);
        logger.info("showdown", kv("winner", winner.getNames()), kv("contenders", hands.size()));
        return winner;
    }

    /**
     * Best hand of every non-folded player, in seating order.
     */
    public static List<PlayerHand> hands(TableState state) {
        List<PlayerHand> hands = new ArrayList<>();
        for (Player player : state.getNonFoldedPlayers()) {
            List<Card> cards = new ArrayList<>(player.getHoleCards());
            cards.addAll(state.getCommunityCards());
            hands.add(PlayerHand.of(player.getName(), cards));
        }
        return hands;
    }
}
