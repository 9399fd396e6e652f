package dev.holdem.hand;

import dev.holdem.Errors;
import dev.holdem.cards.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares player hands and reduces a field of hands to a winner or a draw group.
 */
public final class HandComparator {

    private HandComparator() {}

    /**
     * Strength comparison. Positive when {@code a} is stronger, negative when
     * {@code b} is stronger, zero for a draw.
     *
     * <p>Category and embedded ranks decide first. Straights and straight flushes with the
     * same top rank are draws. Anything else still tied falls to the five realizing cards,
     * compared highest first.
     */
    public static int compareStrength(PlayerHand a, PlayerHand b) {
        int byHand = a.hand().compareTo(b.hand());
        if (byHand != 0 || a.hand().category().isSequence()) {
            return Integer.signum(byHand);
        }
        return kickers(a, b);
    }

    /**
     * Compare two hands, resulting in a winner or a draw.
     */
    public static Winner compare(PlayerHand a, PlayerHand b) {
        int result = compareStrength(a, b);
        if (result > 0) {
            return Winner.sole(a);
        }
        if (result < 0) {
            return Winner.sole(b);
        }
        return Winner.draw(List.of(a, b));
    }

    /**
     * Reduce hands to a sole winner or a draw group.
     *
     * <p>A strictly better challenger replaces the leader and discards any draw group, an
     * equal challenger joins the group, a worse challenger is dropped. The winning set does
     * not depend on the order of {@code hands}.
     *
     * @throws Errors.InvariantViolationError if {@code hands} is empty
     */
    public static Winner determineWinner(List<PlayerHand> hands) {
        if (hands == null || hands.isEmpty()) {
            throw new Errors.InvariantViolationError("No players remaining to determine winner");
        }

        List<PlayerHand> leaders = new ArrayList<>();
        leaders.add(hands.get(0));
        for (PlayerHand challenger : hands.subList(1, hands.size())) {
            int result = compareStrength(challenger, leaders.get(0));
            if (result > 0) {
                leaders.clear();
                leaders.add(challenger);
            } else if (result == 0) {
                leaders.add(challenger);
            }
        }

        return leaders.size() == 1 ? Winner.sole(leaders.get(0)) : Winner.draw(leaders);
    }

    private static int kickers(PlayerHand a, PlayerHand b) {
        List<Card> cardsA = CardGroups.descending(a.bestHand().cards());
        List<Card> cardsB = CardGroups.descending(b.bestHand().cards());
        for (int i = 0; i < Math.min(cardsA.size(), cardsB.size()); i++) {
            int byRank = cardsA.get(i).rank().compareTo(cardsB.get(i).rank());
            if (byRank != 0) {
                return Integer.signum(byRank);
            }
        }
        return 0;
    }
}
