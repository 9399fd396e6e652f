package dev.holdem.hand;

import dev.holdem.Errors;
import dev.holdem.cards.Card;
import dev.holdem.cards.Rank;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

/**
 * Finds the best five-card hand in five to seven cards.
 *
 * <p>Categories are tried strictly from strongest to weakest. Straights are ace-high only.
 */
public final class HandEvaluator {

    public static final int HAND_SIZE = 5;
    public static final int MAX_CARDS = 7;

    private HandEvaluator() {}

    /**
     * Evaluate the best hand.
     *
     * @param cards five to seven distinct cards, in any order
     * @return the hand and the five cards that realize it
     * @throws Errors.CommandRejectedError if the card count is out of range or cards repeat
     */
    public static BestHand bestHand(Collection<Card> cards) {
        // Validate
        if (cards == null || cards.size() < HAND_SIZE || cards.size() > MAX_CARDS) {
            throw Errors.CommandRejectedError.invalidArgument(
                "best hand needs 5 to 7 cards, got " + (cards == null ? 0 : cards.size()));
        }
        if (new HashSet<>(cards).size() != cards.size()) {
            throw Errors.CommandRejectedError.invalidArgument("cards must be distinct: " + cards);
        }

        List<Card> sorted = CardGroups.descending(cards);
        List<List<Card>> ranks = CardGroups.groupByRank(sorted);
        List<List<Card>> suits = CardGroups.groupBySuit(sorted);
        List<Card> flushCards = suits.get(0).size() >= HAND_SIZE ? suits.get(0) : List.of();

        // Straight flush: a run of five inside the flush suit
        if (!flushCards.isEmpty()) {
            List<Card> run = CardGroups.longestRun(flushCards);
            if (run.size() >= HAND_SIZE) {
                List<Card> top = run.subList(0, HAND_SIZE);
                return new BestHand(Hand.straightFlush(top.get(0).rank()), top);
            }
        }

        List<Card> first = ranks.get(0);
        List<Card> second = ranks.size() > 1 ? ranks.get(1) : List.of();

        if (first.size() == 4) {
            return new BestHand(Hand.fourOfAKind(first.get(0).rank()),
                withKickers(first, sorted));
        }

        if (first.size() == 3 && second.size() >= 2) {
            List<Card> cardsUsed = new ArrayList<>(first);
            cardsUsed.addAll(second.subList(0, 2));
            return new BestHand(Hand.fullHouse(first.get(0).rank(), second.get(0).rank()), cardsUsed);
        }

        if (!flushCards.isEmpty()) {
            List<Card> top = flushCards.subList(0, HAND_SIZE);
            List<Rank> flushRanks = new ArrayList<>(HAND_SIZE);
            for (Card card : top) {
                flushRanks.add(card.rank());
            }
            return new BestHand(Hand.flush(flushRanks), top);
        }

        List<Card> run = CardGroups.longestRun(sorted);
        if (run.size() >= HAND_SIZE) {
            List<Card> top = run.subList(0, HAND_SIZE);
            return new BestHand(Hand.straight(top.get(0).rank()), top);
        }

        if (first.size() == 3) {
            return new BestHand(Hand.threeOfAKind(first.get(0).rank()),
                withKickers(first, sorted));
        }

        if (first.size() == 2 && second.size() == 2) {
            List<Card> pairs = new ArrayList<>(first);
            pairs.addAll(second);
            return new BestHand(Hand.twoPair(first.get(0).rank(), second.get(0).rank()),
                withKickers(pairs, sorted));
        }

        if (first.size() == 2) {
            return new BestHand(Hand.onePair(first.get(0).rank()), withKickers(first, sorted));
        }

        return new BestHand(Hand.highCard(sorted.get(0).rank()), sorted.subList(0, HAND_SIZE));
    }

    /**
     * The category cards followed by the highest remaining cards, five in total.
     */
    private static List<Card> withKickers(List<Card> core, List<Card> sortedDescending) {
        List<Card> result = new ArrayList<>(core);
        for (Card card : sortedDescending) {
            if (result.size() == HAND_SIZE) {
                break;
            }
            if (!core.contains(card)) {
                result.add(card);
            }
        }
        return result;
    }
}
