package dev.holdem.hand;

import dev.holdem.cards.Card;
import dev.holdem.cards.Rank;
import dev.holdem.cards.Suit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rank and suit grouping helpers shared by the evaluator and the strategies.
 */
public final class CardGroups {

    /** Highest rank first, ties broken by suit so results never depend on input order. */
    public static final Comparator<Card> DESCENDING = Comparator.<Card>naturalOrder().reversed();

    private static final Comparator<List<Card>> LARGEST_THEN_HIGHEST =
        Comparator.<List<Card>>comparingInt(List::size).reversed()
            .thenComparing(group -> group.get(0).rank(), Comparator.reverseOrder());

    private CardGroups() {}

    /**
     * Group cards by rank. Groups are ordered by size (largest first), then by rank
     * (highest first); cards inside a group are ordered highest first.
     */
    public static List<List<Card>> groupByRank(Collection<Card> cards) {
        Map<Rank, List<Card>> byRank = new EnumMap<>(Rank.class);
        for (Card card : cards) {
            byRank.computeIfAbsent(card.rank(), r -> new ArrayList<>()).add(card);
        }
        return sortedGroups(byRank.values());
    }

    /**
     * Group cards by suit. Groups are ordered by size (largest first), then by their
     * highest card; cards inside a group are ordered highest first.
     */
    public static List<List<Card>> groupBySuit(Collection<Card> cards) {
        Map<Suit, List<Card>> bySuit = new EnumMap<>(Suit.class);
        for (Card card : cards) {
            bySuit.computeIfAbsent(card.suit(), s -> new ArrayList<>()).add(card);
        }
        return sortedGroups(bySuit.values());
    }

    /**
     * Longest run of consecutive ranks, one card per rank, ordered highest first.
     * When two runs have the same length the higher one wins. Aces only count high.
     */
    public static List<Card> longestRun(Collection<Card> cards) {
        TreeMap<Integer, Card> highestPerRank = new TreeMap<>();
        for (Card card : cards) {
            highestPerRank.merge(card.rank().getValue(), card,
                (a, b) -> a.compareTo(b) >= 0 ? a : b);
        }
        if (highestPerRank.isEmpty()) {
            return List.of();
        }

        int bestStart = highestPerRank.firstKey();
        int bestLength = 0;
        int start = bestStart;
        int length = 0;
        int previous = Integer.MIN_VALUE;
        for (int value : highestPerRank.keySet()) {
            if (value == previous + 1) {
                length++;
            } else {
                start = value;
                length = 1;
            }
            if (length >= bestLength) {
                bestLength = length;
                bestStart = start;
            }
            previous = value;
        }

        List<Card> run = new ArrayList<>(bestLength);
        for (int value = bestStart + bestLength - 1; value >= bestStart; value--) {
            run.add(highestPerRank.get(value));
        }
        return run;
    }

    /**
     * True when every card shares one suit. An empty collection counts as same-suited.
     */
    public static boolean sameSuit(Collection<Card> cards) {
        return cards.stream().map(Card::suit).distinct().count() <= 1;
    }

    /**
     * Cards sorted highest first.
     */
    public static List<Card> descending(Collection<Card> cards) {
        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(DESCENDING);
        return sorted;
    }

    private static List<List<Card>> sortedGroups(Collection<List<Card>> groups) {
        List<List<Card>> sorted = new ArrayList<>();
        for (List<Card> group : groups) {
            List<Card> g = new ArrayList<>(group);
            g.sort(DESCENDING);
            sorted.add(g);
        }
        sorted.sort(LARGEST_THEN_HIGHEST);
        return sorted;
    }
}
