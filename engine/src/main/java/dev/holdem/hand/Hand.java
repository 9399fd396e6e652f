package dev.holdem.hand;

import dev.holdem.cards.Rank;

import java.util.List;

/**
 * A ranked poker hand: its category plus the ranks needed to order hands of that category.
 *
 * <ul>
 *   <li>HIGH_CARD, ONE_PAIR, THREE_OF_A_KIND, FOUR_OF_A_KIND: the grouped rank</li>
 *   <li>TWO_PAIR: high pair, low pair</li>
 *   <li>STRAIGHT, STRAIGHT_FLUSH: top rank of the run</li>
 *   <li>FLUSH: the five ranks, highest first</li>
 *   <li>FULL_HOUSE: triple rank, pair rank</li>
 * </ul>
 */
public record Hand(HandCategory category, List<Rank> ranks) implements Comparable<Hand> {

    public Hand {
        ranks = List.copyOf(ranks);
    }

    public static Hand highCard(Rank rank) {
        return new Hand(HandCategory.HIGH_CARD, List.of(rank));
    }

    public static Hand onePair(Rank rank) {
        return new Hand(HandCategory.ONE_PAIR, List.of(rank));
    }

    public static Hand twoPair(Rank high, Rank low) {
        return new Hand(HandCategory.TWO_PAIR, List.of(high, low));
    }

    public static Hand threeOfAKind(Rank rank) {
        return new Hand(HandCategory.THREE_OF_A_KIND, List.of(rank));
    }

    public static Hand straight(Rank top) {
        return new Hand(HandCategory.STRAIGHT, List.of(top));
    }

    public static Hand flush(List<Rank> descending) {
        if (descending.size() != 5) {
            throw new IllegalArgumentException("A flush needs five ranks");
        }
        return new Hand(HandCategory.FLUSH, descending);
    }

    public static Hand fullHouse(Rank triple, Rank pair) {
        return new Hand(HandCategory.FULL_HOUSE, List.of(triple, pair));
    }

    public static Hand fourOfAKind(Rank rank) {
        return new Hand(HandCategory.FOUR_OF_A_KIND, List.of(rank));
    }

    public static Hand straightFlush(Rank top) {
        return new Hand(HandCategory.STRAIGHT_FLUSH, List.of(top));
    }

    /**
     * Orders by category, then by the embedded ranks position by position.
     */
    @Override
    public int compareTo(Hand other) {
        int byCategory = category.compareTo(other.category);
        if (byCategory != 0) {
            return byCategory;
        }
        for (int i = 0; i < Math.min(ranks.size(), other.ranks.size()); i++) {
            int byRank = ranks.get(i).compareTo(other.ranks.get(i));
            if (byRank != 0) {
                return byRank;
            }
        }
        return Integer.compare(ranks.size(), other.ranks.size());
    }

    @Override
    public String toString() {
        String name = category.getDisplayName();
        switch (category) {
            case TWO_PAIR:
                return String.format("%s (%s and %s)", name, ranks.get(0), ranks.get(1));
            case STRAIGHT:
            case STRAIGHT_FLUSH:
                return String.format("%s (ending %s)", name, ranks.get(0));
            case FLUSH:
                return String.format("%s (%s to %s)", name, ranks.get(0), ranks.get(4));
            case FULL_HOUSE:
                return String.format("%s (%s %s)", name, ranks.get(0), ranks.get(1));
            default:
                return String.format("%s (%s)", name, ranks.get(0));
        }
    }
}
