package dev.holdem.cards;

import java.util.Comparator;

/**
 * A playing card. Cards order by rank, then suit.
 */
public record Card(Rank rank, Suit suit) implements Comparable<Card> {

    private static final Comparator<Card> ORDER =
        Comparator.comparing(Card::rank).thenComparing(Card::suit);

    public Card {
        if (rank == null || suit == null) {
            throw new IllegalArgumentException("rank and suit are required");
        }
    }

    public static Card of(Rank rank, Suit suit) {
        return new Card(rank, suit);
    }

    /**
     * Parse the short form used in logs and tests, e.g. "As", "Td", "9c".
     */
    public static Card parse(String code) {
        if (code == null || code.length() != 2) {
            throw new IllegalArgumentException("Card code must have two characters: " + code);
        }
        return new Card(parseRank(code.charAt(0)), parseSuit(code.charAt(1)));
    }

    /**
     * Short form, e.g. "As".
     */
    public String code() {
        return rank.getSymbol() + suit.getSymbol();
    }

    @Override
    public int compareTo(Card other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return rank + " of " + suit;
    }

    private static Rank parseRank(char c) {
        switch (Character.toUpperCase(c)) {
            case 'T': return Rank.TEN;
            case 'J': return Rank.JACK;
            case 'Q': return Rank.QUEEN;
            case 'K': return Rank.KING;
            case 'A': return Rank.ACE;
            default:
                if (c >= '2' && c <= '9') {
                    return Rank.fromValue(c - '0');
                }
                throw new IllegalArgumentException("Unknown rank: " + c);
        }
    }

    private static Suit parseSuit(char c) {
        switch (Character.toLowerCase(c)) {
            case 'c': return Suit.CLUBS;
            case 's': return Suit.SPADES;
            case 'd': return Suit.DIAMONDS;
            case 'h': return Suit.HEARTS;
            default: throw new IllegalArgumentException("Unknown suit: " + c);
        }
    }
}
