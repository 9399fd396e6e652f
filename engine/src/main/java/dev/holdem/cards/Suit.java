package dev.holdem.cards;

/**
 * Card suit.
 */
public enum Suit {
    CLUBS("Clubs", "c"),
    SPADES("Spades", "s"),
    DIAMONDS("Diamonds", "d"),
    HEARTS("Hearts", "h");

    private final String displayName;
    private final String symbol;

    Suit(String displayName, String symbol) {
        this.displayName = displayName;
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
