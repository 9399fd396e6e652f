package dev.holdem.hand;

/**
 * Hand categories from weakest to strongest.
 */
public enum HandCategory {
    HIGH_CARD("High Card"),
    ONE_PAIR("One Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush");

    private final String displayName;

    HandCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * True when a single top rank fully determines the hand, so equal hands are pure draws.
     */
    public boolean isSequence() {
        return this == STRAIGHT || this == STRAIGHT_FLUSH;
    }
}
