package dev.holdem.table;

/**
 * Stages of a round, in the order they are played.
 */
public enum Stage {
    BLINDS("Blinds"),
    HOLE("Hole"),
    PRE_FLOP("Pre-Flop"),
    FLOP("Flop"),
    TURN("Turn"),
    RIVER("River"),
    SHOW_DOWN("Showdown");

    private final String displayName;

    Stage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * The stage that follows this one. Showdown wraps to the blinds of the next round.
     */
    public Stage next() {
        return switch (this) {
            case BLINDS -> HOLE;
            case HOLE -> PRE_FLOP;
            case PRE_FLOP -> FLOP;
            case FLOP -> TURN;
            case TURN -> RIVER;
            case RIVER -> SHOW_DOWN;
            case SHOW_DOWN -> BLINDS;
        };
    }

    /**
     * Returns true for the stages in which players are asked to bet.
     */
    public boolean isBetting() {
        return this == PRE_FLOP || this == FLOP || this == TURN || this == RIVER;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
