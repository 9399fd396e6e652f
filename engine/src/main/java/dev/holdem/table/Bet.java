package dev.holdem.table;

import java.util.Objects;

/**
 * A betting action.
 *
 * <p>For {@link BetType#RAISE} the amount is what the player puts in now and must exceed the call.
 * For {@link BetType#CALL} and {@link BetType#ALL_IN} the amount is what the engine actually took,
 * decision providers may leave it at zero.
 */
public final class Bet {
    private final BetType type;
    private final long amount;

    private Bet(BetType type, long amount) {
        this.type = type;
        this.amount = amount;
    }

    public static Bet fold() {
        return new Bet(BetType.FOLD, 0);
    }

    public static Bet check() {
        return new Bet(BetType.CHECK, 0);
    }

    public static Bet call() {
        return new Bet(BetType.CALL, 0);
    }

    public static Bet call(long paid) {
        return new Bet(BetType.CALL, paid);
    }

    public static Bet raise(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("raise must be positive: " + amount);
        }
        return new Bet(BetType.RAISE, amount);
    }

    public static Bet allIn() {
        return new Bet(BetType.ALL_IN, 0);
    }

    public static Bet allIn(long paid) {
        return new Bet(BetType.ALL_IN, paid);
    }

    public BetType getType() {
        return type;
    }

    public long getAmount() {
        return amount;
    }

    public boolean isFold() {
        return type == BetType.FOLD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bet other)) {
            return false;
        }
        return type == other.type && amount == other.amount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, amount);
    }

    @Override
    public String toString() {
        return switch (type) {
            case FOLD -> "Fold";
            case CHECK -> "Check";
            case CALL -> amount == 0 ? "Call" : "Call (" + amount + ")";
            case RAISE -> "Raise (" + amount + ")";
            case ALL_IN -> amount == 0 ? "All-In" : "All-In (" + amount + ")";
        };
    }
}
