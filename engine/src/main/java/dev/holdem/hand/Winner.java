package dev.holdem.hand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of a comparison: one sole winner, or a draw between two or more equal hands.
 */
public final class Winner {

    private final List<PlayerHand> hands;

    private Winner(List<PlayerHand> hands) {
        this.hands = Collections.unmodifiableList(new ArrayList<>(hands));
    }

    public static Winner sole(PlayerHand hand) {
        return new Winner(List.of(hand));
    }

    public static Winner draw(List<PlayerHand> hands) {
        if (hands.size() < 2) {
            throw new IllegalArgumentException("A draw needs at least two hands");
        }
        return new Winner(hands);
    }

    public boolean isDraw() {
        return hands.size() > 1;
    }

    /**
     * The sole winner's hand.
     *
     * @throws IllegalStateException for a draw
     */
    public PlayerHand getSoleWinner() {
        if (isDraw()) {
            throw new IllegalStateException("Round ended in a draw");
        }
        return hands.get(0);
    }

    /**
     * Every winning hand, one for a sole winner.
     */
    public List<PlayerHand> getHands() {
        return hands;
    }

    public Set<String> getNames() {
        return hands.stream()
            .map(PlayerHand::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String toString() {
        if (!isDraw()) {
            PlayerHand w = hands.get(0);
            return "Winner: " + w.name() + " (" + w.bestHand() + ")";
        }
        return "Draw: " + hands.stream()
            .map(PlayerHand::toString)
            .collect(Collectors.joining(", "));
    }
}
