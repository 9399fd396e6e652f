package dev.holdem.pots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chips staked above the all-in level of a player, contested only by those who could match them.
 *
 * <p>The amount is owned by {@link PotLedger}, which recomputes it after every payment.
 */
public class SidePot {
    private final String owner;
    private final long threshold;
    private final List<String> players;
    private long amount;

    SidePot(String owner, long threshold, List<String> players) {
        this.owner = owner;
        this.threshold = threshold;
        this.players = new ArrayList<>(players);
    }

    /**
     * The all-in player who opened this pot. Never eligible for it.
     */
    public String getOwner() {
        return owner;
    }

    /**
     * Round contribution of the all-in player who opened this pot.
     */
    public long getThreshold() {
        return threshold;
    }

    /**
     * Players eligible to win this pot, in seat order.
     */
    public List<String> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public long getAmount() {
        return amount;
    }

    public boolean isEligible(String player) {
        return players.contains(player);
    }

    void setAmount(long amount) {
        this.amount = amount;
    }

    void removePlayer(String player) {
        players.remove(player);
    }

    @Override
    public String toString() {
        return "SidePot{owner=" + owner + ", threshold=" + threshold + ", players=" + players + ", amount=" + amount + "}";
    }
}
