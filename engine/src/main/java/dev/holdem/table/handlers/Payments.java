package dev.holdem.table.handlers;

import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;

import java.util.ArrayList;
import java.util.List;

/**
 * Chip movements shared by the blinds and the betting round.
 */
final class Payments {

    private Payments() {}

    /**
     * Move chips from a player's bank roll into the pots.
     */
    static void pay(TableState state, Player player, long amount) {
        player.setBankRoll(player.getBankRoll() - amount);
        player.setStageBet(player.getStageBet() + amount);
        state.getLedger().contribute(player.getName(), amount);
    }

    /**
     * Put a player's whole bank roll in and open a side pot at their level.
     *
     * @return the chips paid
     */
    static long goAllIn(TableState state, Player player) {
        long amount = player.getBankRoll();
        pay(state, player, amount);
        player.setAllIn(true);
        List<String> eligible = new ArrayList<>();
        for (Player other : state.getPlayers()) {
            if (other.isActive()) {
                eligible.add(other.getName());
            }
        }
        state.getLedger().openSidePot(player.getName(), eligible);
        return amount;
    }
}
