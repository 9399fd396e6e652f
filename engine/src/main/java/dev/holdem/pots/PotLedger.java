package dev.holdem.pots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Tracks what each player has put in this round and splits it into the main pot and side pots.
 *
 * <p>Every all-in opens a side pot at the all-in player's total contribution. Pots are ordered by
 * threshold: the main pot holds contributions up to the lowest threshold, and each side pot holds
 * contributions between its own threshold and the next higher one. Amounts are recomputed from the
 * contributions after each payment, so they never depend on the order players acted in.
 */
public class PotLedger {
    private static final Logger logger = LoggerFactory.getLogger(PotLedger.class);

    private final Map<String, Long> contributions = new LinkedHashMap<>();
    private final List<SidePot> sidePots = new ArrayList<>();
    private long pot;

    /**
     * Record a payment into the pot.
     */
    public void contribute(String player, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("negative contribution: " + amount);
        }
        if (amount == 0) {
            return;
        }
        contributions.merge(player, amount, Long::sum);
        rebalance();
    }

    /**
     * Open a side pot for a player who has just gone all-in.
     *
     * <p>The all-in player is dropped from any existing side pot at or above their level, since they
     * put nothing into it. Players who went all-in earlier at a higher level join the new pot.
     *
     * @param allInPlayer the player who went all-in, after their final payment was recorded
     * @param eligible    players still able to bet, in seat order
     * @return the new side pot
     */
    public SidePot openSidePot(String allInPlayer, List<String> eligible) {
        long level = contributionOf(allInPlayer);
        List<String> players = new ArrayList<>(eligible);
        players.remove(allInPlayer);
        for (SidePot existing : sidePots) {
            if (existing.getThreshold() >= level) {
                existing.removePlayer(allInPlayer);
            }
            // Earlier all-ins above this level also paid into the new lane
            if (existing.getThreshold() > level && !players.contains(existing.getOwner())) {
                players.add(existing.getOwner());
            }
        }
        SidePot sidePot = new SidePot(allInPlayer, level, players);
        sidePots.add(sidePot);
        rebalance();
        logger.debug("side_pot_opened", kv("player", allInPlayer), kv("threshold", level),
            kv("eligible", players));
        return sidePot;
    }

    public long contributionOf(String player) {
        return contributions.getOrDefault(player, 0L);
    }

    public Map<String, Long> getContributions() {
        return Collections.unmodifiableMap(contributions);
    }

    /**
     * The main pot.
     */
    public long getPot() {
        return pot;
    }

    /**
     * Side pots in the order they were opened.
     */
    public List<SidePot> getSidePots() {
        return Collections.unmodifiableList(sidePots);
    }

    /**
     * Main pot plus every side pot. Always equals the sum of contributions.
     */
    public long total() {
        long total = pot;
        for (SidePot sidePot : sidePots) {
            total += sidePot.getAmount();
        }
        return total;
    }

    /**
     * Empty the ledger for the next round.
     */
    public void clear() {
        contributions.clear();
        sidePots.clear();
        pot = 0;
    }

    private void rebalance() {
        List<SidePot> byLevel = new ArrayList<>(sidePots);
        byLevel.sort(Comparator.comparingLong(SidePot::getThreshold));

        long mainCap = byLevel.isEmpty() ? Long.MAX_VALUE : byLevel.get(0).getThreshold();
        pot = sumBetween(0, mainCap);
        for (int i = 0; i < byLevel.size(); i++) {
            long low = byLevel.get(i).getThreshold();
            long high = i + 1 < byLevel.size() ? byLevel.get(i + 1).getThreshold() : Long.MAX_VALUE;
            byLevel.get(i).setAmount(sumBetween(low, high));
        }
    }

    private long sumBetween(long low, long high) {
        long sum = 0;
        for (long contribution : contributions.values()) {
            sum += Math.max(0, Math.min(contribution, high) - low);
        }
        return sum;
    }
}
