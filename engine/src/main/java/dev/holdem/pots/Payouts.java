package dev.holdem.pots;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of distributing the pots.
 *
 * @param winnings  chips won per contender, in seat order, zero for those who won nothing
 * @param discarded chips removed from the table by the remainder policy
 */
public record Payouts(Map<String, Long> winnings, long discarded) {

    public Payouts {
        winnings = Collections.unmodifiableMap(new LinkedHashMap<>(winnings));
    }

    public long winningsOf(String player) {
        return winnings.getOrDefault(player, 0L);
    }

    public long total() {
        long total = discarded;
        for (long amount : winnings.values()) {
            total += amount;
        }
        return total;
    }

    /**
     * Only the players who won something.
     */
    public Map<String, Long> nonZero() {
        Map<String, Long> result = new LinkedHashMap<>();
        winnings.forEach((player, amount) -> {
            if (amount > 0) {
                result.put(player, amount);
            }
        });
        return result;
    }
}
