package dev.holdem.events;

import java.util.Map;

/**
 * Chips won by each player at the end of a round. Players who won nothing are omitted.
 */
public record PotsAwarded(Map<String, Long> payouts) implements GameEvent {

    public PotsAwarded {
        payouts = Map.copyOf(payouts);
    }
}
