package dev.holdem.events;

import java.util.List;

/**
 * Seating and bank rolls at the start of a round, after the blinds.
 */
public record PlayersAnnounced(List<Seat> players, String dealer) implements GameEvent {

    public PlayersAnnounced {
        players = List.copyOf(players);
    }

    /**
     * One seated player.
     */
    public record Seat(String name, long bankRoll) {
    }
}
