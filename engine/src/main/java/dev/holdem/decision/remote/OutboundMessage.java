package dev.holdem.decision.remote;

import dev.holdem.decision.BetRequest;
import dev.holdem.events.GameEvent;

/**
 * A message from the table to a remote player.
 */
public interface OutboundMessage {

    /**
     * Ask the player for a bet. The connection answers with {@link PlayerConnection#awaitBet()}.
     */
    record PlaceBet(String player, BetRequest request) implements OutboundMessage {
    }

    /**
     * Tell the player what happened at the table.
     */
    record Update(GameEvent event) implements OutboundMessage {
    }
}
