package dev.holdem.decision.remote;

import dev.holdem.table.Bet;

import java.io.IOException;
import java.util.Optional;

/**
 * Transport to one remote player, such as a WebSocket session.
 *
 * <p>Only the connection task calls these methods, from a single thread.
 */
public interface PlayerConnection extends AutoCloseable {

    void send(OutboundMessage message) throws IOException;

    /**
     * Block until the player answers the last bet request.
     *
     * @return the bet, or empty if the player disconnected
     */
    Optional<Bet> awaitBet() throws IOException;

    @Override
    void close();
}
