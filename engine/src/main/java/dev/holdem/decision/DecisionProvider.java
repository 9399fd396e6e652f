package dev.holdem.decision;

import dev.holdem.table.Bet;

import java.util.Optional;

/**
 * Source of betting decisions for one player: a local strategy or a remote client.
 *
 * <p>An empty result means no decision could be obtained, for example because a remote
 * client timed out or disconnected.
 */
@FunctionalInterface
public interface DecisionProvider {

    Optional<Bet> decide(BetRequest request);
}
