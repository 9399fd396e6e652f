package dev.holdem.decision.strategies;

import dev.holdem.decision.BetRequest;
import dev.holdem.decision.DecisionProvider;
import dev.holdem.table.Bet;

import java.util.Optional;

/**
 * Never raises: checks when it can, calls when it must, and goes all-in when the call
 * takes everything.
 */
public class CheckCallStrategy implements DecisionProvider {

    @Override
    public Optional<Bet> decide(BetRequest request) {
        return Optional.of(passive(request));
    }

    static Bet passive(BetRequest request) {
        if (request.bankRoll() == 0) {
            return Bet.fold();
        }
        if (request.bankRoll() <= request.call()) {
            return Bet.allIn();
        }
        return request.canCheck() ? Bet.check() : Bet.call();
    }
}
