package dev.holdem.decision.strategies;

import dev.holdem.decision.BetRequest;
import dev.holdem.decision.DecisionProvider;
import dev.holdem.table.Bet;

import java.util.Optional;
import java.util.Random;

/**
 * Tosses a coin between calling and a small raise of one to two minimum raises on top of the call.
 */
public class ModestStrategy implements DecisionProvider {
    private final Random rng;

    public ModestStrategy(Random rng) {
        this.rng = rng;
    }

    @Override
    public Optional<Bet> decide(BetRequest request) {
        long bankRoll = request.bankRoll();
        if (bankRoll == 0 || bankRoll <= request.call() || !rng.nextBoolean()) {
            return Optional.of(CheckCallStrategy.passive(request));
        }
        // Stay one chip short of the bank roll so the raise never turns into an all-in
        long ceiling = Math.min(request.call() + request.min() * 2, bankRoll - 1);
        long floor = request.call() + request.min();
        if (ceiling <= floor) {
            return ceiling > request.call()
                ? Optional.of(Bet.raise(ceiling))
                : Optional.of(CheckCallStrategy.passive(request));
        }
        long amount = floor + (long) (rng.nextDouble() * (ceiling - floor));
        return Optional.of(Bet.raise(amount));
    }
}
