package dev.holdem.decision;

import dev.holdem.table.Bet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Turns a missing decision into a fold so that an unresponsive player cannot stall the table.
 */
public class FoldOnNoDecision implements DecisionProvider {
    private static final Logger logger = LoggerFactory.getLogger(FoldOnNoDecision.class);

    private final String player;
    private final DecisionProvider delegate;

    public FoldOnNoDecision(String player, DecisionProvider delegate) {
        this.player = player;
        this.delegate = delegate;
    }

    @Override
    public Optional<Bet> decide(BetRequest request) {
        Optional<Bet> bet = delegate.decide(request);
        if (bet.isEmpty()) {
            logger.warn("no_decision_folded", kv("player", player), kv("stage", request.stage()));
            return Optional.of(Bet.fold());
        }
        return bet;
    }
}
