package dev.holdem.table.handlers;

import dev.holdem.Errors;
import dev.holdem.events.PotsAwarded;
import dev.holdem.hand.PlayerHand;
import dev.holdem.hand.Winner;
import dev.holdem.pots.Contender;
import dev.holdem.pots.Payouts;
import dev.holdem.pots.PotDistributor;
import dev.holdem.pots.PotLedger;
import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Pays the pots out to the showdown winners.
 */
public final class DistributionHandler {
    private static final Logger logger = LoggerFactory.getLogger(DistributionHandler.class);

    private DistributionHandler() {}

    /**
     * Credit winnings to bank rolls and empty the pots.
     *
     * @return the payouts, or empty when no winner has been decided
     * @throws Errors.InvariantViolationError if a winner is not in the hand or chips go missing
     */
    public static Optional<Payouts> distribute(TableState state) {
        // Guard
        Winner winner = state.getWinner();
        if (winner == null) {
            logger.warn("distribution_without_winner", kv("stage", state.getStage()));
            return Optional.empty();
        }

        // Compute
        List<Contender> contenders = new ArrayList<>();
        for (PlayerHand hand : ShowdownHandler.hands(state)) {
            contenders.add(new Contender(hand, state.getPlayer(hand.name()).isAllIn()));
        }
        PotLedger ledger = state.getLedger();
        Payouts payouts = PotDistributor.distribute(ledger.getPot(), ledger.getSidePots(), contenders,
            winner, state.getConfig().remainderPolicy());
        if (payouts.total() != ledger.total()) {
            throw new Errors.InvariantViolationError(String.format(
                "Distributed %d chips from pots holding %d", payouts.total(), ledger.total()));
        }

        // Apply
        for (Map.Entry<String, Long> entry : payouts.winnings().entrySet()) {
            Player player = state.getPlayer(entry.getKey());
            player.setBankRoll(player.getBankRoll() + entry.getValue());
        }
        state.addPaidOut(payouts.discarded());
        ledger.clear();
        state.publish(new PotsAwarded(payouts.nonZero()));
        return Optional.of(payouts);
    }
}
