package dev.holdem.pots;

import dev.holdem.Errors;
import dev.holdem.hand.HandComparator;
import dev.holdem.hand.PlayerHand;
import dev.holdem.hand.Winner;
import dev.holdem.table.RemainderPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Works out who receives the main pot and each side pot after a showdown.
 *
 * <p>Pure computation: bank rolls are not touched here.
 */
public final class PotDistributor {
    private static final Logger logger = LoggerFactory.getLogger(PotDistributor.class);

    private PotDistributor() {}

    /**
     * Distribute the pots.
     *
     * @param mainPot    chips in the main pot
     * @param sidePots   side pots in the order they were opened
     * @param contenders every non-folded player, in seat order
     * @param winner     showdown result over the contenders
     * @param policy     what to do with chips that do not split evenly
     * @return winnings per contender plus any discarded remainder
     * @throws Errors.InvariantViolationError if a winner is not among the contenders
     */
    public static Payouts distribute(long mainPot, List<SidePot> sidePots, List<Contender> contenders,
                                     Winner winner, RemainderPolicy policy) {
        Map<String, Contender> byName = new LinkedHashMap<>();
        for (Contender contender : contenders) {
            byName.put(contender.name(), contender);
        }
        // Guard
        for (String name : winner.getNames()) {
            if (!byName.containsKey(name)) {
                throw new Errors.InvariantViolationError(
                    "Winner " + name + " is not an active player: " + byName.keySet());
            }
        }

        Split split = new Split(byName.keySet(), policy);
        List<String> winners = new ArrayList<>(winner.getNames());

        if (!winner.isDraw()) {
            String sole = winners.get(0);
            split.award(mainPot, winners);
            boolean allIn = byName.get(sole).allIn();
            for (SidePot sidePot : sidePots) {
                if (allIn) {
                    resolve(sidePot, byName, winners, split);
                } else {
                    split.award(sidePot.getAmount(), winners);
                }
            }
        } else {
            split.award(mainPot, winners);
            for (SidePot sidePot : sidePots) {
                resolve(sidePot, byName, winners, split);
            }
        }

        Payouts payouts = new Payouts(split.winnings, split.discarded);
        logger.info("pots_distributed", kv("winner", winners), kv("payouts", payouts.nonZero()),
            kv("discarded", payouts.discarded()));
        return payouts;
    }

    private static void resolve(SidePot sidePot, Map<String, Contender> byName,
                                List<String> fallback, Split split) {
        if (sidePot.getAmount() == 0) {
            return;
        }
        List<PlayerHand> candidates = new ArrayList<>();
        for (String name : sidePot.getPlayers()) {
            Contender contender = byName.get(name);
            if (contender != null) {
                candidates.add(contender.hand());
            }
        }
        if (candidates.isEmpty()) {
            split.award(sidePot.getAmount(), fallback);
            return;
        }
        Winner sideWinner = HandComparator.determineWinner(candidates);
        split.award(sidePot.getAmount(), new ArrayList<>(sideWinner.getNames()));
    }

    /**
     * Accumulates winnings and applies the remainder policy to uneven splits.
     */
    private static final class Split {
        private final List<String> seatOrder;
        private final RemainderPolicy policy;
        private final Map<String, Long> winnings = new LinkedHashMap<>();
        private long discarded;

        Split(Set<String> seatOrder, RemainderPolicy policy) {
            this.seatOrder = new ArrayList<>(seatOrder);
            this.policy = policy;
            for (String name : seatOrder) {
                winnings.put(name, 0L);
            }
        }

        void award(long amount, Collection<String> group) {
            if (amount == 0) {
                return;
            }
            List<String> ordered = new ArrayList<>(seatOrder);
            ordered.retainAll(group);
            long share = amount / ordered.size();
            long remainder = amount % ordered.size();
            for (String name : ordered) {
                winnings.merge(name, share, Long::sum);
            }
            if (remainder == 0) {
                return;
            }
            switch (policy) {
                case SEAT_ORDER -> winnings.merge(ordered.get(0), remainder, Long::sum);
                case DISCARD -> {
                    discarded += remainder;
                    logger.warn("split_remainder_discarded", kv("amount", remainder), kv("group", ordered));
                }
            }
        }
    }
}
