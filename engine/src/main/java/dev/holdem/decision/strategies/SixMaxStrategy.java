package dev.holdem.decision.strategies;

import dev.holdem.cards.Card;
import dev.holdem.cards.Rank;
import dev.holdem.decision.BetRequest;
import dev.holdem.decision.DecisionProvider;
import dev.holdem.hand.CardGroups;
import dev.holdem.table.Bet;
import dev.holdem.table.Stage;

import java.util.List;
import java.util.Optional;

/**
 * Plays only strong starting hands and raises up to twice per stage with them.
 *
 * <p>Pre-flop, a hand is played when the hole cards are a pair, or when the higher card is
 * <ul>
 *   <li>an ace with a jack or better, or suited with a five or better,</li>
 *   <li>a king with a jack or better, or suited with a ten or better,</li>
 *   <li>a queen with a jack.</li>
 * </ul>
 * Anything else is folded unless checking is free. After the flop it keeps betting.
 */
public class SixMaxStrategy implements DecisionProvider {
    static final int MAX_RAISES_PER_STAGE = 2;

    @Override
    public Optional<Bet> decide(BetRequest request) {
        if (request.bankRoll() == 0) {
            return Optional.of(Bet.fold());
        }
        if (request.stage() == Stage.PRE_FLOP && !isPlayable(request.holeCards())) {
            return Optional.of(request.canCheck() ? Bet.check() : Bet.fold());
        }
        return Optional.of(aggressive(request));
    }

    private static Bet aggressive(BetRequest request) {
        long call = request.call();
        long bankRoll = request.bankRoll();
        if (bankRoll <= call) {
            return Bet.allIn();
        }
        long raise = call + request.min();
        if (request.cycle() < MAX_RAISES_PER_STAGE && raise < bankRoll) {
            return Bet.raise(raise);
        }
        return request.canCheck() ? Bet.check() : Bet.call();
    }

    static boolean isPlayable(List<Card> holeCards) {
        if (holeCards.size() != 2) {
            return false;
        }
        List<Card> sorted = CardGroups.descending(holeCards);
        Rank high = sorted.get(0).rank();
        Rank low = sorted.get(1).rank();
        if (high == low) {
            return true;
        }
        boolean suited = CardGroups.sameSuit(sorted);
        return switch (high) {
            case ACE -> low.compareTo(Rank.TEN) > 0 || suited && low.compareTo(Rank.FOUR) > 0;
            case KING -> low.compareTo(Rank.TEN) > 0 || suited && low.compareTo(Rank.NINE) > 0;
            case QUEEN -> low.compareTo(Rank.TEN) > 0;
            default -> false;
        };
    }
}
