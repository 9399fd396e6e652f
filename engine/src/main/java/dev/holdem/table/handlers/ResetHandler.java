package dev.holdem.table.handlers;

import dev.holdem.cards.Deck;
import dev.holdem.events.PlayerEliminated;
import dev.holdem.pots.PotLedger;
import dev.holdem.table.Player;
import dev.holdem.table.Stage;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Clears the table after a round, removes players who cannot pay their next blind, and moves the
 * dealer button.
 */
public final class ResetHandler {
    private static final Logger logger = LoggerFactory.getLogger(ResetHandler.class);

    private ResetHandler() {}

    public static void reset(TableState state) {
        refundUnsettledPots(state);
        state.getCommunityCards().clear();
        state.setDeck(Deck.shuffled(state.getRng()));
        state.setWinner(null);
        state.setStage(Stage.BLINDS);
        for (Player player : state.getPlayers()) {
            player.resetForRound();
        }

        List<String> seating = new ArrayList<>(state.getSeating());
        if (seating.isEmpty()) {
            return;
        }
        int dealerIndex = Math.max(0, seating.indexOf(state.getDealer()));

        // Nobody below the small blind can post anything
        List<String> leaving = new ArrayList<>();
        for (String name : seating) {
            if (state.getPlayer(name).getBankRoll() < state.getConfig().smallBlind()) {
                leaving.add(name);
            }
        }
        // Each removal can move the button and the small blind, so repeat until stable
        boolean changed = true;
        while (changed && leaving.size() < seating.size()) {
            changed = false;
            String dealer = nextDealer(seating, dealerIndex, leaving);
            String smallBlindSeat = nextDealer(seating, seating.indexOf(dealer), leaving);
            for (String name : seating) {
                if (leaving.contains(name)) {
                    continue;
                }
                long blind = name.equals(smallBlindSeat)
                    ? state.getConfig().smallBlind()
                    : state.getConfig().bigBlind();
                if (state.getPlayer(name).getBankRoll() < blind) {
                    leaving.add(name);
                    changed = true;
                }
            }
        }
        if (leaving.size() == seating.size()) {
            leaving.remove(richest(state, seating));
        }
        state.setDealer(nextDealer(seating, dealerIndex, leaving));

        for (String name : leaving) {
            long chips = state.getPlayer(name).getBankRoll();
            state.publish(new PlayerEliminated(name, chips));
            state.unseat(name);
            logger.info("player_eliminated", kv("player", name), kv("cashed_out", chips));
        }
    }

    /**
     * Return chips still in the pots to the players who put them there. Pots are only left
     * unsettled when a round was abandoned before distribution.
     */
    private static void refundUnsettledPots(TableState state) {
        PotLedger ledger = state.getLedger();
        if (ledger.total() > 0) {
            logger.warn("unsettled_pots_refunded", kv("pot", ledger.total()),
                kv("contributions", ledger.getContributions()));
            for (Map.Entry<String, Long> entry : ledger.getContributions().entrySet()) {
                if (state.isSeated(entry.getKey())) {
                    Player player = state.getPlayer(entry.getKey());
                    player.setBankRoll(player.getBankRoll() + entry.getValue());
                } else {
                    state.addPaidOut(entry.getValue());
                }
            }
        }
        ledger.clear();
    }

    /**
     * First player clockwise from {@code fromIndex} who is not leaving.
     */
    private static String nextDealer(List<String> seating, int fromIndex, List<String> leaving) {
        int seats = seating.size();
        for (int i = 1; i <= seats; i++) {
            String candidate = seating.get((fromIndex + i) % seats);
            if (!leaving.contains(candidate)) {
                return candidate;
            }
        }
        return seating.get(fromIndex);
    }

    private static String richest(TableState state, List<String> seating) {
        String richest = seating.get(0);
        for (String name : seating) {
            if (state.getPlayer(name).getBankRoll() > state.getPlayer(richest).getBankRoll()) {
                richest = name;
            }
        }
        return richest;
    }
}
