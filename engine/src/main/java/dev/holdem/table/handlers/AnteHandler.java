package dev.holdem.table.handlers;

import dev.holdem.events.PlayersAnnounced;
import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Seating rotation and blinds at the start of a round.
 */
public final class AnteHandler {
    private static final Logger logger = LoggerFactory.getLogger(AnteHandler.class);

    private AnteHandler() {}

    /**
     * Rotate the seating so the player left of the dealer comes first and the dealer last.
     * On the first round the first seated player deals.
     */
    public static void orderPlayers(TableState state) {
        List<String> seating = state.getSeating();
        if (seating.isEmpty()) {
            return;
        }
        if (state.getDealer() == null || !state.isSeated(state.getDealer())) {
            state.setDealer(seating.get(0));
        }
        int dealerIndex = seating.indexOf(state.getDealer());
        List<String> order = new ArrayList<>(seating.size());
        for (int i = 1; i <= seating.size(); i++) {
            order.add(seating.get((dealerIndex + i) % seating.size()));
        }
        state.reorderSeating(order);
    }

    /**
     * Collect the blinds: the first player pays the small blind, everyone else the big blind.
     *
     * <p>A player who cannot cover their blind pays what they have and is all-in. A player with
     * nothing left sits the round out as folded.
     */
    public static void anteUp(TableState state) {
        List<Player> players = state.getPlayers();
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            long blind = i == 0 ? state.getConfig().smallBlind() : state.getConfig().bigBlind();
            long bankRoll = player.getBankRoll();
            if (bankRoll > blind) {
                Payments.pay(state, player, blind);
            } else if (bankRoll > 0) {
                Payments.goAllIn(state, player);
                logger.info("blind_all_in", kv("player", player.getName()), kv("amount", bankRoll));
            } else {
                player.setFolded(true);
                logger.info("blind_skipped", kv("player", player.getName()));
            }
        }

        List<PlayersAnnounced.Seat> seats = new ArrayList<>(players.size());
        for (Player player : players) {
            seats.add(new PlayersAnnounced.Seat(player.getName(), player.getBankRoll()));
        }
        logger.info("blinds_posted", kv("dealer", state.getDealer()), kv("pot", state.getLedger().total()));
        state.publish(new PlayersAnnounced(seats, state.getDealer()));
    }
}
