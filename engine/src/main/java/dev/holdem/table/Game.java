package dev.holdem.table;

import dev.holdem.Errors;
import dev.holdem.events.EventSink;
import dev.holdem.events.GameWon;
import dev.holdem.events.PlayerJoined;
import dev.holdem.events.RoundWon;
import dev.holdem.hand.Winner;
import dev.holdem.names.Names;
import dev.holdem.table.handlers.AnteHandler;
import dev.holdem.table.handlers.BettingRound;
import dev.holdem.table.handlers.DealHandler;
import dev.holdem.table.handlers.DistributionHandler;
import dev.holdem.table.handlers.ResetHandler;
import dev.holdem.table.handlers.ShowdownHandler;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * A table playing rounds of Texas Hold'em until one player holds every chip.
 *
 * <p>Not thread safe: a game is driven by a single thread, which blocks while decision providers
 * answer.
 */
public class Game {
    private static final Logger logger = LoggerFactory.getLogger(Game.class);

    private final TableState state;

    public Game(GameConfig config) {
        this(config, new Random());
    }

    public Game(GameConfig config, Random rng) {
        this.state = new TableState(config, rng);
    }

    /**
     * A standard table with the given big blind.
     */
    public static Game build(long bigBlind, int maxPlayers) {
        return new Game(GameConfig.of(bigBlind, maxPlayers));
    }

    /**
     * Seat a player with the buy-in as bank roll.
     *
     * @return the name the player was seated under, suffixed if already taken
     * @throws Errors.CommandRejectedError if every seat is taken
     */
    public String join(Player player) {
        if (state.isFull()) {
            throw Errors.CommandRejectedError.preconditionFailed("Cannot add more players");
        }
        String name = Names.uniquify(player.getName(), state.getSeating());
        player.setName(name);
        state.seat(player, state.getConfig().buyIn());
        logger.info("player_joined", kv("player", name), kv("bank_roll", player.getBankRoll()));
        state.publish(new PlayerJoined(name, player.getBankRoll()));
        return name;
    }

    /**
     * Subscribe to every public event.
     */
    public void addSink(EventSink sink) {
        state.addSink(sink);
    }

    /**
     * Play until one player is left.
     *
     * @return the winner's name
     */
    public String play() {
        return play(0);
    }

    /**
     * Play until one player is left or {@code maxRounds} rounds have been played.
     *
     * @param maxRounds round limit, zero for none
     * @return the last player standing, or the chip leader when the limit was reached
     */
    public String play(int maxRounds) {
        if (state.getSeating().size() < GameConfig.MIN_PLAYERS) {
            throw Errors.CommandRejectedError.preconditionFailed(
                "Need at least " + GameConfig.MIN_PLAYERS + " players to play");
        }
        while (state.getSeating().size() > 1
            && (maxRounds == 0 || state.getRoundsPlayed() < maxRounds)) {
            playRound();
            resetAfterRound();
        }

        if (state.getSeating().size() > 1) {
            String leader = chipLeader();
            logger.info("round_limit_reached", kv("rounds", state.getRoundsPlayed()), kv("leader", leader));
            return leader;
        }
        Player winner = state.getPlayer(state.getSeating().get(0));
        logger.info("game_won", kv("player", winner.getName()), kv("bank_roll", winner.getBankRoll()),
            kv("rounds", state.getRoundsPlayed()));
        state.publish(new GameWon(winner.getName(), winner.getBankRoll()));
        return winner.getName();
    }

    /**
     * Play one round from the blinds to the payout.
     *
     * @return the round winner
     */
    public Winner playRound() {
        if (state.getSeating().size() < GameConfig.MIN_PLAYERS) {
            throw Errors.CommandRejectedError.preconditionFailed("Need at least two players for a round");
        }
        if (state.getStage() != Stage.BLINDS) {
            throw new Errors.InvariantViolationError("Round started during " + state.getStage());
        }
        logger.info("round_started", kv("round", state.getRoundsPlayed() + 1), kv("players", state.getSeating()));

        state.declareStage();
        AnteHandler.orderPlayers(state);
        AnteHandler.anteUp(state);

        state.advanceStage(Stage.HOLE);
        state.declareStage();
        DealHandler.dealHoleCards(state);

        state.advanceStage(Stage.PRE_FLOP);
        state.declareStage();
        new BettingRound(state).run();

        state.advanceStage(Stage.FLOP);
        DealHandler.dealFlop(state);
        state.declareStage();
        new BettingRound(state).run();

        state.advanceStage(Stage.TURN);
        DealHandler.dealTurn(state);
        state.declareStage();
        new BettingRound(state).run();

        state.advanceStage(Stage.RIVER);
        DealHandler.dealRiver(state);
        state.declareStage();
        new BettingRound(state).run();

        state.advanceStage(Stage.SHOW_DOWN);
        state.declareStage();
        Winner winner = ShowdownHandler.showdown(state);
        DistributionHandler.distribute(state);
        state.setRoundsPlayed(state.getRoundsPlayed() + 1);

        logger.info("round_won", kv("round", state.getRoundsPlayed()), kv("winner", winner.toString()));
        state.publish(new RoundWon(winner));
        return winner;
    }

    /**
     * Clear the table for the next round and remove players who cannot pay their blind.
     */
    public void resetAfterRound() {
        ResetHandler.reset(state);
    }

    public TableState getState() {
        return state;
    }

    public GameConfig getConfig() {
        return state.getConfig();
    }

    public List<String> getSeating() {
        return state.getSeating();
    }

    public Player getPlayer(String name) {
        return state.getPlayer(name);
    }

    public String getDealer() {
        return state.getDealer();
    }

    public Stage getStage() {
        return state.getStage();
    }

    public int getRoundsPlayed() {
        return state.getRoundsPlayed();
    }

    /**
     * Bank rolls, pots and chips already paid out. Constant over the whole game.
     */
    public long totalChips() {
        return state.totalChips();
    }

    /**
     * Richest seated player, the first in seating order on ties.
     */
    public String chipLeader() {
        Player leader = null;
        for (Player player : state.getPlayers()) {
            if (leader == null || player.getBankRoll() > leader.getBankRoll()) {
                leader = player;
            }
        }
        return leader == null ? null : leader.getName();
    }
}
