package dev.holdem.table.handlers;

import dev.holdem.Errors;
import dev.holdem.decision.BetRequest;
import dev.holdem.events.BetPlaced;
import dev.holdem.table.Bet;
import dev.holdem.table.Player;
import dev.holdem.table.Stage;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * One stage of betting.
 *
 * <p>Players are asked in seating order until every player who can still bet has acted since the
 * last raise and matched the highest stage bet, or fewer than two players remain in the hand.
 * Blinds are collected as antes, so each stage starts with nothing to call.
 */
public class BettingRound {
    private static final Logger logger = LoggerFactory.getLogger(BettingRound.class);

    private final TableState state;
    private final Stage stage;
    private long currentBet;
    private int cycle;

    public BettingRound(TableState state) {
        this.state = state;
        this.stage = state.getStage();
        for (Player player : state.getPlayers()) {
            player.setStageBet(0);
            player.setHasActed(false);
        }
    }

    public long getCurrentBet() {
        return currentBet;
    }

    /**
     * Number of raises so far in this stage.
     */
    public int getCycle() {
        return cycle;
    }

    /**
     * Chips the player must add to match the highest stage bet.
     */
    public long callFor(Player player) {
        return currentBet - player.getStageBet();
    }

    /**
     * Ask players for bets until the stage is settled.
     *
     * @throws Errors.NoDecisionError if a provider gives no decision
     * @throws Errors.ProtocolViolationError if a provider makes an illegal bet
     */
    public void run() {
        List<Player> order = state.getPlayers();
        int index = 0;
        while (!isComplete()) {
            Player player = order.get(index % order.size());
            index++;
            if (!player.isActive() || (player.hasActed() && callFor(player) == 0)) {
                continue;
            }
            BetRequest request = new BetRequest(callFor(player), state.getConfig().bigBlind(), stage,
                cycle, state.getCommunityCards(), player.getHoleCards(), player.getBankRoll());
            Optional<Bet> decision = player.getProvider().decide(request);
            if (decision.isEmpty()) {
                throw new Errors.NoDecisionError(player.getName(), stage.getDisplayName());
            }
            apply(player.getName(), decision.get());
        }
        logger.debug("betting_complete", kv("stage", stage), kv("current_bet", currentBet),
            kv("raises", cycle), kv("pot", state.getLedger().total()));
    }

    /**
     * Apply one bet to the table.
     *
     * @return the bet as applied, with the chips actually paid for calls and all-ins
     * @throws Errors.ProtocolViolationError if the bet is not allowed
     */
    public Bet apply(String name, Bet bet) {
        // Guard
        Player player = state.getPlayer(name);
        if (player == null) {
            throw violation("Unknown or removed player", name, bet, 0);
        }
        long call = callFor(player);
        if (!player.isActive()) {
            throw violation("Player cannot act", name, bet, call);
        }

        // Validate and compute
        Bet applied = switch (bet.getType()) {
            case FOLD -> {
                player.setFolded(true);
                yield Bet.fold();
            }
            case CHECK -> {
                if (call > 0) {
                    throw violation("Cannot check, must call or fold", name, bet, call);
                }
                yield Bet.check();
            }
            case CALL -> {
                if (call >= player.getBankRoll()) {
                    yield allIn(player);
                }
                Payments.pay(state, player, call);
                yield Bet.call(call);
            }
            case RAISE -> {
                long amount = bet.getAmount();
                if (amount <= call) {
                    throw violation("Raise must exceed the call", name, bet, call);
                }
                if (amount > player.getBankRoll()) {
                    throw violation("Raise exceeds bank roll", name, bet, call);
                }
                if (amount == player.getBankRoll()) {
                    yield allIn(player);
                }
                Payments.pay(state, player, amount);
                currentBet = player.getStageBet();
                cycle++;
                reopenAction(player);
                yield Bet.raise(amount);
            }
            case ALL_IN -> allIn(player);
        };
        player.setHasActed(true);

        logger.debug("bet_placed", kv("player", name), kv("bet", applied), kv("pot", state.getLedger().total()));
        state.publish(new BetPlaced(name, applied, state.getLedger().total()));
        return applied;
    }

    /**
     * True when no more bets are needed this stage.
     */
    public boolean isComplete() {
        List<Player> inHand = state.getNonFoldedPlayers();
        if (inHand.size() <= 1) {
            return true;
        }
        boolean alone = isAlone(inHand);
        for (Player player : inHand) {
            if (!player.isActive()) {
                continue;
            }
            if (callFor(player) > 0) {
                return false;
            }
            if (!player.hasActed() && !alone) {
                return false;
            }
        }
        return true;
    }

    // A single player able to bet has nobody left to bet against
    private static boolean isAlone(List<Player> inHand) {
        int active = 0;
        for (Player player : inHand) {
            if (player.isActive()) {
                active++;
            }
        }
        return active == 1;
    }

    private Bet allIn(Player player) {
        long paid = Payments.goAllIn(state, player);
        if (player.getStageBet() > currentBet) {
            currentBet = player.getStageBet();
            reopenAction(player);
        }
        logger.info("player_all_in", kv("player", player.getName()), kv("amount", paid),
            kv("stage", stage));
        return Bet.allIn(paid);
    }

    private void reopenAction(Player aggressor) {
        for (Player other : state.getPlayers()) {
            if (other != aggressor && other.isActive()) {
                other.setHasActed(false);
            }
        }
    }

    private Errors.ProtocolViolationError violation(String reason, String name, Bet bet, long call) {
        return new Errors.ProtocolViolationError(reason, name, stage.getDisplayName(), bet.toString(), call);
    }
}
