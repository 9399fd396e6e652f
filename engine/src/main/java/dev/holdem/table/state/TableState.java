package dev.holdem.table.state;

import dev.holdem.Errors;
import dev.holdem.cards.Card;
import dev.holdem.cards.Deck;
import dev.holdem.events.EventSink;
import dev.holdem.events.GameEvent;
import dev.holdem.events.StageDeclared;
import dev.holdem.hand.Winner;
import dev.holdem.pots.PotLedger;
import dev.holdem.table.GameConfig;
import dev.holdem.table.Player;
import dev.holdem.table.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Mutable state of a table, owned by the thread that plays the game.
 */
public class TableState {
    private static final Logger logger = LoggerFactory.getLogger(TableState.class);

    private final GameConfig config;
    private final Random rng;
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final List<String> seating = new ArrayList<>();
    private final List<EventSink> sinks = new ArrayList<>();
    private final PotLedger ledger = new PotLedger();
    private final List<Card> communityCards = new ArrayList<>();
    private Deck deck;
    private Stage stage = Stage.BLINDS;
    private String dealer;
    private Winner winner;
    private int roundsPlayed;
    private long chipsBoughtIn;
    private long paidOut;

    public TableState(GameConfig config, Random rng) {
        this.config = config;
        this.rng = rng;
        this.deck = Deck.shuffled(rng);
    }

    public GameConfig getConfig() { return config; }
    public Random getRng() { return rng; }

    public PotLedger getLedger() { return ledger; }

    public Deck getDeck() { return deck; }
    public void setDeck(Deck deck) { this.deck = deck; }

    public List<Card> getCommunityCards() { return communityCards; }

    public Stage getStage() { return stage; }
    public void setStage(Stage stage) { this.stage = stage; }

    public String getDealer() { return dealer; }
    public void setDealer(String dealer) { this.dealer = dealer; }

    public Winner getWinner() { return winner; }
    public void setWinner(Winner winner) { this.winner = winner; }

    public int getRoundsPlayed() { return roundsPlayed; }
    public void setRoundsPlayed(int roundsPlayed) { this.roundsPlayed = roundsPlayed; }

    public long getChipsBoughtIn() { return chipsBoughtIn; }
    public long getPaidOut() { return paidOut; }
    public void addPaidOut(long chips) { this.paidOut += chips; }

    public void addSink(EventSink sink) {
        sinks.add(sink);
    }

    /**
     * Seat a player at the end of the seating order, funding them with {@code bankRoll}.
     */
    public void seat(Player player, long bankRoll) {
        player.setBankRoll(bankRoll);
        players.put(player.getName(), player);
        seating.add(player.getName());
        chipsBoughtIn += bankRoll;
    }

    /**
     * Remove a player, counting their chips as paid out.
     */
    public void unseat(String name) {
        Player player = players.remove(name);
        if (player == null) {
            return;
        }
        seating.remove(name);
        paidOut += player.getBankRoll();
        player.setBankRoll(0);
    }

    public boolean isSeated(String name) {
        return players.containsKey(name);
    }

    public boolean isFull() {
        return players.size() >= config.maxPlayers();
    }

    public Player getPlayer(String name) {
        return players.get(name);
    }

    /**
     * Seated player names in seating order.
     */
    public List<String> getSeating() {
        return Collections.unmodifiableList(seating);
    }

    /**
     * Replace the seating order with a permutation of itself.
     */
    public void reorderSeating(List<String> order) {
        if (order.size() != seating.size() || !seating.containsAll(order)) {
            throw new Errors.InvariantViolationError("Seating " + order + " does not match " + seating);
        }
        seating.clear();
        seating.addAll(order);
    }

    /**
     * Seated players in seating order.
     */
    public List<Player> getPlayers() {
        List<Player> result = new ArrayList<>(seating.size());
        for (String name : seating) {
            result.add(players.get(name));
        }
        return result;
    }

    public List<Player> getNonFoldedPlayers() {
        List<Player> result = new ArrayList<>();
        for (Player player : getPlayers()) {
            if (!player.isFolded()) {
                result.add(player);
            }
        }
        return result;
    }

    public int getActivePlayerCount() {
        return (int) players.values().stream()
            .filter(Player::isActive)
            .count();
    }

    /**
     * Chips on the table: bank rolls plus every pot plus chips already paid out.
     */
    public long totalChips() {
        long total = ledger.total() + paidOut;
        for (Player player : players.values()) {
            total += player.getBankRoll();
        }
        return total;
    }

    /**
     * Move to the next stage. Announcing it is left to the caller, once any cards are dealt.
     *
     * @throws Errors.InvariantViolationError if {@code next} does not follow the current stage
     */
    public void advanceStage(Stage next) {
        if (stage.next() != next) {
            throw new Errors.InvariantViolationError(
                "Stage " + next + " cannot follow " + stage);
        }
        stage = next;
    }

    /**
     * Announce the current stage.
     */
    public void declareStage() {
        logger.debug("stage_declared", kv("stage", stage), kv("community", communityCards));
        publish(new StageDeclared(stage, communityCards));
    }

    /**
     * Send an event to every table sink and every seated player.
     */
    public void publish(GameEvent event) {
        for (EventSink sink : sinks) {
            deliver(sink, event);
        }
        for (Player player : getPlayers()) {
            deliver(player.getSink(), event);
        }
    }

    /**
     * Send an event to one player only.
     */
    public void publishTo(Player player, GameEvent event) {
        deliver(player.getSink(), event);
    }

    private static void deliver(EventSink sink, GameEvent event) {
        try {
            sink.onEvent(event);
        } catch (RuntimeException e) {
            logger.warn("event_delivery_failed", kv("event", event.getClass().getSimpleName()), e);
        }
    }
}
