package dev.holdem.runner;

import dev.holdem.cards.Card;
import dev.holdem.events.BetPlaced;
import dev.holdem.events.GameEvent;
import dev.holdem.events.GameWon;
import dev.holdem.events.HoleCardsDealt;
import dev.holdem.events.PlayerEliminated;
import dev.holdem.events.PlayerJoined;
import dev.holdem.events.PlayersAnnounced;
import dev.holdem.events.PotsAwarded;
import dev.holdem.events.RoundWon;
import dev.holdem.events.StageDeclared;
import dev.holdem.table.Stage;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders poker events as human-readable text.
 */
public class TextRenderer {

    /**
     * Render an event to text.
     */
    public String render(GameEvent event) {
        if (event instanceof PlayerJoined e) {
            return String.format("%s joined with %d chips", e.name(), e.bankRoll());
        }
        if (event instanceof PlayersAnnounced e) {
            return renderPlayersAnnounced(e);
        }
        if (event instanceof StageDeclared e) {
            return renderStageDeclared(e);
        }
        if (event instanceof HoleCardsDealt e) {
            return String.format("%s holds %s", e.player(), renderCards(e.cards()));
        }
        if (event instanceof BetPlaced e) {
            return String.format("%s: %s (pot: %d)", e.player(), e.bet(), e.pot());
        }
        if (event instanceof PotsAwarded e) {
            return renderPotsAwarded(e.payouts());
        }
        if (event instanceof RoundWon e) {
            return e.winner().toString();
        }
        if (event instanceof PlayerEliminated e) {
            return String.format("%s left the table with %d chips", e.name(), e.chipsCashedOut());
        }
        if (event instanceof GameWon e) {
            return String.format("=== %s wins the game with %d chips ===", e.name(), e.bankRoll());
        }
        return "[" + event.getClass().getSimpleName() + "]";
    }

    private String renderPlayersAnnounced(PlayersAnnounced event) {
        String players = event.players().stream()
            .map(seat -> seat.name() + " " + seat.bankRoll())
            .collect(Collectors.joining(", "));
        return String.format("Players: %s (dealer: %s)", players, event.dealer());
    }

    private String renderStageDeclared(StageDeclared event) {
        if (event.stage() == Stage.BLINDS) {
            return "=== New round ===";
        }
        if (event.communityCards().isEmpty()) {
            return event.stage().getDisplayName();
        }
        return String.format("%s: %s", event.stage().getDisplayName(), renderCards(event.communityCards()));
    }

    private String renderPotsAwarded(Map<String, Long> payouts) {
        if (payouts.isEmpty()) {
            return "Pot awarded: nothing";
        }
        StringBuilder sb = new StringBuilder("Pot awarded: ");
        boolean first = true;
        for (Map.Entry<String, Long> entry : payouts.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(String.format("%s wins %d", entry.getKey(), entry.getValue()));
            first = false;
        }
        return sb.toString();
    }

    private String renderCards(List<Card> cards) {
        return cards.stream().map(Card::code).collect(Collectors.joining(" "));
    }
}
