package dev.holdem.table.handlers;

import dev.holdem.Errors;
import dev.holdem.cards.Card;
import dev.holdem.cards.Deck;
import dev.holdem.events.HoleCardsDealt;
import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;

import java.util.List;

/**
 * Deals hole and community cards.
 */
public final class DealHandler {
    public static final int HOLE_CARDS = 2;
    public static final int FLOP_CARDS = 3;

    private DealHandler() {}

    /**
     * Two cards to every player still in the round, each told privately.
     *
     * @throws Errors.DeckExhaustedError if the deck runs short
     */
    public static void dealHoleCards(TableState state) {
        for (Player player : state.getNonFoldedPlayers()) {
            List<Card> cards = state.getDeck().take(HOLE_CARDS);
            player.setHoleCards(cards);
            state.publishTo(player, new HoleCardsDealt(player.getName(), cards));
        }
    }

    public static void dealFlop(TableState state) {
        burnAndDeal(state, FLOP_CARDS);
    }

    public static void dealTurn(TableState state) {
        burnAndDeal(state, 1);
    }

    public static void dealRiver(TableState state) {
        burnAndDeal(state, 1);
    }

    private static void burnAndDeal(TableState state, int count) {
        Deck deck = state.getDeck();
        // Check up front so a short deck is not burned into
        if (deck.size() < count + 1) {
            throw new Errors.DeckExhaustedError(count + 1, deck.size());
        }
        deck.burn();
        state.getCommunityCards().addAll(deck.take(count));
    }
}
