package dev.holdem.table.handlers;

import dev.holdem.Errors;
import dev.holdem.cards.Deck;
import dev.holdem.decision.strategies.CheckCallStrategy;
import dev.holdem.events.GameEvent;
import dev.holdem.events.HoleCardsDealt;
import dev.holdem.table.GameConfig;
import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static dev.holdem.TestCards.cards;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DealHandlerTest {

    @Test
    void hole_cards_should_be_sent_only_to_their_owner() {
        TableState state = new TableState(GameConfig.of(20, 6), new Random(1));
        List<GameEvent> table = new ArrayList<>();
        List<GameEvent> alice = new ArrayList<>();
        List<GameEvent> bob = new ArrayList<>();
        state.addSink(table::add);
        state.seat(new Player("Alice", new CheckCallStrategy(), alice::add), 2000);
        state.seat(new Player("Bob", new CheckCallStrategy(), bob::add), 2000);

        DealHandler.dealHoleCards(state);

        assertThat(table).isEmpty();
        assertThat(alice).singleElement()
            .isEqualTo(new HoleCardsDealt("Alice", state.getPlayer("Alice").getHoleCards()));
        assertThat(bob).singleElement()
            .isEqualTo(new HoleCardsDealt("Bob", state.getPlayer("Bob").getHoleCards()));
        assertThat(state.getDeck().size()).isEqualTo(48);
    }

    @Test
    void flop_should_burn_one_and_deal_three() {
        TableState state = new TableState(GameConfig.of(20, 6), new Random(1));
        state.setDeck(Deck.ofCards(cards("2c", "As", "Kd", "Qh", "Jc", "Ts")));

        DealHandler.dealFlop(state);
        DealHandler.dealTurn(state);

        assertThat(state.getDeck().getBurned()).isEqualTo(cards("2c", "Jc"));
        assertThat(state.getCommunityCards()).isEqualTo(cards("As", "Kd", "Qh", "Ts"));
    }

    @Test
    void short_deck_should_not_be_burned_into() {
        TableState state = new TableState(GameConfig.of(20, 6), new Random(1));
        state.setDeck(Deck.ofCards(cards("2c", "As", "Kd")));

        assertThatThrownBy(() -> DealHandler.dealFlop(state))
            .isInstanceOf(Errors.DeckExhaustedError.class);
        assertThat(state.getDeck().size()).isEqualTo(3);
        assertThat(state.getDeck().getBurned()).isEmpty();
        assertThat(state.getCommunityCards()).isEmpty();
    }
}
