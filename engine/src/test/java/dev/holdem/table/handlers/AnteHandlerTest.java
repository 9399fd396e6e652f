package dev.holdem.table.handlers;

import dev.holdem.decision.strategies.CheckCallStrategy;
import dev.holdem.events.GameEvent;
import dev.holdem.events.PlayersAnnounced;
import dev.holdem.table.GameConfig;
import dev.holdem.table.Player;
import dev.holdem.table.state.TableState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class AnteHandlerTest {

    private TableState state;
    private List<GameEvent> events;

    @BeforeEach
    void setUp() {
        state = new TableState(GameConfig.of(20, 6), new Random(1));
        events = new ArrayList<>();
        state.addSink(events::add);
        for (String name : List.of("A", "B", "C")) {
            state.seat(new Player(name, new CheckCallStrategy()), 2000);
        }
    }

    @Test
    void first_round_should_make_the_first_seat_dealer_and_act_last() {
        AnteHandler.orderPlayers(state);

        assertThat(state.getDealer()).isEqualTo("A");
        assertThat(state.getSeating()).containsExactly("B", "C", "A");
    }

    @Test
    void player_left_of_the_dealer_should_pay_the_small_blind() {
        AnteHandler.orderPlayers(state);
        AnteHandler.anteUp(state);

        assertThat(state.getPlayer("B").getBankRoll()).isEqualTo(1990);
        assertThat(state.getPlayer("C").getBankRoll()).isEqualTo(1980);
        assertThat(state.getPlayer("A").getBankRoll()).isEqualTo(1980);
        assertThat(state.getLedger().getPot()).isEqualTo(50);
    }

    @Test
    void short_blind_should_go_all_in_and_open_a_side_pot() {
        state.getPlayer("B").setBankRoll(15);

        AnteHandler.anteUp(state);

        Player b = state.getPlayer("B");
        assertThat(b.isAllIn()).isTrue();
        assertThat(b.getBankRoll()).isZero();
        assertThat(state.getLedger().getSidePots()).hasSize(1);
        assertThat(state.getLedger().getSidePots().get(0).getPlayers()).containsExactly("A", "C");
        assertThat(state.getLedger().getPot()).isEqualTo(40);
        assertThat(state.getLedger().total()).isEqualTo(10 + 15 + 20);
    }

    @Test
    void empty_bank_roll_should_sit_the_round_out() {
        state.getPlayer("C").setBankRoll(0);

        AnteHandler.anteUp(state);

        assertThat(state.getPlayer("C").isFolded()).isTrue();
        assertThat(state.getLedger().contributionOf("C")).isZero();
    }

    @Test
    void players_should_be_announced_after_the_blinds() {
        AnteHandler.orderPlayers(state);
        AnteHandler.anteUp(state);

        assertThat(events).hasSize(1);
        PlayersAnnounced announced = (PlayersAnnounced) events.get(0);
        assertThat(announced.dealer()).isEqualTo("A");
        assertThat(announced.players()).containsExactly(
            new PlayersAnnounced.Seat("B", 1990),
            new PlayersAnnounced.Seat("C", 1980),
            new PlayersAnnounced.Seat("A", 1980));
    }
}
