package dev.holdem.pots;

import dev.holdem.Errors;
import dev.holdem.hand.PlayerHand;
import dev.holdem.hand.Winner;
import dev.holdem.table.RemainderPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.holdem.TestCards.cards;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PotDistributorTest {

    // A and B hold equal straights, C a pair of fives, D a pair of aces
    private static final PlayerHand A = PlayerHand.of("A", cards("5c", "6d", "7h", "8s", "9c"));
    private static final PlayerHand B = PlayerHand.of("B", cards("5d", "6h", "7c", "8d", "9s"));
    private static final PlayerHand C = PlayerHand.of("C", cards("5h", "5s", "Kd", "Js", "2c"));
    private static final PlayerHand D = PlayerHand.of("D", cards("Ah", "As", "Qd", "Th", "3c"));

    // =========================================================================
    // Draws
    // =========================================================================

    @Test
    void main_pot_should_split_evenly_between_drawing_players() {
        Payouts payouts = PotDistributor.distribute(120, List.of(),
            List.of(new Contender(A, false), new Contender(B, false)),
            Winner.draw(List.of(A, B)), RemainderPolicy.SEAT_ORDER);

        assertThat(payouts.winningsOf("A")).isEqualTo(60);
        assertThat(payouts.winningsOf("B")).isEqualTo(60);
    }

    @Test
    void side_pot_should_go_only_to_its_eligible_drawing_players() {
        PotLedger ledger = new PotLedger();
        ledger.contribute("C", 40);
        ledger.openSidePot("C", List.of("A", "B"));
        ledger.contribute("A", 70);
        ledger.contribute("B", 70);
        PlayerHand c = PlayerHand.of("C", cards("5h", "6s", "7d", "8c", "9h"));

        Payouts payouts = PotDistributor.distribute(ledger.getPot(), ledger.getSidePots(),
            List.of(new Contender(A, false), new Contender(B, false), new Contender(c, true)),
            Winner.draw(List.of(A, B, c)), RemainderPolicy.SEAT_ORDER);

        assertThat(ledger.getPot()).isEqualTo(120);
        assertThat(payouts.winningsOf("A")).isEqualTo(70);
        assertThat(payouts.winningsOf("B")).isEqualTo(70);
        assertThat(payouts.winningsOf("C")).isEqualTo(40);
    }

    // =========================================================================
    // Sole winners
    // =========================================================================

    @Test
    void sole_winner_not_all_in_should_take_every_pot() {
        PotLedger ledger = new PotLedger();
        ledger.contribute("C", 30);
        ledger.openSidePot("C", List.of("A", "D"));
        ledger.contribute("A", 50);
        ledger.contribute("D", 50);

        Payouts payouts = PotDistributor.distribute(ledger.getPot(), ledger.getSidePots(),
            List.of(new Contender(A, false), new Contender(C, true), new Contender(D, false)),
            Winner.sole(A), RemainderPolicy.SEAT_ORDER);

        assertThat(payouts.winningsOf("A")).isEqualTo(130);
        assertThat(payouts.total()).isEqualTo(ledger.total());
    }

    @Test
    void all_in_winner_should_leave_the_side_pot_to_the_best_eligible_hand() {
        PotLedger ledger = new PotLedger();
        ledger.contribute("A", 30);
        ledger.openSidePot("A", List.of("C", "D"));
        ledger.contribute("C", 50);
        ledger.contribute("D", 50);

        Payouts payouts = PotDistributor.distribute(ledger.getPot(), ledger.getSidePots(),
            List.of(new Contender(A, true), new Contender(C, false), new Contender(D, false)),
            Winner.sole(A), RemainderPolicy.SEAT_ORDER);

        assertThat(payouts.winningsOf("A")).isEqualTo(90);
        assertThat(payouts.winningsOf("D")).isEqualTo(40);
        assertThat(payouts.winningsOf("C")).isZero();
    }

    @Test
    void side_pot_without_eligible_contenders_should_fall_back_to_the_winner() {
        PotLedger ledger = new PotLedger();
        ledger.contribute("A", 30);
        ledger.contribute("B", 50);
        ledger.openSidePot("A", List.of("B"));

        // B folded later, so only A contends
        Payouts payouts = PotDistributor.distribute(ledger.getPot(), ledger.getSidePots(),
            List.of(new Contender(A, true)), Winner.sole(A), RemainderPolicy.SEAT_ORDER);

        assertThat(payouts.winningsOf("A")).isEqualTo(80);
    }

    // =========================================================================
    // Remainders
    // =========================================================================

    @Test
    void seat_order_policy_should_give_the_remainder_to_the_first_seat() {
        Payouts payouts = PotDistributor.distribute(121, List.of(),
            List.of(new Contender(B, false), new Contender(A, false)),
            Winner.draw(List.of(A, B)), RemainderPolicy.SEAT_ORDER);

        assertThat(payouts.winningsOf("B")).isEqualTo(61);
        assertThat(payouts.winningsOf("A")).isEqualTo(60);
        assertThat(payouts.discarded()).isZero();
    }

    @Test
    void discard_policy_should_drop_the_remainder() {
        Payouts payouts = PotDistributor.distribute(121, List.of(),
            List.of(new Contender(A, false), new Contender(B, false)),
            Winner.draw(List.of(A, B)), RemainderPolicy.DISCARD);

        assertThat(payouts.winningsOf("A")).isEqualTo(60);
        assertThat(payouts.winningsOf("B")).isEqualTo(60);
        assertThat(payouts.discarded()).isEqualTo(1);
        assertThat(payouts.total()).isEqualTo(121);
    }

    @Test
    void winner_outside_the_contenders_should_be_an_invariant_violation() {
        assertThatThrownBy(() -> PotDistributor.distribute(100, List.of(),
            List.of(new Contender(A, false)), Winner.sole(D), RemainderPolicy.SEAT_ORDER))
            .isInstanceOf(Errors.InvariantViolationError.class);
    }
}
