package dev.holdem.pots;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PotLedgerTest {

    private PotLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PotLedger();
    }

    @Test
    void contributions_without_all_in_should_stay_in_the_main_pot() {
        ledger.contribute("A", 20);
        ledger.contribute("B", 40);

        assertThat(ledger.getPot()).isEqualTo(60);
        assertThat(ledger.getSidePots()).isEmpty();
    }

    @Test
    void all_in_should_cap_the_main_pot_and_route_the_excess_to_a_side_pot() {
        // Blinds of 20 each, then A raises 40, B is all-in for 30, C calls 40
        ledger.contribute("A", 20);
        ledger.contribute("B", 20);
        ledger.contribute("C", 20);
        ledger.contribute("A", 40);
        ledger.contribute("B", 30);
        SidePot sidePot = ledger.openSidePot("B", List.of("A", "C"));
        ledger.contribute("C", 40);

        assertThat(ledger.getPot()).isEqualTo(150);
        assertThat(sidePot.getAmount()).isEqualTo(20);
        assertThat(sidePot.getPlayers()).containsExactly("A", "C");
        assertThat(sidePot.isEligible("B")).isFalse();
        assertThat(ledger.total()).isEqualTo(170);
    }

    @Test
    void each_all_in_level_should_get_its_own_lane() {
        ledger.contribute("B", 10);
        ledger.openSidePot("B", List.of("A", "C", "D"));
        ledger.contribute("C", 30);
        SidePot upper = ledger.openSidePot("C", List.of("A", "D"));
        ledger.contribute("A", 50);
        ledger.contribute("D", 50);

        SidePot lower = ledger.getSidePots().get(0);
        assertThat(ledger.getPot()).isEqualTo(40);
        assertThat(lower.getAmount()).isEqualTo(60);
        assertThat(lower.getPlayers()).containsExactly("A", "C", "D");
        assertThat(upper.getAmount()).isEqualTo(40);
        assertThat(upper.getPlayers()).containsExactly("A", "D");
        assertThat(ledger.total()).isEqualTo(140);
    }

    @Test
    void lower_all_in_after_a_higher_one_should_leave_the_higher_pot() {
        ledger.contribute("C", 30);
        SidePot upper = ledger.openSidePot("C", List.of("A", "B", "D"));
        ledger.contribute("B", 10);
        SidePot lower = ledger.openSidePot("B", List.of("A", "D"));
        ledger.contribute("A", 50);
        ledger.contribute("D", 50);

        assertThat(upper.getPlayers()).containsExactly("A", "D");
        assertThat(lower.getPlayers()).containsExactlyInAnyOrder("A", "C", "D");
        assertThat(ledger.getPot()).isEqualTo(40);
        assertThat(lower.getAmount()).isEqualTo(60);
        assertThat(upper.getAmount()).isEqualTo(40);
    }

    @Test
    void side_pots_should_keep_the_order_they_were_opened_in() {
        ledger.contribute("C", 30);
        ledger.openSidePot("C", List.of("A", "B"));
        ledger.contribute("B", 10);
        ledger.openSidePot("B", List.of("A"));

        assertThat(ledger.getSidePots()).extracting(SidePot::getOwner).containsExactly("C", "B");
    }

    @Test
    void clear_should_empty_every_pot() {
        ledger.contribute("A", 20);
        ledger.openSidePot("A", List.of("B"));
        ledger.clear();

        assertThat(ledger.total()).isZero();
        assertThat(ledger.getSidePots()).isEmpty();
        assertThat(ledger.contributionOf("A")).isZero();
    }
}
