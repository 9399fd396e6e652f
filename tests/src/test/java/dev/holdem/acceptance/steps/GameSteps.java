package dev.holdem.acceptance.steps;

import dev.holdem.Errors;
import dev.holdem.events.PlayerEliminated;
import dev.holdem.table.Game;
import dev.holdem.table.GameConfig;
import dev.holdem.table.Games;
import dev.holdem.table.Player;
import dev.holdem.table.RemainderPolicy;
import io.cucumber.java.Before;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cucumber step definitions for seating players and playing whole games.
 */
public class GameSteps {

    private Game game;
    private String lastJoined;
    private String result;
    private List<String> eliminated;
    private long chipsAtStart;

    @Before
    public void setup() {
        game = null;
        lastJoined = null;
        result = null;
        eliminated = new ArrayList<>();
        chipsAtStart = 0;
    }

    // --- Given steps ---

    @Given("a game for {int} players with big blind {int}")
    public void gameForPlayers(int maxPlayers, int bigBlind) {
        game = Game.build(bigBlind, maxPlayers);
    }

    @Given("a seeded game of {int} automatic players with seed {long} and remainder policy {string}")
    public void seededGame(int players, long seed, String policy) {
        GameConfig config = GameConfig.of(20, GameConfig.MAX_PLAYERS)
            .withRemainderPolicy(RemainderPolicy.valueOf(policy));
        game = Games.withAutoPlayers(config, players, new Random(seed));
        game.addSink(event -> {
            if (event instanceof PlayerEliminated e) {
                eliminated.add(e.name());
            }
        });
        chipsAtStart = game.totalChips();
    }

    // --- When steps ---

    @When("{string} joins the game")
    public void joins(String name) {
        try {
            lastJoined = game.join(new Player(name, request -> Optional.empty()));
        } catch (Errors.PokerError e) {
            CommonSteps.setLastError(e);
        }
    }

    @When("the game is played for at most {int} rounds")
    public void playedForAtMost(int rounds) {
        result = game.play(rounds);
    }

    // --- Then steps ---

    @Then("the player is seated as {string}")
    public void seatedAs(String name) {
        assertThat(lastJoined).isEqualTo(name);
        assertThat(game.getSeating()).contains(name);
    }

    @Then("{int} players are seated")
    public void playersSeated(int count) {
        assertThat(game.getSeating()).hasSize(count);
    }

    @Then("{string} has the buy-in of {long} chips")
    public void hasBuyIn(String name, long chips) {
        assertThat(game.getPlayer(name).getBankRoll()).isEqualTo(chips);
    }

    @Then("the game names a seated player as the result")
    public void resultIsSeated() {
        assertThat(result).isNotNull();
        assertThat(game.getSeating()).contains(result);
    }

    @Then("no chips were created or lost")
    public void chipsConserved() {
        var state = game.getState();
        assertThat(game.totalChips() + state.getPaidOut()).isEqualTo(chipsAtStart);
        assertThat(state.getChipsBoughtIn()).isEqualTo(chipsAtStart);
    }

    @Then("no eliminated player is still seated")
    public void eliminatedPlayersLeft() {
        assertThat(game.getSeating()).doesNotContainAnyElementsOf(eliminated);
    }
}
