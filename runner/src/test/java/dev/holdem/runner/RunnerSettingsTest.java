package dev.holdem.runner;

import dev.holdem.table.GameConfig;
import dev.holdem.table.RemainderPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunnerSettingsTest {

    // =========================================================================
    // Defaults
    // =========================================================================

    @Test
    void empty_environment_uses_defaults() {
        RunnerSettings settings = RunnerSettings.fromEnvironment(Map.of());

        assertThat(settings.bigBlind()).isEqualTo(20);
        assertThat(settings.smallBlind()).isEqualTo(10);
        assertThat(settings.players()).isEqualTo(4);
        assertThat(settings.seed()).isNull();
        assertThat(settings.remainderPolicy()).isEqualTo(RemainderPolicy.SEAT_ORDER);
        assertThat(settings.maxRounds()).isZero();
    }

    @Test
    void small_blind_follows_big_blind_when_unset() {
        RunnerSettings settings = RunnerSettings.fromEnvironment(Map.of("POKER_BIG_BLIND", "50"));

        assertThat(settings.smallBlind()).isEqualTo(25);
    }

    // =========================================================================
    // Parsing
    // =========================================================================

    @Test
    void parses_every_variable() {
        RunnerSettings settings = RunnerSettings.fromEnvironment(Map.of(
            "POKER_BIG_BLIND", "40",
            "POKER_SMALL_BLIND", "15",
            "POKER_PLAYERS", "6",
            "POKER_SEED", "42",
            "POKER_REMAINDER_POLICY", "discard",
            "POKER_MAX_ROUNDS", "12"));

        assertThat(settings.bigBlind()).isEqualTo(40);
        assertThat(settings.smallBlind()).isEqualTo(15);
        assertThat(settings.players()).isEqualTo(6);
        assertThat(settings.seed()).isEqualTo(42L);
        assertThat(settings.remainderPolicy()).isEqualTo(RemainderPolicy.DISCARD);
        assertThat(settings.maxRounds()).isEqualTo(12);
    }

    @Test
    void invalid_values_fall_back_to_defaults() {
        RunnerSettings settings = RunnerSettings.fromEnvironment(Map.of(
            "POKER_BIG_BLIND", "lots",
            "POKER_PLAYERS", "9",
            "POKER_SEED", "x",
            "POKER_REMAINDER_POLICY", "BURN",
            "POKER_MAX_ROUNDS", "ten"));

        assertThat(settings.bigBlind()).isEqualTo(20);
        assertThat(settings.players()).isEqualTo(4);
        assertThat(settings.seed()).isNull();
        assertThat(settings.remainderPolicy()).isEqualTo(RemainderPolicy.SEAT_ORDER);
        assertThat(settings.maxRounds()).isZero();
    }

    @Test
    void non_positive_blind_falls_back_to_default() {
        RunnerSettings settings = RunnerSettings.fromEnvironment(Map.of("POKER_BIG_BLIND", "-5"));

        assertThat(settings.bigBlind()).isEqualTo(20);
    }

    @Test
    void small_blind_above_big_blind_is_halved_big_blind() {
        RunnerSettings settings = RunnerSettings.fromEnvironment(Map.of(
            "POKER_BIG_BLIND", "20",
            "POKER_SMALL_BLIND", "30"));

        assertThat(settings.smallBlind()).isEqualTo(10);
    }

    // =========================================================================
    // Game config
    // =========================================================================

    @Test
    void game_config_buys_in_for_a_hundred_big_blinds() {
        GameConfig config = RunnerSettings.fromEnvironment(Map.of("POKER_BIG_BLIND", "10")).toGameConfig();

        assertThat(config.bigBlind()).isEqualTo(10);
        assertThat(config.smallBlind()).isEqualTo(5);
        assertThat(config.buyIn()).isEqualTo(1000);
        assertThat(config.maxPlayers()).isEqualTo(GameConfig.MAX_PLAYERS);
    }
}
