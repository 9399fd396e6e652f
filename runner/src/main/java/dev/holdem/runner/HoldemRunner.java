package dev.holdem.runner;

import dev.holdem.table.Game;
import dev.holdem.table.Games;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Random;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Plays a table of automatic players to completion, printing every event.
 */
public class HoldemRunner {
    private static final Logger logger = LoggerFactory.getLogger(HoldemRunner.class);

    private final RunnerSettings settings;
    private final OutputSink output;

    public HoldemRunner(RunnerSettings settings, OutputSink output) {
        this.settings = settings;
        this.output = output;
    }

    /**
     * Build the table, play it out and return the winner (or the chip leader at the round limit).
     */
    public String run() {
        long seed = settings.seed() != null ? settings.seed() : new Random().nextLong();
        logger.info("game_configured",
            kv("big_blind", settings.bigBlind()),
            kv("small_blind", settings.smallBlind()),
            kv("players", settings.players()),
            kv("seed", seed),
            kv("remainder_policy", settings.remainderPolicy()),
            kv("max_rounds", settings.maxRounds()));

        Game game = Games.withAutoPlayers(settings.toGameConfig(), settings.players(), new Random(seed));
        game.addSink(output);
        String winner = game.play(settings.maxRounds());

        logger.info("game_finished",
            kv("winner", winner),
            kv("rounds", game.getRoundsPlayed()),
            kv("bank_roll", game.getPlayer(winner).getBankRoll()));
        return winner;
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        RunnerSettings settings = RunnerSettings.fromEnvironment(env);
        new HoldemRunner(settings, new OutputSink(System.out::println, false)).run();
    }
}
