package dev.holdem.table;

import dev.holdem.decision.DecisionProvider;
import dev.holdem.decision.strategies.CheckCallStrategy;
import dev.holdem.decision.strategies.ModestStrategy;
import dev.holdem.decision.strategies.SixMaxStrategy;
import dev.holdem.names.Names;

import java.util.List;
import java.util.Random;

/**
 * Factory for tables of automatic players.
 */
public final class Games {

    private Games() {}

    /**
     * A table filled with {@code count} automatic players taking turns between the six-max,
     * modest and check/call strategies.
     */
    public static Game withAutoPlayers(GameConfig config, int count, Random rng) {
        Game game = new Game(config, rng);
        List<String> names = Names.pick(count, rng);
        for (int i = 0; i < names.size(); i++) {
            game.join(new Player(names.get(i), autoStrategy(i, rng)));
        }
        return game;
    }

    static DecisionProvider autoStrategy(int seat, Random rng) {
        return switch (seat % 3) {
            case 0 -> new SixMaxStrategy();
            case 1 -> new ModestStrategy(rng);
            default -> new CheckCallStrategy();
        };
    }
}
