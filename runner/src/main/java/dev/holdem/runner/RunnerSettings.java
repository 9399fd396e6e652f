package dev.holdem.runner;

import dev.holdem.table.GameConfig;
import dev.holdem.table.RemainderPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Runner configuration read from {@code POKER_*} environment variables.
 *
 * @param seed null for a random seed
 */
public record RunnerSettings(long bigBlind, long smallBlind, int players, Long seed,
                             RemainderPolicy remainderPolicy, int maxRounds) {
    private static final Logger logger = LoggerFactory.getLogger(RunnerSettings.class);

    static final String PREFIX = "POKER_";
    static final long DEFAULT_BIG_BLIND = 20;
    static final int DEFAULT_PLAYERS = 4;

    public static RunnerSettings defaults() {
        return fromEnvironment(Map.of());
    }

    public static RunnerSettings fromEnvironment(Map<String, String> env) {
        long bigBlind = positiveLong(env, "BIG_BLIND", DEFAULT_BIG_BLIND);
        long smallBlind = positiveLong(env, "SMALL_BLIND", Math.max(1, bigBlind / 2));
        if (smallBlind > bigBlind) {
            logger.warn("Small blind {} exceeds big blind {}, using {}", smallBlind, bigBlind, bigBlind / 2);
            smallBlind = Math.max(1, bigBlind / 2);
        }

        int players = (int) positiveLong(env, "PLAYERS", DEFAULT_PLAYERS);
        if (players < GameConfig.MIN_PLAYERS || players > GameConfig.MAX_PLAYERS) {
            logger.warn("Invalid {}PLAYERS '{}', using default {}", PREFIX, players, DEFAULT_PLAYERS);
            players = DEFAULT_PLAYERS;
        }

        Long seed = null;
        String seedEnv = value(env, "SEED");
        if (seedEnv != null) {
            try {
                seed = Long.parseLong(seedEnv);
            } catch (NumberFormatException e) {
                logger.warn("Invalid {}SEED env var '{}', using a random seed", PREFIX, seedEnv);
            }
        }

        RemainderPolicy policy = RemainderPolicy.SEAT_ORDER;
        String policyEnv = value(env, "REMAINDER_POLICY");
        if (policyEnv != null) {
            try {
                policy = RemainderPolicy.valueOf(policyEnv.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {}REMAINDER_POLICY env var '{}', using default {}", PREFIX, policyEnv, policy);
            }
        }

        int maxRounds = 0;
        String roundsEnv = value(env, "MAX_ROUNDS");
        if (roundsEnv != null) {
            try {
                maxRounds = Math.max(0, Integer.parseInt(roundsEnv));
            } catch (NumberFormatException e) {
                logger.warn("Invalid {}MAX_ROUNDS env var '{}', using default {}", PREFIX, roundsEnv, 0);
            }
        }

        return new RunnerSettings(bigBlind, smallBlind, players, seed, policy, maxRounds);
    }

    /**
     * Table configuration for these settings. Every seat is filled by an automatic player.
     */
    public GameConfig toGameConfig() {
        return new GameConfig(bigBlind, smallBlind, bigBlind * GameConfig.BUY_IN_BLINDS,
            GameConfig.MAX_PLAYERS, remainderPolicy);
    }

    private static String value(Map<String, String> env, String key) {
        String raw = env.get(PREFIX + key);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static long positiveLong(Map<String, String> env, String key, long defaultValue) {
        String raw = value(env, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw);
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.warn("Invalid {}{} env var '{}', using default {}", PREFIX, key, raw, defaultValue);
            return defaultValue;
        }
        logger.warn("Non-positive {}{} env var '{}', using default {}", PREFIX, key, raw, defaultValue);
        return defaultValue;
    }
}
