package dev.holdem.table;

import dev.holdem.Errors;

/**
 * Table stakes and rules.
 *
 * @param bigBlind        big blind, also the minimum raise
 * @param smallBlind      blind paid by the player left of the dealer
 * @param buyIn           bank roll of every joining player
 * @param maxPlayers      seats at the table
 * @param remainderPolicy what happens to chips that do not split evenly
 */
public record GameConfig(long bigBlind, long smallBlind, long buyIn, int maxPlayers,
                         RemainderPolicy remainderPolicy) {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 6;
    public static final long BUY_IN_BLINDS = 100;

    public GameConfig {
        if (bigBlind <= 0) {
            throw Errors.CommandRejectedError.invalidArgument("big blind must be positive: " + bigBlind);
        }
        if (smallBlind <= 0 || smallBlind > bigBlind) {
            throw Errors.CommandRejectedError.invalidArgument(
                "small blind must be between 1 and the big blind: " + smallBlind);
        }
        if (buyIn < bigBlind) {
            throw Errors.CommandRejectedError.invalidArgument("buy-in must cover the big blind: " + buyIn);
        }
        if (maxPlayers < MIN_PLAYERS || maxPlayers > MAX_PLAYERS) {
            throw Errors.CommandRejectedError.invalidArgument(String.format(
                "seats must be between %d and %d: %d", MIN_PLAYERS, MAX_PLAYERS, maxPlayers));
        }
        if (remainderPolicy == null) {
            remainderPolicy = RemainderPolicy.SEAT_ORDER;
        }
    }

    /**
     * Standard table: small blind is half the big blind, buy-in is a hundred big blinds.
     */
    public static GameConfig of(long bigBlind, int maxPlayers) {
        return new GameConfig(bigBlind, Math.max(1, bigBlind / 2), bigBlind * BUY_IN_BLINDS,
            maxPlayers, RemainderPolicy.SEAT_ORDER);
    }

    public GameConfig withSmallBlind(long smallBlind) {
        return new GameConfig(bigBlind, smallBlind, buyIn, maxPlayers, remainderPolicy);
    }

    public GameConfig withBuyIn(long buyIn) {
        return new GameConfig(bigBlind, smallBlind, buyIn, maxPlayers, remainderPolicy);
    }

    public GameConfig withRemainderPolicy(RemainderPolicy remainderPolicy) {
        return new GameConfig(bigBlind, smallBlind, buyIn, maxPlayers, remainderPolicy);
    }
}
