package dev.holdem.table;

public enum BetType {
    FOLD,
    CHECK,
    CALL,
    RAISE,
    ALL_IN
}
