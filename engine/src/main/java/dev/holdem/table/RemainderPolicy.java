package dev.holdem.table;

/**
 * What happens to chips left over when a pot does not split evenly.
 */
public enum RemainderPolicy {
    /** The first tied player in seat order receives the whole remainder. */
    SEAT_ORDER,
    /** The remainder leaves the table and is counted as paid out. */
    DISCARD
}
