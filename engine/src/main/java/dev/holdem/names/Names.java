package dev.holdem.names;

import dev.holdem.Errors;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Player names for automatic players, and disambiguation of names that are already taken.
 */
public final class Names {

    public static final List<String> POOL = List.of(
        "Bob", "Alice", "Cali", "Arjun", "Bianca", "Kalyna",
        "Chen", "Zhu", "Cielo", "Eva", "Franco", "Lopa");

    private Names() {}

    /**
     * Pick {@code count} distinct names from the pool.
     *
     * @throws Errors.CommandRejectedError if more names are requested than the pool holds
     */
    public static List<String> pick(int count, Random rng) {
        if (count < 0 || count > POOL.size()) {
            throw Errors.CommandRejectedError.invalidArgument(
                "Request a smaller number of names: " + count + " > " + POOL.size());
        }
        List<String> names = new ArrayList<>(POOL);
        Collections.shuffle(names, rng);
        return new ArrayList<>(names.subList(0, count));
    }

    /**
     * A name distinct from every taken name: the name itself when free, otherwise the name with the
     * smallest numeric suffix from 2 upwards that is free.
     */
    public static String uniquify(String name, Collection<String> taken) {
        if (!taken.contains(name)) {
            return name;
        }
        // n taken names can block at most n suffixes
        for (int suffix = 2; suffix <= taken.size() + 1; suffix++) {
            String candidate = name + suffix;
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
        throw new Errors.InvariantViolationError("No free suffix for " + name);
    }
}
