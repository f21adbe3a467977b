package org.jkconfig.model;

import java.util.List;
import java.util.OptionalInt;

/**
 * Helpers for the three-valued logic of Kconfig: 0 (n), 1 (m) and 2 (y).
 */
public final class Tristate {

    public static final int N = 0;
    public static final int M = 1;
    public static final int Y = 2;

    private static final List<String> NAMES = List.of("n", "m", "y");

    private Tristate() {
    }

    /**
     * @param value A tristate value.
     * @return {@code "n"}, {@code "m"} or {@code "y"}.
     */
    public static String toString(int value) {
        return NAMES.get(value);
    }

    /**
     * @param text {@code "n"}, {@code "m"} or {@code "y"}.
     * @return The matching tristate value, or empty for any other text.
     */
    public static OptionalInt parse(String text) {
        int index = NAMES.indexOf(text);
        return index < 0 ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public static boolean isValid(int value) {
        return value >= N && value <= Y;
    }
}
