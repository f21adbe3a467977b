package org.jkconfig.model;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Parses and formats the integer literals used by {@code int} and {@code hex} symbols.
 * <p>
 * Parsing accepts surrounding whitespace and an optional sign. With radix 16 an optional
 * {@code 0x} prefix is allowed; with radix 0 the radix comes from a {@code 0x}, {@code 0o}
 * or {@code 0b} prefix and defaults to decimal, where leading zeros are only allowed in zero itself.
 */
public final class NumericLiterals {

    private NumericLiterals() {
    }

    /**
     * @param text The text to check.
     * @param radix 0, 10 or 16.
     * @return {@code true} if {@link #parse(String, int)} accepts the text.
     */
    public static boolean isValid(String text, int radix) {
        try {
            parse(text, radix);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * @param text The text to parse.
     * @param radix 0, 10 or 16.
     * @return The parsed value.
     * @throws NumberFormatException if the text is not a valid literal in the radix.
     */
    public static BigInteger parse(String text, int radix) {
        String s = text.strip();
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '+' || s.charAt(0) == '-')) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        String lower = s.toLowerCase(Locale.ROOT);
        int effectiveRadix = radix;
        if (radix == 16 && lower.startsWith("0x")) {
            s = s.substring(2);
        } else if (radix == 0) {
            if (lower.startsWith("0x")) {
                effectiveRadix = 16;
                s = s.substring(2);
            } else if (lower.startsWith("0o")) {
                effectiveRadix = 8;
                s = s.substring(2);
            } else if (lower.startsWith("0b")) {
                effectiveRadix = 2;
                s = s.substring(2);
            } else {
                effectiveRadix = 10;
                if (s.length() > 1 && s.charAt(0) == '0' && !s.chars().allMatch(c -> c == '0')) {
                    throw new NumberFormatException("Leading zeros in decimal literal: " + text);
                }
            }
        }
        final int digitRadix = effectiveRadix;
        if (s.isEmpty() || !s.chars().allMatch(c -> c < 128 && Character.digit(c, digitRadix) >= 0)) {
            throw new NumberFormatException("Invalid literal for radix " + effectiveRadix + ": " + text);
        }
        BigInteger value = new BigInteger(s, effectiveRadix);
        return negative ? value.negate() : value;
    }

    /**
     * Formats a value as a lowercase hexadecimal literal with a {@code 0x} prefix,
     * e.g. {@code 0x1f} or {@code -0x10}.
     *
     * @param value The value.
     * @return The formatted literal.
     */
    public static String toHex(BigInteger value) {
        return value.signum() < 0 ? "-0x" + value.negate().toString(16) : "0x" + value.toString(16);
    }

    /**
     * @param value The value.
     * @param type {@link SymbolType#INT} or {@link SymbolType#HEX}.
     * @return The value in the canonical form for the type.
     */
    public static String format(BigInteger value, SymbolType type) {
        return type == SymbolType.HEX ? toHex(value) : value.toString();
    }
}
