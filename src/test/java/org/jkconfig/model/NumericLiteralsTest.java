package org.jkconfig.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class NumericLiteralsTest {

    @Test
    void parsesDecimalAndHexLiterals() {
        assertThat(NumericLiterals.parse(" 42 ", 10)).isEqualTo(BigInteger.valueOf(42));
        assertThat(NumericLiterals.parse("-7", 10)).isEqualTo(BigInteger.valueOf(-7));
        assertThat(NumericLiterals.parse("0x1F", 16)).isEqualTo(BigInteger.valueOf(31));
        assertThat(NumericLiterals.parse("ff", 16)).isEqualTo(BigInteger.valueOf(255));
    }

    @Test
    void autoRadixFollowsPrefix() {
        assertThat(NumericLiterals.parse("0x10", 0)).isEqualTo(BigInteger.valueOf(16));
        assertThat(NumericLiterals.parse("0o17", 0)).isEqualTo(BigInteger.valueOf(15));
        assertThat(NumericLiterals.parse("0b101", 0)).isEqualTo(BigInteger.valueOf(5));
        assertThat(NumericLiterals.parse("000", 0)).isEqualTo(BigInteger.ZERO);
        assertThat(NumericLiterals.isValid("010", 0)).isFalse();
    }

    @Test
    void rejectsMalformedLiterals() {
        assertThat(NumericLiterals.isValid("", 10)).isFalse();
        assertThat(NumericLiterals.isValid("12a", 10)).isFalse();
        assertThat(NumericLiterals.isValid("0x", 16)).isFalse();
        assertThat(NumericLiterals.isValid("FOO", 0)).isFalse();
        assertThatThrownBy(() -> NumericLiterals.parse("0xg", 16)).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void digitsAreCheckedAgainstThePrefixRadix() {
        assertThat(NumericLiterals.parse("0x1f", 0)).isEqualTo(BigInteger.valueOf(31));
        assertThat(NumericLiterals.parse("-0b11", 0)).isEqualTo(BigInteger.valueOf(-3));
        assertThat(NumericLiterals.isValid("0o18", 0)).isFalse();
        assertThat(NumericLiterals.isValid("0b102", 0)).isFalse();
        assertThatThrownBy(() -> NumericLiterals.parse("0x1g", 0))
                .isInstanceOf(NumberFormatException.class)
                .hasMessageContaining("radix 16");
    }

    @Test
    void formatsValuesForTheirType() {
        assertThat(NumericLiterals.format(BigInteger.valueOf(255), SymbolType.HEX)).isEqualTo("0xff");
        assertThat(NumericLiterals.format(BigInteger.valueOf(-16), SymbolType.HEX)).isEqualTo("-0x10");
        assertThat(NumericLiterals.format(BigInteger.valueOf(255), SymbolType.INT)).isEqualTo("255");
    }

    @Test
    void tristateNamesRoundTrip() {
        assertThat(Tristate.toString(Tristate.M)).isEqualTo("m");
        assertThat(Tristate.parse("y")).hasValue(Tristate.Y);
        assertThat(Tristate.parse("yes")).isEmpty();
        assertThat(Tristate.isValid(3)).isFalse();
    }
}
