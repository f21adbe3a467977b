package org.jkconfig.model;

import org.jkconfig.Kconfig;
import org.jkconfig.KconfigTestSupport;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests the value computation of symbols: visibility, assignable values, defaults, select,
 * imply, ranges and user values.
 */
@Tag("unit")
class SymbolTest {

    private static final String MODULES = """
            config MODULES
            	bool "modules"
            	default y

            """;

    @TempDir
    Path tempDir;

    private Kconfig parse(String text) throws Exception {
        return KconfigTestSupport.parse(tempDir, MODULES + text);
    }

    private static Symbol sym(Kconfig kconfig, String name) {
        return kconfig.getSyms().get(name);
    }

    @Test
    void visibilityFollowsDependencies() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A"

                config B
                	tristate "B"
                	depends on A
                """);
        Symbol a = sym(kconfig, "A");
        Symbol b = sym(kconfig, "B");

        assertThat(a.getTriValue()).isEqualTo(Tristate.N);
        assertThat(a.getAssignable()).containsExactly(0, 2);
        assertThat(b.getVisibility()).isEqualTo(Tristate.N);
        assertThat(b.getAssignable()).isEmpty();

        assertThat(a.setValue(Tristate.Y)).isTrue();

        assertThat(b.getVisibility()).isEqualTo(Tristate.Y);
        assertThat(b.getAssignable()).containsExactly(0, 1, 2);
        assertThat(b.setValue("m")).isTrue();
        assertThat(b.getStrValue()).isEqualTo("m");
    }

    @Test
    void userValueIsLimitedByVisibility() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	tristate "A"

                config B
                	tristate "B" if A
                """);
        sym(kconfig, "A").setValue(Tristate.M);
        sym(kconfig, "B").setValue(Tristate.Y);

        assertThat(sym(kconfig, "B").getVisibility()).isEqualTo(Tristate.M);
        assertThat(sym(kconfig, "B").getTriValue()).isEqualTo(Tristate.M);
        assertThat(sym(kconfig, "B").getAssignable()).containsExactly(0, 1);
    }

    @Test
    void tristateActsAsBoolWithoutModules() throws Exception {
        Kconfig kconfig = parse("""
                config T
                	tristate "T"
                	default m
                """);
        Symbol t = sym(kconfig, "T");
        assertThat(t.getType()).isEqualTo(SymbolType.TRISTATE);
        assertThat(t.getTriValue()).isEqualTo(Tristate.M);

        sym(kconfig, "MODULES").setValue(Tristate.N);

        assertThat(t.getType()).isEqualTo(SymbolType.BOOL);
        assertThat(t.getTriValue()).isEqualTo(Tristate.Y);
        assertThat(t.getAssignable()).containsExactly(0, 2);
    }

    @Test
    void firstDefaultWithTrueConditionWins() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A"

                config C
                	bool
                	default n if A
                	default y
                """);
        Symbol c = sym(kconfig, "C");
        assertThat(c.getTriValue()).isEqualTo(Tristate.Y);

        sym(kconfig, "A").setValue(Tristate.Y);

        assertThat(c.getTriValue()).isEqualTo(Tristate.N);
    }

    @Test
    void userValueOnSymbolWithoutPromptHasNoEffect() throws Exception {
        Kconfig kconfig = parse("""
                config C
                	bool
                	default y
                """);
        Symbol c = sym(kconfig, "C");

        assertThat(c.setValue(Tristate.N)).isTrue();

        assertThat(c.getTriValue()).isEqualTo(Tristate.Y);
        assertThat(kconfig.getWarnings())
                .anyMatch(w -> w.contains("C (defined at Kconfig:5) has no prompt, meaning user values have no effect on it"));
    }

    @Test
    void invalidUserValuesAreRejected() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A"

                config I
                	int "I"

                config H
                	hex "H"
                """);

        assertThat(sym(kconfig, "A").setValue("m")).isFalse();
        assertThat(sym(kconfig, "A").setValue("yes")).isFalse();
        assertThat(sym(kconfig, "I").setValue("0x10")).isFalse();
        assertThat(sym(kconfig, "H").setValue("-1")).isFalse();
        assertThat(sym(kconfig, "H").setValue("ABC")).isTrue();

        assertThat(sym(kconfig, "A").getUserValue()).isNull();
        assertThat(sym(kconfig, "H").getStrValue()).isEqualTo("ABC");
        assertThat(kconfig.getWarnings())
                .anyMatch(w -> w.contains("the value m is invalid for A (defined at Kconfig:5), which has type bool"));
    }

    @Test
    void selectForcesMinimumValue() throws Exception {
        Kconfig kconfig = parse("""
                config S
                	tristate "S"
                	select T

                config T
                	tristate "T"
                	depends on D

                config D
                	bool "D"
                """);
        Symbol s = sym(kconfig, "S");
        Symbol t = sym(kconfig, "T");
        sym(kconfig, "D").setValue(Tristate.Y);
        assertThat(t.getTriValue()).isEqualTo(Tristate.N);

        s.setValue(Tristate.M);

        assertThat(t.getTriValue()).isEqualTo(Tristate.M);
        assertThat(t.getAssignable()).containsExactly(1, 2);

        s.setValue(Tristate.Y);

        assertThat(t.getTriValue()).isEqualTo(Tristate.Y);
        assertThat(t.getAssignable()).containsExactly(2);
    }

    @Test
    void selectIgnoresUnmetDependenciesWithWarning() throws Exception {
        Kconfig kconfig = parse("""
                config S
                	bool "S"
                	select T

                config T
                	bool "T"
                	depends on D

                config D
                	bool "D"
                """);
        sym(kconfig, "S").setValue(Tristate.Y);

        assertThat(sym(kconfig, "T").getTriValue()).isEqualTo(Tristate.Y);
        assertThat(kconfig.getWarnings())
                .anyMatch(w -> w.contains("has direct dependencies D with value n, but is currently being selected to y by S"));
    }

    @Test
    void implyRaisesOnlyTheDefault() throws Exception {
        Kconfig kconfig = parse("""
                config I
                	bool "I"
                	imply J

                config J
                	tristate "J"
                """);
        Symbol j = sym(kconfig, "J");
        assertThat(j.getTriValue()).isEqualTo(Tristate.N);

        sym(kconfig, "I").setValue(Tristate.Y);

        assertThat(j.getTriValue()).isEqualTo(Tristate.Y);
        assertThat(j.getAssignable()).containsExactly(0, 2);

        j.setValue(Tristate.N);

        assertThat(j.getTriValue()).isEqualTo(Tristate.N);
    }

    @Test
    void outOfRangeDefaultIsClamped() throws Exception {
        Kconfig kconfig = parse("""
                config R
                	int "R"
                	range 1 10
                	default 20
                """);

        assertEquals("10", sym(kconfig, "R").getStrValue());
        assertThat(kconfig.getWarnings()).containsExactly(
                "warning: default value 20 on R (defined at Kconfig:5) clamped to 10 due to being outside the "
                        + "active range ([1, 10])");
    }

    @Test
    void outOfRangeUserValueFallsBackOnDefault() throws Exception {
        Kconfig kconfig = parse("""
                config R
                	int "R"
                	range 1 10
                	default 4
                """);
        Symbol r = sym(kconfig, "R");

        assertThat(r.setValue("7")).isTrue();
        assertEquals("7", r.getStrValue());

        assertThat(r.setValue("50")).isTrue();
        assertEquals("4", r.getStrValue());
        assertThat(kconfig.getWarnings()).anyMatch(w -> w.contains(
                "user value 50 on the int symbol R (defined at Kconfig:5) ignored due to being outside the "
                        + "active range ([1, 10]) -- falling back on defaults"));
    }

    @Test
    void hexWithoutDefaultStartsAtLowerBound() throws Exception {
        Kconfig kconfig = parse("""
                config H
                	hex "H"
                	range 0x10 0x20
                """);
        Symbol h = sym(kconfig, "H");

        assertEquals("0x10", h.getStrValue());
        assertThat(h.setValue("0x18")).isTrue();
        assertEquals("0x18", h.getStrValue());
        assertThat(kconfig.getWarnings()).isEmpty();
    }

    @Test
    void stringDefaultAndUserValue() throws Exception {
        Kconfig kconfig = parse("""
                config S
                	string "S"
                	default "hello"
                """);
        Symbol s = sym(kconfig, "S");
        assertEquals("hello", s.getStrValue());
        assertEquals("CONFIG_S=\"hello\"\n", s.getConfigString());

        s.setValue("say \"hi\"");

        assertEquals("CONFIG_S=\"say \\\"hi\\\"\"\n", s.getConfigString());

        s.unsetValue();

        assertEquals("hello", s.getStrValue());
    }

    @Test
    void configStringsPerType() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A"

                config HIDDEN
                	bool
                """);

        assertEquals("CONFIG_MODULES=y\n", sym(kconfig, "MODULES").getConfigString());
        assertEquals("# CONFIG_A is not set\n", sym(kconfig, "A").getConfigString());
        assertEquals("", sym(kconfig, "HIDDEN").getConfigString());
    }

    @Test
    void changingAValueInvalidatesDependents() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A"

                config B
                	bool
                	default A

                config C
                	bool
                	default B
                """);
        Symbol c = sym(kconfig, "C");
        assertThat(c.getTriValue()).isEqualTo(Tristate.N);

        sym(kconfig, "A").setValue(Tristate.Y);

        assertThat(c.getTriValue()).isEqualTo(Tristate.Y);
        assertThat(sym(kconfig, "A").getDependents()).extracting(ConfigItem::getName).contains("B");
    }

    @Test
    void describesItself() throws Exception {
        Kconfig kconfig = parse("""
                config A
                	bool "A"
                """);
        Symbol a = sym(kconfig, "A");

        assertEquals("<symbol A, bool, \"A\", value n, visibility y, direct deps y, Kconfig:5>", a.toString());

        a.setValue(Tristate.Y);

        assertEquals("<symbol A, bool, \"A\", value y, user value y, visibility y, direct deps y, Kconfig:5>",
                a.toString());
        assertEquals("<symbol MISSING, unknown, value \"MISSING\", visibility n, direct deps n, undefined>",
                kconfig.lookupSymbol("MISSING").toString());
    }
}
