package org.jkconfig;

import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.model.Tristate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Evaluates ad hoc expressions against a small configuration covering every symbol type.
 */
@Tag("unit")
class EvalStringTest {

    private static final String KCONFIG = """
            config MODULES
            	bool "modules"
            	default y
            	option modules

            config BOOL_Y
            	bool "bool"
            	default y

            config TRI_M
            	tristate "tristate"
            	default m

            config INT_5
            	int "int"
            	default 5

            config HEX_10
            	hex "hex"
            	default 0x10

            config STR
            	string "string"
            	default "foo"
            """;

    @TempDir
    Path tempDir;

    private Kconfig kconfig;

    @BeforeEach
    void setUp() throws Exception {
        kconfig = KconfigTestSupport.parse(tempDir, KCONFIG);
    }

    @Test
    void evaluatesTristateOperators() throws KconfigSyntaxException {
        assertThat(kconfig.evalString("BOOL_Y")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("TRI_M")).isEqualTo(Tristate.M);
        assertThat(kconfig.evalString("!TRI_M")).isEqualTo(Tristate.M);
        assertThat(kconfig.evalString("!BOOL_Y")).isEqualTo(Tristate.N);
        assertThat(kconfig.evalString("BOOL_Y && TRI_M")).isEqualTo(Tristate.M);
        assertThat(kconfig.evalString("BOOL_Y || TRI_M")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("(BOOL_Y || TRI_M) && !BOOL_Y")).isEqualTo(Tristate.N);
    }

    @Test
    void bareMDependsOnModules() throws KconfigSyntaxException {
        assertThat(kconfig.evalString("m")).isEqualTo(Tristate.M);

        kconfig.getSyms().get("MODULES").setValue(Tristate.N);

        assertThat(kconfig.evalString("m")).isEqualTo(Tristate.N);
        assertThat(kconfig.evalString("y")).isEqualTo(Tristate.Y);
    }

    @Test
    void comparesNumbersNumerically() throws KconfigSyntaxException {
        assertThat(kconfig.evalString("INT_5 = 5")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("INT_5 > 3")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("INT_5 < 3")).isEqualTo(Tristate.N);
        assertThat(kconfig.evalString("HEX_10 = 16")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("HEX_10 <= 0x10")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("BOOL_Y = y")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("TRI_M != y")).isEqualTo(Tristate.Y);
    }

    @Test
    void comparesStringsAsText() throws KconfigSyntaxException {
        assertThat(kconfig.evalString("STR = \"foo\"")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("STR = foo")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("STR != 'bar'")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("STR < \"goo\"")).isEqualTo(Tristate.Y);
    }

    @Test
    void undefinedSymbolsAreN() throws KconfigSyntaxException {
        assertThat(kconfig.evalString("NOT_DEFINED")).isEqualTo(Tristate.N);
        assertThat(kconfig.evalString("!NOT_DEFINED")).isEqualTo(Tristate.Y);
        assertThat(kconfig.getWarnings()).isEmpty();
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThatThrownBy(() -> kconfig.evalString("")).isInstanceOf(KconfigSyntaxException.class);
        assertThatThrownBy(() -> kconfig.evalString("BOOL_Y &&")).isInstanceOf(KconfigSyntaxException.class);
        assertThatThrownBy(() -> kconfig.evalString("(BOOL_Y")).isInstanceOf(KconfigSyntaxException.class);
        assertThatThrownBy(() -> kconfig.evalString("BOOL_Y TRI_M"))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("extra tokens at end of line");
        assertThatThrownBy(() -> kconfig.evalString("BOOL_Y ="))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("expected symbol after '='");
    }

    @Test
    void evaluationFollowsUserValues() throws KconfigSyntaxException {
        kconfig.getSyms().get("BOOL_Y").setValue(Tristate.N);
        kconfig.getSyms().get("INT_5").setValue("12");

        assertThat(kconfig.evalString("BOOL_Y")).isEqualTo(Tristate.N);
        assertThat(kconfig.evalString("INT_5 = 12")).isEqualTo(Tristate.Y);
    }
}
