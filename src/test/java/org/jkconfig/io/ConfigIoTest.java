package org.jkconfig.io;

import org.jkconfig.Kconfig;
import org.jkconfig.KconfigTestSupport;
import org.jkconfig.api.KconfigException;
import org.jkconfig.model.Tristate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests reading and writing {@code .config} files against the {@code kconfig/sample} tree.
 */
@Tag("integration")
class ConfigIoTest {

    private static final String DEFAULT_CONFIG = """
            CONFIG_MODULES=y

            #
            # General setup
            #
            CONFIG_LOCALVERSION="-sample"
            CONFIG_LOG_BUF_SHIFT=17
            CONFIG_PHYS_START=0x1000000

            #
            # Drivers
            #
            CONFIG_NET=y
            CONFIG_NET_DRIVER=m
            # CONFIG_USB is not set
            # CONFIG_SCHED_SIMPLE is not set
            CONFIG_SCHED_FAIR=y

            #
            # End of configuration
            #
            """;

    @TempDir
    Path tempDir;

    private static Kconfig sample() throws KconfigException {
        return sample(Map.of());
    }

    private static Kconfig sample(Map<String, String> variables) throws KconfigException {
        return Kconfig.builder()
                .filename("Kconfig")
                .environment(KconfigTestSupport.environment(KconfigTestSupport.fixture("sample"), variables))
                .build();
    }

    private String configFile(String content) throws Exception {
        return KconfigTestSupport.write(tempDir, "test.config", content).toString();
    }

    @Test
    void rendersDefaultsInMenuOrder() throws Exception {
        Kconfig kconfig = sample();

        assertEquals(DEFAULT_CONFIG, kconfig.getConfigText());
        assertThat(kconfig.getWarnings()).isEmpty();
    }

    @Test
    void writtenConfigurationLoadsBackToTheSameValues() throws Exception {
        // Arrange
        Kconfig original = sample();
        original.getSyms().get("LOCALVERSION").setValue("-custom \"q\"");
        original.getSyms().get("NET_DRIVER").setValue(Tristate.Y);
        original.getSyms().get("USB").setValue(Tristate.M);
        original.getSyms().get("SCHED_SIMPLE").setValue(Tristate.Y);
        Path file = tempDir.resolve(".config");

        // Act
        original.writeConfig(file.toString());
        Kconfig reloaded = sample();
        reloaded.loadConfig(file.toString());

        // Assert
        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(written).startsWith("# Generated by jkconfig\nCONFIG_MODULES=y\n");
        assertThat(written).contains("CONFIG_LOCALVERSION=\"-custom \\\"q\\\"\"\n");
        assertEquals("# Generated by jkconfig\n", reloaded.getConfigHeader());
        assertEquals("-custom \"q\"", reloaded.getSyms().get("LOCALVERSION").getStrValue());
        assertEquals("y", reloaded.getSyms().get("NET_DRIVER").getStrValue());
        assertEquals("m", reloaded.getSyms().get("USB").getStrValue());
        assertEquals("SCHED_SIMPLE", reloaded.getChoices().get(0).getSelection().getName());
        assertEquals(original.getConfigText(), reloaded.getConfigText());
        assertThat(reloaded.getWarnings()).isEmpty();
    }

    @Test
    void reportsProblemsWithLoadedLines() throws Exception {
        Kconfig kconfig = sample();
        String file = configFile("""
                CONFIG_NET=y
                CONFIG_NET=y
                CONFIG_USB=x
                garbage
                CONFIG_LOCALVERSION=unquoted
                CONFIG_NOPE=y
                CONFIG_NET=n
                """);

        kconfig.loadConfig(file);

        assertThat(kconfig.getWarnings()).containsExactly(
                file + ":2: warning: NET (defined at Kconfig:27) set more than once. "
                        + "Old value: \"y\", new value: \"y\".",
                file + ":3: warning: 'x' is not a valid value for the tristate symbol "
                        + "USB (defined at Kconfig:38). Assignment ignored.",
                file + ":4: warning: ignoring malformed line 'garbage'",
                file + ":5: warning: malformed string literal in assignment to "
                        + "LOCALVERSION (defined at Kconfig:10). Assignment ignored.",
                file + ":7: warning: NET (defined at Kconfig:27) set more than once. "
                        + "Old value: \"y\", new value: \"n\".");
        assertEquals("n", kconfig.getSyms().get("NET").getStrValue());
        assertEquals("-sample", kconfig.getSyms().get("LOCALVERSION").getStrValue());
    }

    @Test
    void undefinedAssignmentsAreReportedOnlyWhenEnabled() throws Exception {
        Kconfig kconfig = sample();
        String file = configFile("CONFIG_NOPE=y\n");

        kconfig.loadConfig(file);
        assertThat(kconfig.getWarnings()).isEmpty();

        kconfig.enableUndefWarnings();
        kconfig.loadConfig(file);
        assertThat(kconfig.getWarnings()).containsExactly(
                file + ":1: warning: attempt to assign the value 'y' to the undefined symbol NOPE");
    }

    @Test
    void redundantAssignmentWarningsCanBeDisabled() throws Exception {
        Kconfig kconfig = sample();
        kconfig.disableRedundantWarnings();

        kconfig.loadConfig(configFile("CONFIG_USB=m\nCONFIG_USB=m\n"));

        assertThat(kconfig.getWarnings()).isEmpty();
        assertEquals("m", kconfig.getSyms().get("USB").getStrValue());
    }

    @Test
    void replaceModeUnsetsSymbolsNotInTheFile() throws Exception {
        // Given
        Kconfig kconfig = sample();
        kconfig.getSyms().get("USB").setValue(Tristate.M);
        String file = configFile("CONFIG_NET_DRIVER=y\n");

        // When
        kconfig.loadConfig(file, false);

        // Then
        assertEquals(1, kconfig.getSyms().get("USB").getUserValue());
        assertEquals("y", kconfig.getSyms().get("NET_DRIVER").getStrValue());

        // When
        kconfig.loadConfig(file, true);

        // Then
        assertNull(kconfig.getSyms().get("USB").getUserValue());
        assertEquals("n", kconfig.getSyms().get("USB").getStrValue());
        assertEquals("y", kconfig.getSyms().get("NET_DRIVER").getStrValue());
    }

    @Test
    void loadingTheSameFileTwiceInReplaceModeChangesNothing() throws Exception {
        // Given
        Kconfig kconfig = sample();
        String file = configFile("CONFIG_USB=m\nCONFIG_SCHED_SIMPLE=y\nCONFIG_LOG_BUF_SHIFT=14\n");
        kconfig.loadConfig(file, true);
        String first = kconfig.getConfigText();

        // When
        kconfig.loadConfig(file, true);

        // Then
        assertEquals(first, kconfig.getConfigText());
        assertEquals("m", kconfig.getSyms().get("USB").getStrValue());
        assertEquals("14", kconfig.getSyms().get("LOG_BUF_SHIFT").getStrValue());
        assertEquals("SCHED_SIMPLE", kconfig.getChoices().get(0).getSelection().getName());
        assertThat(kconfig.getWarnings()).isEmpty();
    }

    @Test
    void notSetLineAssignsN() throws Exception {
        Kconfig kconfig = sample();

        kconfig.loadConfig(configFile("# CONFIG_NET is not set\n"));

        assertEquals(Tristate.N, kconfig.getSyms().get("NET").getTriValue());
        assertEquals(Tristate.N, kconfig.getSyms().get("NET_DRIVER").getTriValue());
        assertThat(kconfig.getConfigText())
                .contains("# CONFIG_NET is not set\n")
                .doesNotContain("NET_DRIVER");
        assertEquals("", kconfig.getConfigHeader());
    }

    @Test
    void leadingCommentsBecomeTheHeader() throws Exception {
        Kconfig kconfig = sample();

        kconfig.loadConfig(configFile("# first\n#\n# second\nCONFIG_USB=y\n# not header\n"));

        assertEquals("# first\n#\n# second\n", kconfig.getConfigHeader());
        assertEquals("y", kconfig.getSyms().get("USB").getStrValue());
    }

    @Test
    void loadsChoiceSelection() throws Exception {
        Kconfig kconfig = sample();

        kconfig.loadConfig(configFile("CONFIG_SCHED_SIMPLE=y\n# CONFIG_SCHED_FAIR is not set\n"));

        assertEquals("SCHED_SIMPLE", kconfig.getChoices().get(0).getSelection().getName());
        assertEquals("y", kconfig.getSyms().get("SCHED_SIMPLE").getStrValue());
        assertEquals("n", kconfig.getSyms().get("SCHED_FAIR").getStrValue());
    }

    @Test
    void usesConfiguredSymbolPrefix() throws Exception {
        Kconfig kconfig = sample(Map.of("CONFIG_", "MY_"));

        kconfig.loadConfig(configFile("MY_USB=y\nCONFIG_NET=n\n"));

        assertThat(kconfig.getConfigText())
                .startsWith("MY_MODULES=y\n")
                .contains("MY_USB=y\n")
                .contains("MY_NET=y\n");
        assertThat(kconfig.getWarnings()).hasSize(1);
        assertThat(kconfig.getWarnings().get(0)).endsWith("ignoring malformed line 'CONFIG_NET=n'");
    }

    @Test
    void missingConfigurationFileIsAnError() throws Exception {
        Kconfig kconfig = sample();
        String missing = tempDir.resolve("missing.config").toString();

        assertThatThrownBy(() -> kconfig.loadConfig(missing))
                .isInstanceOf(KconfigException.class)
                .hasMessageContaining("could not read configuration file '" + missing + "'");
    }
}
