package org.jkconfig.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class KconfigSettingsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        KconfigSettings settings = KconfigSettings.defaults();

        assertEquals("Kconfig", settings.kconfigFile());
        assertEquals(".config", settings.configFile());
        assertEquals("Linux Kernel Configuration", settings.defaultMainmenuPrompt());
        assertEquals("# Generated by jkconfig\n", settings.configHeader());
        assertTrue(settings.warningsEnabled());
        assertFalse(settings.undefinedAssignmentWarnings());
        assertTrue(settings.redundantAssignmentWarnings());
    }

    @Test
    void overridesFallBackToDefaults() {
        KconfigSettings settings = KconfigSettings.fromConfig(ConfigFactory.parseString("""
                jkconfig {
                  config-file = "out.config"
                  warnings.undefined-assignment = true
                }
                """).withFallback(ConfigFactory.load()));

        assertEquals("out.config", settings.configFile());
        assertEquals("Kconfig", settings.kconfigFile());
        assertTrue(settings.undefinedAssignmentWarnings());
    }

    @Test
    void missingKeysAreReported() {
        assertThatThrownBy(() -> KconfigSettings.fromConfig(ConfigFactory.parseString("jkconfig {}")))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
