package org.jkconfig.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tool defaults read from the {@code jkconfig} block of the HOCON configuration.
 *
 * <pre>
 * jkconfig {
 *   kconfig-file = "Kconfig"
 *   config-file = ".config"
 *   default-mainmenu-prompt = "Linux Kernel Configuration"
 *   config-header = "# Generated by jkconfig\n"
 *   warnings {
 *     enabled = true
 *     undefined-assignment = false
 *     redundant-assignment = true
 *   }
 * }
 * </pre>
 *
 * @param kconfigFile The top-level Kconfig file used when none is given.
 * @param configFile The configuration file written when no output is given.
 * @param defaultMainmenuPrompt The main menu prompt used when no {@code mainmenu} statement exists.
 * @param configHeader The header written at the top of configuration files.
 * @param warningsEnabled Whether warnings are reported at all.
 * @param undefinedAssignmentWarnings Whether assignments to undefined symbols in loaded files are reported.
 * @param redundantAssignmentWarnings Whether repeated assignments of the same value are reported.
 */
public record KconfigSettings(
        String kconfigFile,
        String configFile,
        String defaultMainmenuPrompt,
        String configHeader,
        boolean warningsEnabled,
        boolean undefinedAssignmentWarnings,
        boolean redundantAssignmentWarnings
) {
    private static final String ROOT = "jkconfig";

    /**
     * Reads the settings from the {@code jkconfig} block of the given configuration.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     */
    public static KconfigSettings fromConfig(Config config) {
        Config root = config.getConfig(ROOT);
        Config warnings = root.getConfig("warnings");
        return new KconfigSettings(
                root.getString("kconfig-file"),
                root.getString("config-file"),
                root.getString("default-mainmenu-prompt"),
                root.getString("config-header"),
                warnings.getBoolean("enabled"),
                warnings.getBoolean("undefined-assignment"),
                warnings.getBoolean("redundant-assignment"));
    }

    /**
     * @return The settings from the classpath defaults ({@code reference.conf}).
     */
    public static KconfigSettings defaults() {
        return fromConfig(ConfigFactory.load());
    }
}
