package org.jkconfig.tools;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.model.Choice;
import org.jkconfig.model.ConfigItem;
import org.jkconfig.model.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generates whole configurations: every symbol as low as possible, every symbol as high as
 * possible, or the defaults with extra values from the {@code KCONFIG_ALLCONFIG} file.
 * <p>
 * Warnings are disabled while the values are assigned, since many assignments are expected to
 * be rejected or overridden.
 */
public final class ConfigGenerators {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigGenerators.class);
    private static final String ALL_CONFIG = "all.config";

    private ConfigGenerators() {
    }

    /**
     * Sets {@code allnoconfig_y} symbols to y, then lowers every other non-choice symbol to its
     * lowest assignable value until nothing changes.
     *
     * @param kconfig The configuration.
     * @param keep Items whose values must not be touched.
     */
    public static void allnoconfig(Kconfig kconfig, Set<ConfigItem> keep) {
        withWarningsDisabled(kconfig, () -> {
            for (Symbol symbol : kconfig.getDefinedSyms()) {
                if (symbol.isAllnoconfigY() && !keep.contains(symbol) && symbol.getEnvVar() == null) {
                    symbol.setValue(2);
                }
            }
            int passes = 0;
            boolean changed = true;
            while (changed) {
                changed = false;
                passes++;
                for (Symbol symbol : kconfig.getDefinedSyms()) {
                    if (symbol.getChoice() != null || symbol.isAllnoconfigY() || !isAssignable(symbol, keep)) {
                        continue;
                    }
                    List<Integer> assignable = symbol.getAssignable();
                    if (!assignable.isEmpty() && symbol.getTriValue() > assignable.get(0)) {
                        changed |= lower(symbol, assignable.get(0));
                    }
                }
            }
            LOG.debug("allnoconfig settled after {} passes", passes);
        });
    }

    /**
     * Sets every symbol once: {@code allnoconfig_y} symbols to y and all others to n.
     *
     * @param kconfig The configuration.
     * @param keep Items whose values must not be touched.
     */
    public static void allnoconfigSimple(Kconfig kconfig, Set<ConfigItem> keep) {
        withWarningsDisabled(kconfig, () -> {
            for (Symbol symbol : kconfig.getDefinedSyms()) {
                if (isAssignable(symbol, keep)) {
                    symbol.setValue(symbol.isAllnoconfigY() ? 2 : 0);
                }
            }
        });
    }

    /**
     * Raises every non-choice symbol and every choice to its highest assignable value until
     * nothing changes. Choices ending up in m mode get all their members set to m.
     *
     * @param kconfig The configuration.
     * @param keep Items whose values must not be touched.
     */
    public static void allyesconfig(Kconfig kconfig, Set<ConfigItem> keep) {
        withWarningsDisabled(kconfig, () -> {
            int passes = 0;
            boolean changed = true;
            while (changed) {
                changed = false;
                passes++;
                for (Symbol symbol : kconfig.getDefinedSyms()) {
                    if (symbol.getChoice() != null || !isAssignable(symbol, keep)) {
                        continue;
                    }
                    List<Integer> assignable = symbol.getAssignable();
                    if (!assignable.isEmpty() && symbol.getTriValue() < assignable.get(assignable.size() - 1)) {
                        changed |= raise(symbol, assignable.get(assignable.size() - 1));
                    }
                }
                for (Choice choice : kconfig.getChoices()) {
                    if (keep.contains(choice)) {
                        continue;
                    }
                    List<Integer> assignable = choice.getAssignable();
                    int before = choice.getTriValue();
                    if (!assignable.isEmpty() && before < assignable.get(assignable.size() - 1)) {
                        if (!choice.setValue(assignable.get(assignable.size() - 1)) || choice.getTriValue() == before) {
                            continue;
                        }
                        changed = true;
                        if (choice.getTriValue() == 1) {
                            for (Symbol symbol : choice.getSymbols()) {
                                symbol.setValue(1);
                            }
                        }
                    }
                }
            }
            LOG.debug("allyesconfig settled after {} passes", passes);
        });
    }

    /**
     * Loads the file named by {@code KCONFIG_ALLCONFIG} in append mode, if the variable is set.
     * When it is empty or {@code 1}, the generator specific file (e.g. {@code allno.config}) is
     * tried first, then {@code all.config}.
     *
     * @param kconfig The configuration.
     * @param generatorFile The generator specific file name.
     * @return The symbols and choices the file assigned, which the generators leave untouched.
     * @throws KconfigException if the variable is set but no file can be loaded.
     */
    public static Set<ConfigItem> loadAllconfig(Kconfig kconfig, String generatorFile) throws KconfigException {
        Optional<String> allconfig = kconfig.getEnvironment().allconfig();
        if (allconfig.isEmpty()) {
            return Set.of();
        }

        String value = allconfig.get();
        String file;
        if (value.isEmpty() || value.equals("1")) {
            if (Files.isRegularFile(Path.of(generatorFile))) {
                file = generatorFile;
            } else if (Files.isRegularFile(Path.of(ALL_CONFIG))) {
                file = ALL_CONFIG;
            } else {
                throw new KconfigException("KCONFIG_ALLCONFIG is set, but neither " + generatorFile + " nor "
                        + ALL_CONFIG + " could be opened");
            }
        } else {
            if (!Files.isRegularFile(Path.of(value))) {
                throw new KconfigException("KCONFIG_ALLCONFIG is set to '" + value + "', which could not be opened");
            }
            file = value;
        }

        kconfig.loadConfig(file, false);
        LOG.info("Merged {} from KCONFIG_ALLCONFIG", file);

        Set<ConfigItem> assigned = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Symbol symbol : kconfig.getDefinedSyms()) {
            if (symbol.wasSet()) {
                assigned.add(symbol);
            }
        }
        for (Choice choice : kconfig.getChoices()) {
            if (choice.wasSet()) {
                assigned.add(choice);
            }
        }
        return assigned;
    }

    // Symbols taking their value from the environment reject user values.
    private static boolean isAssignable(Symbol symbol, Set<ConfigItem> keep) {
        return symbol.getEnvVar() == null && !keep.contains(symbol);
    }

    private static boolean lower(Symbol symbol, int value) {
        int before = symbol.getTriValue();
        return symbol.setValue(value) && symbol.getTriValue() < before;
    }

    private static boolean raise(Symbol symbol, int value) {
        int before = symbol.getTriValue();
        return symbol.setValue(value) && symbol.getTriValue() > before;
    }

    private static void withWarningsDisabled(Kconfig kconfig, Runnable action) {
        boolean enabled = kconfig.areWarningsEnabled();
        kconfig.disableWarnings();
        try {
            action.run();
        } finally {
            if (enabled) {
                kconfig.enableWarnings();
            }
        }
    }
}
