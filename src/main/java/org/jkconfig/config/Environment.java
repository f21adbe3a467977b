package org.jkconfig.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable snapshot of the environment variables a configuration is built against.
 * <p>
 * The snapshot is taken once, when the configuration is constructed. Later changes to the process
 * environment do not affect it, and tests can supply their own variables through {@link #of(Map)}.
 */
public final class Environment {

    /** Variable naming the root directory that Kconfig files are resolved against. */
    public static final String SRCTREE = "srctree";
    /** Variable overriding the symbol name prefix used in configuration files. */
    public static final String CONFIG_PREFIX = "CONFIG_";
    /** Variable naming an extra configuration file merged by the configuration generators. */
    public static final String KCONFIG_ALLCONFIG = "KCONFIG_ALLCONFIG";

    private static final String DEFAULT_CONFIG_PREFIX = "CONFIG_";
    private static final Pattern VARIABLE = Pattern.compile(
            "\\$(?:\\{([A-Za-z0-9_]+)}|\\(([A-Za-z0-9_]+)\\)|([A-Za-z0-9_]+))");

    private final Map<String, String> variables;

    private Environment(Map<String, String> variables) {
        this.variables = Collections.unmodifiableMap(new HashMap<>(variables));
    }

    /**
     * @return A snapshot of the current process environment.
     */
    public static Environment system() {
        return new Environment(System.getenv());
    }

    /**
     * @param variables The variables to expose.
     * @return An environment consisting of exactly the given variables.
     */
    public static Environment of(Map<String, String> variables) {
        return new Environment(variables);
    }

    /**
     * @return An environment without any variables.
     */
    public static Environment empty() {
        return new Environment(Map.of());
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * @return The source tree root, if {@code srctree} is set.
     */
    public Optional<String> srctree() {
        return get(SRCTREE);
    }

    /**
     * @return The value of {@code CONFIG_}, or {@code "CONFIG_"} when it is not set.
     */
    public String configPrefix() {
        return variables.getOrDefault(CONFIG_PREFIX, DEFAULT_CONFIG_PREFIX);
    }

    public Optional<String> allconfig() {
        return get(KCONFIG_ALLCONFIG);
    }

    /**
     * Expands {@code $NAME}, {@code ${NAME}} and {@code $(NAME)} references to environment variables.
     * References to unset variables are left as they are.
     *
     * @param text The text to expand.
     * @return The expanded text.
     */
    public String expand(String text) {
        Matcher matcher = VARIABLE.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1)
                    : matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            String value = variables.get(name);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
