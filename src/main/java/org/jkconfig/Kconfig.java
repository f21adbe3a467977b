package org.jkconfig;

import org.jkconfig.api.KconfigException;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.api.SourceInfo;
import org.jkconfig.config.Environment;
import org.jkconfig.config.KconfigSettings;
import org.jkconfig.diagnostics.DiagnosticsEngine;
import org.jkconfig.frontend.finalizer.TreeFinalizer;
import org.jkconfig.frontend.parser.Parser;
import org.jkconfig.io.ConfigLoader;
import org.jkconfig.io.ConfigWriter;
import org.jkconfig.model.Choice;
import org.jkconfig.model.DefaultValue;
import org.jkconfig.model.Expressions;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Prompt;
import org.jkconfig.model.Symbol;
import org.jkconfig.model.SymbolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed Kconfig configuration: the symbol tables, the menu tree and the warning settings.
 * <p>
 * An instance is built once from a top-level Kconfig file and is then queried and modified
 * through its symbols and choices, or by loading configuration files. It is not thread-safe;
 * independent instances can be used from different threads.
 *
 * <pre>
 * Kconfig kconfig = Kconfig.builder()
 *         .filename("Kconfig")
 *         .environment(Environment.of(Map.of("srctree", "/path/to/tree")))
 *         .build();
 * kconfig.loadConfig(".config");
 * kconfig.getSyms().get("FOO").setValue("y");
 * kconfig.writeConfig(".config");
 * </pre>
 */
public final class Kconfig {

    private static final Logger LOG = LoggerFactory.getLogger(Kconfig.class);
    private static final Pattern SYMBOL_REFERENCE = Pattern.compile("\\$([A-Za-z0-9_]+)");

    private final String filename;
    private final Environment environment;
    private final KconfigSettings settings;
    private final DiagnosticsEngine diagnostics;
    private final String srctree;
    private final String configPrefix;

    private final Map<String, Symbol> syms = new LinkedHashMap<>();
    private final Map<String, Symbol> constSyms = new LinkedHashMap<>();
    private final List<Symbol> definedSyms = new ArrayList<>();
    private final Map<String, Choice> namedChoices = new LinkedHashMap<>();
    private final List<Choice> choices = new ArrayList<>();
    private final Map<Symbol, SourceInfo> firstReferences = new HashMap<>();

    private final Symbol n;
    private final Symbol m;
    private final Symbol y;
    private final Symbol modules;
    private final MenuNode topNode;
    private Symbol defconfigList;

    private boolean undefWarnings;
    private boolean redundantWarnings;
    private boolean noPromptWarnings = true;
    private String configHeader = "";

    private Kconfig(Builder builder) throws KconfigException {
        this.filename = builder.filename;
        this.environment = builder.environment;
        this.settings = builder.settings;
        this.diagnostics = new DiagnosticsEngine(builder.warn && settings.warningsEnabled());
        this.undefWarnings = settings.undefinedAssignmentWarnings();
        this.redundantWarnings = settings.redundantAssignmentWarnings();
        this.srctree = environment.srctree().orElse(null);
        this.configPrefix = environment.configPrefix();

        // n has to exist before any other symbol, since it is the initial dependency of each.
        this.n = Symbol.tristateConstant(this, 0);
        this.m = Symbol.tristateConstant(this, 1);
        this.y = Symbol.tristateConstant(this, 2);
        for (Symbol constant : List.of(n, m, y)) {
            constSyms.put(constant.getName(), constant);
        }

        this.modules = lookupSymbol("MODULES");

        Symbol unameRelease = new Symbol(this, "UNAME_RELEASE", true);
        unameRelease.setOrigType(SymbolType.STRING);
        unameRelease.setEnvVar("<uname release>");
        unameRelease.addDefaults(List.of(new DefaultValue(lookupConstant(System.getProperty("os.version", "")), y)));
        syms.put(unameRelease.getName(), unameRelease);
        constSyms.put(unameRelease.getName(), unameRelease);

        this.topNode = new MenuNode(this, MenuNode.Kind.MENU, null, null, new SourceInfo(filename, 1));
        topNode.setPrompt(new Prompt(settings.defaultMainmenuPrompt(), y));

        long start = System.nanoTime();
        new Parser(this, environment).parse(filename, topNode);
        new TreeFinalizer(this).finalizeTree();
        LOG.info("Parsed {}: {} symbols ({} defined), {} choices in {} ms", filename, syms.size(),
                definedSyms.size(), choices.size(), (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * Parses a top-level Kconfig file against the process environment and the default settings.
     *
     * @param kconfigFile The top-level Kconfig file.
     * @return The configuration.
     * @throws KconfigException if the files cannot be read or contain syntax errors.
     */
    public static Kconfig parse(Path kconfigFile) throws KconfigException {
        return builder().filename(kconfigFile.toString()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Kconfig} instances.
     */
    public static final class Builder {
        private String filename = "Kconfig";
        private Environment environment;
        private KconfigSettings settings;
        private boolean warn = true;

        private Builder() {
        }

        /**
         * @param filename The top-level Kconfig file, relative to {@code srctree} when that is set.
         */
        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder environment(Environment environment) {
            this.environment = environment;
            return this;
        }

        public Builder settings(KconfigSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * @param warn {@code false} disables warnings from the start, including those raised while parsing.
         */
        public Builder warn(boolean warn) {
            this.warn = warn;
            return this;
        }

        /**
         * @return The parsed configuration.
         * @throws KconfigException if the files cannot be read or contain syntax errors.
         */
        public Kconfig build() throws KconfigException {
            if (environment == null) {
                environment = Environment.system();
            }
            if (settings == null) {
                settings = KconfigSettings.defaults();
            }
            return new Kconfig(this);
        }
    }

    // Symbol tables

    /**
     * Returns the symbol with the given name, creating an undefined one if it does not exist yet.
     *
     * @param name The symbol name.
     * @return The symbol.
     */
    public Symbol lookupSymbol(String name) {
        return syms.computeIfAbsent(name, key -> new Symbol(this, key, false));
    }

    /**
     * Returns the constant symbol with the given name, creating it if needed.
     *
     * @param name The constant value.
     * @return The constant symbol.
     */
    public Symbol lookupConstant(String name) {
        return constSyms.computeIfAbsent(name, key -> new Symbol(this, key, true));
    }

    /**
     * Returns the named choice, creating it if needed, or a new unnamed choice.
     *
     * @param name The choice name, or {@code null}.
     * @return The choice.
     */
    public Choice lookupChoice(String name) {
        if (name != null && namedChoices.containsKey(name)) {
            return namedChoices.get(name);
        }
        Choice choice = new Choice(this, name);
        if (name != null) {
            namedChoices.put(name, choice);
        }
        choices.add(choice);
        return choice;
    }

    public void registerDefinedSymbol(Symbol symbol) {
        definedSyms.add(symbol);
    }

    /**
     * Remembers where a symbol is referenced first.
     */
    public void noteReference(Symbol symbol, SourceInfo location) {
        firstReferences.putIfAbsent(symbol, location);
    }

    public Optional<SourceInfo> getFirstReference(Symbol symbol) {
        return Optional.ofNullable(firstReferences.get(symbol));
    }

    /**
     * @return All non-constant symbols, defined or referenced, plus {@code UNAME_RELEASE}, in creation order.
     */
    public Map<String, Symbol> getSyms() {
        return Collections.unmodifiableMap(syms);
    }

    public Map<String, Symbol> getConstSyms() {
        return Collections.unmodifiableMap(constSyms);
    }

    /**
     * @return The symbols with at least one definition, in the order of their first definition.
     */
    public List<Symbol> getDefinedSyms() {
        return Collections.unmodifiableList(definedSyms);
    }

    public Map<String, Choice> getNamedChoices() {
        return Collections.unmodifiableMap(namedChoices);
    }

    public List<Choice> getChoices() {
        return Collections.unmodifiableList(choices);
    }

    public MenuNode getTopNode() {
        return topNode;
    }

    /**
     * @return Every node of the menu tree below the top node, in depth-first order.
     */
    public List<MenuNode> nodes() {
        List<MenuNode> result = new ArrayList<>();
        MenuNode node = topNode.getList();
        while (node != null) {
            result.add(node);
            if (node.getList() != null) {
                node = node.getList();
            } else if (node.getNext() != null) {
                node = node.getNext();
            } else {
                node = node.getParent();
                while (node != null && node.getNext() == null) {
                    node = node.getParent();
                }
                node = node == null ? null : node.getNext();
            }
        }
        return result;
    }

    public Symbol getN() {
        return n;
    }

    public Symbol getM() {
        return m;
    }

    public Symbol getY() {
        return y;
    }

    /**
     * @return The symbol named {@code MODULES}, which enables tristate values.
     */
    public Symbol getModules() {
        return modules;
    }

    /**
     * @return The symbol with {@code option defconfig_list}, or {@code null}.
     */
    public Symbol getDefconfigList() {
        return defconfigList;
    }

    public void setDefconfigList(Symbol defconfigList) {
        this.defconfigList = defconfigList;
    }

    public String getFilename() {
        return filename;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public KconfigSettings getSettings() {
        return settings;
    }

    /**
     * @return The source tree root, or {@code null} when {@code srctree} is not set.
     */
    public String getSrctree() {
        return srctree;
    }

    public String getConfigPrefix() {
        return configPrefix;
    }

    // Values

    /**
     * Parses and evaluates an expression, e.g. {@code "FOO && (BAR || BAZ = 3)"}.
     * Undefined symbols referenced by the expression are created.
     *
     * @param expression The expression text.
     * @return The tristate value.
     * @throws KconfigSyntaxException if the expression is malformed.
     */
    public int evalString(String expression) throws KconfigSyntaxException {
        return Expressions.value(new Parser(this, environment).parseExpression(expression));
    }

    /**
     * Invalidates the cached values of every defined symbol and every choice.
     */
    public void invalidateAll() {
        for (Symbol symbol : definedSyms) {
            symbol.invalidate();
        }
        for (Choice choice : choices) {
            choice.invalidate();
        }
    }

    /**
     * Removes every user value and user selection.
     */
    public void unsetValues() {
        for (Symbol symbol : definedSyms) {
            symbol.unsetValue();
        }
        for (Choice choice : choices) {
            choice.unsetValue();
        }
        invalidateAll();
    }

    // Configuration files

    /**
     * Loads a configuration file, replacing all user values.
     *
     * @param configFile The file to load.
     * @throws KconfigException if the file cannot be read.
     */
    public void loadConfig(String configFile) throws KconfigException {
        loadConfig(configFile, true);
    }

    /**
     * Loads a configuration file.
     *
     * @param configFile The file to load.
     * @param replace {@code true} to unset every symbol the file does not assign,
     *                {@code false} to add to the current user values.
     * @throws KconfigException if the file cannot be read.
     */
    public void loadConfig(String configFile, boolean replace) throws KconfigException {
        boolean previous = noPromptWarnings;
        noPromptWarnings = false;
        try {
            configHeader = new ConfigLoader(this).load(Path.of(configFile), replace);
        } finally {
            noPromptWarnings = previous;
        }
    }

    /**
     * Writes the configuration with the header from the settings.
     *
     * @param configFile The file to write.
     * @throws KconfigException if the file cannot be written.
     */
    public void writeConfig(String configFile) throws KconfigException {
        writeConfig(configFile, settings.configHeader());
    }

    /**
     * Writes the configuration.
     *
     * @param configFile The file to write.
     * @param header Text written verbatim at the top of the file.
     * @throws KconfigException if the file cannot be written.
     */
    public void writeConfig(String configFile, String header) throws KconfigException {
        new ConfigWriter(this).write(Path.of(configFile), header);
    }

    /**
     * @return The configuration file content that {@link #writeConfig(String)} would write, without the header.
     */
    public String getConfigText() {
        return new ConfigWriter(this).render();
    }

    /**
     * @return The leading comment lines of the last loaded configuration file, each ending in a newline.
     */
    public String getConfigHeader() {
        return configHeader;
    }

    /**
     * Finds the first existing file among the defaults of the {@code defconfig_list} symbol whose
     * conditions hold. {@code $SYM} references are expanded, and relative names that do not exist
     * are also looked up below {@code srctree}.
     *
     * @return The file name as it was found, if any.
     */
    public Optional<String> defconfigFilename() {
        if (defconfigList == null) {
            return Optional.empty();
        }
        for (DefaultValue defaultValue : defconfigList.getDefaults()) {
            if (Expressions.value(defaultValue.condition()) == 0) {
                continue;
            }
            String name = expandSymbolReferences(Expressions.strValue(defaultValue.value()));
            Path path = Path.of(name);
            if (Files.isRegularFile(path)) {
                return Optional.of(name);
            }
            if (!path.isAbsolute() && srctree != null) {
                Path inTree = Path.of(srctree).resolve(path);
                if (Files.isRegularFile(inTree)) {
                    return Optional.of(inTree.toString());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return The main menu prompt with {@code $SYM} references expanded.
     */
    public String mainmenuText() {
        return expandSymbolReferences(topNode.getPrompt().text());
    }

    /**
     * Replaces {@code $NAME} with the string value of the symbol NAME, or with nothing if there is no such symbol.
     *
     * @param text The text to expand.
     * @return The expanded text.
     */
    public String expandSymbolReferences(String text) {
        Matcher matcher = SYMBOL_REFERENCE.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Symbol symbol = syms.get(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(symbol == null ? "" : symbol.getStrValue()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    // Warnings

    public void warn(String message) {
        diagnostics.reportWarning(message);
    }

    public void warn(String message, SourceInfo location) {
        if (location == null) {
            diagnostics.reportWarning(message);
        } else {
            diagnostics.reportWarning(message, location.fileName(), location.lineNumber());
        }
    }

    /**
     * Reports that a user value was given to a symbol without a prompt, unless such warnings are
     * suspended while a configuration file is loaded.
     */
    public void warnNoPrompt(String message) {
        if (noPromptWarnings) {
            warn(message);
        }
    }

    public void warnUndefinedAssignment(String message, SourceInfo location) {
        if (undefWarnings) {
            warn(message, location);
        }
    }

    public void warnRedundantAssignment(String message, SourceInfo location) {
        if (redundantWarnings) {
            warn(message, location);
        }
    }

    public void enableWarnings() {
        diagnostics.setEnabled(true);
    }

    public void disableWarnings() {
        diagnostics.setEnabled(false);
    }

    public boolean areWarningsEnabled() {
        return diagnostics.isEnabled();
    }

    public void enableUndefWarnings() {
        undefWarnings = true;
    }

    public void disableUndefWarnings() {
        undefWarnings = false;
    }

    public void enableRedundantWarnings() {
        redundantWarnings = true;
    }

    public void disableRedundantWarnings() {
        redundantWarnings = false;
    }

    /**
     * @return The formatted text of every warning reported so far.
     */
    public List<String> getWarnings() {
        return diagnostics.getWarnings();
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "<configuration with " + syms.size() + " symbols, main menu prompt \"" + mainmenuText()
                + "\", srctree " + (srctree == null ? "not set" : "\"" + srctree + "\"")
                + ", config symbol prefix \"" + configPrefix + "\""
                + ", warnings " + enabled(diagnostics.isEnabled())
                + ", undef. symbol assignment warnings " + enabled(undefWarnings)
                + ", redundant symbol assignment warnings " + enabled(redundantWarnings) + ">";
    }

    private static String enabled(boolean flag) {
        return flag ? "enabled" : "disabled";
    }
}
