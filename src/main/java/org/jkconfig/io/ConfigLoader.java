package org.jkconfig.io;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.api.SourceInfo;
import org.jkconfig.model.Choice;
import org.jkconfig.model.Symbol;
import org.jkconfig.model.SymbolType;
import org.jkconfig.model.Tristate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code .config} files into the user values of a {@link Kconfig}.
 * <p>
 * Assignments have the form {@code CONFIG_FOO=value}; bool and tristate symbols can also be
 * set to n with {@code # CONFIG_FOO is not set}. Both must start in the first column.
 */
public class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Pattern STRING_LITERAL = Pattern.compile("\"((?:[^\\\\\"]|\\\\.)*)\"");

    private final Kconfig kconfig;
    private final Pattern assignment;
    private final Pattern unset;

    public ConfigLoader(Kconfig kconfig) {
        this.kconfig = kconfig;
        String prefix = Pattern.quote(kconfig.getConfigPrefix());
        this.assignment = Pattern.compile(prefix + "(\\w+)=(.*)");
        this.unset = Pattern.compile("# " + prefix + "(\\w+) is not set");
    }

    /**
     * Loads a configuration file.
     *
     * @param file The file to read.
     * @param replace Whether symbols and choices the file does not set lose their user values.
     * @return The leading comment lines of the file, each ending in a newline.
     * @throws KconfigException if the file cannot be read.
     */
    public String load(Path file, boolean replace) throws KconfigException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KconfigException("could not read configuration file '" + file + "'", e);
        }

        for (Symbol symbol : kconfig.getDefinedSyms()) {
            symbol.setWasSet(false);
        }
        for (Choice choice : kconfig.getChoices()) {
            choice.setWasSet(false);
        }

        String fileName = file.toString();
        StringBuilder header = new StringBuilder();
        boolean inHeader = true;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).stripTrailing();
            SourceInfo location = new SourceInfo(fileName, i + 1);
            boolean unsetLine = unset.matcher(line).matches();
            if (inHeader && line.startsWith("#") && !unsetLine) {
                header.append(line).append('\n');
                continue;
            }
            inHeader = false;
            loadLine(line, location);
        }

        if (replace) {
            for (Symbol symbol : kconfig.getDefinedSyms()) {
                if (!symbol.wasSet()) {
                    symbol.unsetValue();
                }
            }
            for (Choice choice : kconfig.getChoices()) {
                if (!choice.wasSet()) {
                    choice.unsetValue();
                }
            }
        }
        LOG.info("Loaded configuration from {} ({} mode)", file, replace ? "replace" : "append");
        return header.toString();
    }

    private void loadLine(String line, SourceInfo location) {
        String name;
        String value;
        Symbol symbol;

        Matcher set = assignment.matcher(line);
        if (set.matches()) {
            name = set.group(1);
            value = set.group(2);
            symbol = definedSymbol(name, value, location);
            if (symbol == null) {
                return;
            }
            if (symbol.getOrigType().isBoolOrTristate()) {
                value = tristateValue(symbol, value, location);
                if (value == null) {
                    return;
                }
            } else if (symbol.getOrigType() == SymbolType.STRING) {
                Matcher literal = STRING_LITERAL.matcher(value);
                if (!literal.lookingAt()) {
                    kconfig.warn("malformed string literal in assignment to " + symbol.nameAndLocation()
                            + ". Assignment ignored.", location);
                    return;
                }
                value = ConfigStrings.unescape(literal.group(1));
            }
        } else {
            Matcher unsetMatch = unset.matcher(line);
            if (!unsetMatch.matches()) {
                if (!line.isEmpty() && !line.stripLeading().startsWith("#")) {
                    kconfig.warn("ignoring malformed line '" + line + "'", location);
                }
                return;
            }
            name = unsetMatch.group(1);
            value = "n";
            symbol = definedSymbol(name, value, location);
            if (symbol == null || !symbol.getOrigType().isBoolOrTristate()) {
                return;
            }
        }

        if (symbol.wasSet()) {
            Object previous = symbol.getUserValue();
            String display = previous instanceof Integer tristate ? Tristate.toString(tristate) : String.valueOf(previous);
            String message = symbol.nameAndLocation() + " set more than once. Old value: \"" + display
                    + "\", new value: \"" + value + "\".";
            if (display.equals(value)) {
                kconfig.warnRedundantAssignment(message, location);
            } else {
                kconfig.warn(message, location);
            }
        }
        symbol.setValue(value);
    }

    private Symbol definedSymbol(String name, String value, SourceInfo location) {
        Symbol symbol = kconfig.getSyms().get(name);
        if (symbol == null || symbol.getNodes().isEmpty()) {
            kconfig.warnUndefinedAssignment("attempt to assign the value '" + value + "' to the undefined symbol "
                    + name, location);
            return null;
        }
        return symbol;
    }

    /**
     * Checks a bool or tristate value by its first character, as the C tools do, and infers the
     * mode of the enclosing choice from it.
     *
     * @return {@code n}, {@code m} or {@code y}, or {@code null} if the value is invalid.
     */
    private String tristateValue(Symbol symbol, String value, SourceInfo location) {
        String allowed = symbol.getOrigType() == SymbolType.BOOL ? "ny" : "nmy";
        if (value.isEmpty() || allowed.indexOf(value.charAt(0)) < 0) {
            kconfig.warn("'" + value + "' is not a valid value for the " + symbol.getOrigType() + " symbol "
                    + symbol.nameAndLocation() + ". Assignment ignored.", location);
            return null;
        }
        String tristate = value.substring(0, 1);

        Choice choice = symbol.getChoice();
        if (choice != null && !tristate.equals("n")) {
            Integer previousMode = choice.getUserValue();
            if (previousMode != null && !Tristate.toString(previousMode).equals(tristate)) {
                kconfig.warn("both m and y assigned to symbols within the same choice", location);
            }
            choice.setValue(tristate);
        }
        return tristate;
    }
}
