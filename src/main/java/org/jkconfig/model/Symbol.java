package org.jkconfig.model;

import org.jkconfig.Kconfig;
import org.jkconfig.io.ConfigStrings;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * A configuration symbol: either defined by {@code config}/{@code menuconfig} statements,
 * referenced without a definition, or a constant (n, m, y and quoted strings).
 * <p>
 * Undefined symbols have type {@link SymbolType#UNKNOWN} and their name as string value.
 * Constants have a fixed value equal to their name, or the tristate value for n, m and y.
 */
public final class Symbol extends ConfigItem {

    private final String name;
    private final boolean constant;
    private final List<TargetCondition> selects = new ArrayList<>();
    private final List<TargetCondition> implies = new ArrayList<>();
    private final List<Range> ranges = new ArrayList<>();

    private Choice choice;
    private Expr reverseDependency;
    private Expr weakReverseDependency;
    private String envVar;
    private boolean allnoconfigY;

    private Object userValue;
    private Integer cachedTriValue;
    private String cachedStrValue;
    private List<Integer> cachedAssignable;
    private boolean writeToConfig;

    /**
     * Creates a symbol. The first symbol created for a configuration must be the constant n,
     * which becomes its own dependency.
     *
     * @param kconfig The configuration the symbol belongs to.
     * @param name The symbol name.
     * @param constant Whether the symbol is a constant.
     */
    public Symbol(Kconfig kconfig, String name, boolean constant) {
        super(kconfig);
        this.name = name;
        this.constant = constant;
        Expr n = kconfig.getN() != null ? kconfig.getN() : this;
        this.directDependency = n;
        this.reverseDependency = n;
        this.weakReverseDependency = n;
    }

    /**
     * Creates one of the constants n, m and y.
     *
     * @param kconfig The configuration the symbol belongs to.
     * @param value The tristate value, which also determines the name.
     * @return The constant.
     */
    public static Symbol tristateConstant(Kconfig kconfig, int value) {
        Symbol symbol = new Symbol(kconfig, Tristate.toString(value), true);
        symbol.origType = SymbolType.TRISTATE;
        symbol.cachedTriValue = value;
        symbol.cachedStrValue = symbol.name;
        return symbol;
    }

    @Override
    public String getName() {
        return name;
    }

    public boolean isConstant() {
        return constant;
    }

    /**
     * @return The choice this symbol is a member of, or {@code null}.
     */
    public Choice getChoice() {
        return choice;
    }

    public void setChoice(Choice choice) {
        this.choice = choice;
    }

    public List<TargetCondition> getSelects() {
        return Collections.unmodifiableList(selects);
    }

    public void addSelects(List<TargetCondition> values) {
        selects.addAll(values);
    }

    public List<TargetCondition> getImplies() {
        return Collections.unmodifiableList(implies);
    }

    public void addImplies(List<TargetCondition> values) {
        implies.addAll(values);
    }

    public List<Range> getRanges() {
        return Collections.unmodifiableList(ranges);
    }

    public void addRanges(List<Range> values) {
        ranges.addAll(values);
    }

    /**
     * @return The OR of {@code SELECTOR && cond} over every symbol selecting this one.
     */
    public Expr getReverseDependency() {
        return reverseDependency;
    }

    public void addReverseDependency(Expr dependency) {
        reverseDependency = Expressions.or(reverseDependency, dependency);
    }

    /**
     * @return The OR of {@code IMPLIER && cond} over every symbol implying this one.
     */
    public Expr getWeakReverseDependency() {
        return weakReverseDependency;
    }

    public void addWeakReverseDependency(Expr dependency) {
        weakReverseDependency = Expressions.or(weakReverseDependency, dependency);
    }

    /**
     * @return The environment variable the symbol takes its default from, or {@code null}.
     */
    public String getEnvVar() {
        return envVar;
    }

    public void setEnvVar(String envVar) {
        this.envVar = envVar;
    }

    public boolean isAllnoconfigY() {
        return allnoconfigY;
    }

    public void setAllnoconfigY(boolean allnoconfigY) {
        this.allnoconfigY = allnoconfigY;
    }

    /**
     * @return The user value: an {@link Integer} tristate for bool and tristate symbols,
     *         a {@link String} otherwise, or {@code null} if none is set.
     */
    public Object getUserValue() {
        return userValue;
    }

    @Override
    public SymbolType getType() {
        if (origType == SymbolType.TRISTATE
                && ((choice != null && choice.getTriValue() == Tristate.Y)
                    || kconfig.getModules().getTriValue() == Tristate.N)) {
            return SymbolType.BOOL;
        }
        return origType;
    }

    @Override
    public int getTriValue() {
        if (cachedTriValue != null) {
            return cachedTriValue;
        }

        if (!origType.isBoolOrTristate()) {
            if (origType != SymbolType.UNKNOWN) {
                kconfig.warn("The " + origType + " symbol " + nameAndLocation()
                        + " is being evaluated in a logical context somewhere. It will always evaluate to n.");
            }
            cachedTriValue = Tristate.N;
            return Tristate.N;
        }

        int visibility = getVisibility();
        writeToConfig = visibility != 0;
        int value = Tristate.N;

        if (choice == null) {
            if (visibility != 0 && userValue != null) {
                value = Math.min((Integer) userValue, visibility);
            } else {
                for (DefaultValue defaultValue : defaults) {
                    int condition = Expressions.value(defaultValue.condition());
                    if (condition != 0) {
                        value = Math.min(Expressions.value(defaultValue.value()), condition);
                        if (value != 0) {
                            writeToConfig = true;
                        }
                        break;
                    }
                }

                // Implies only apply while the direct dependencies are met.
                int weak = Expressions.value(weakReverseDependency);
                if (weak != 0 && Expressions.value(directDependency) != 0) {
                    value = Math.max(weak, value);
                    writeToConfig = true;
                }
            }

            int reverse = Expressions.value(reverseDependency);
            if (reverse != 0) {
                if (Expressions.value(directDependency) < reverse) {
                    warnSelectUnsatisfiedDependencies(reverse);
                }
                value = Math.max(reverse, value);
                writeToConfig = true;
            }

            if (value == Tristate.M
                    && (getType() == SymbolType.BOOL || Expressions.value(weakReverseDependency) == Tristate.Y)) {
                value = Tristate.Y;
            }
        } else if (visibility == Tristate.Y) {
            value = choice.getSelection() == this ? Tristate.Y : Tristate.N;
        } else if (visibility != 0 && userValue != null && (Integer) userValue != 0) {
            value = Tristate.M;
        }

        cachedTriValue = value;
        return value;
    }

    private void warnSelectUnsatisfiedDependencies(int reverse) {
        kconfig.warn(nameAndLocation() + " has direct dependencies " + Expressions.toString(directDependency)
                + " with value " + Tristate.toString(Expressions.value(directDependency))
                + ", but is currently being selected to " + Tristate.toString(reverse) + " by "
                + Expressions.toString(reverseDependency));
    }

    @Override
    public String getStrValue() {
        if (cachedStrValue != null) {
            return cachedStrValue;
        }

        if (origType.isBoolOrTristate()) {
            cachedStrValue = Tristate.toString(getTriValue());
            return cachedStrValue;
        }

        // Undefined symbols evaluate to their own name, which makes "FOO = bar" comparisons work.
        if (origType == SymbolType.UNKNOWN) {
            cachedStrValue = name;
            return name;
        }

        String value = "";
        int visibility = getVisibility();
        writeToConfig = visibility != 0;

        if (origType.isNumeric()) {
            value = numericValue(visibility);
        } else if (visibility != 0 && userValue != null) {
            value = (String) userValue;
        } else {
            for (DefaultValue defaultValue : defaults) {
                if (Expressions.value(defaultValue.condition()) != 0) {
                    value = Expressions.strValue(defaultValue.value());
                    writeToConfig = true;
                    break;
                }
            }
        }

        if (envVar != null || this == kconfig.getDefconfigList()) {
            writeToConfig = false;
        }

        cachedStrValue = value;
        return value;
    }

    private String numericValue(int visibility) {
        int base = origType.getBase();
        BigInteger low = null;
        BigInteger high = null;
        for (Range range : ranges) {
            if (Expressions.value(range.condition()) != 0) {
                low = parseOrZero(range.low().getStrValue(), base);
                high = parseOrZero(range.high().getStrValue(), base);
                break;
            }
        }
        boolean hasActiveRange = low != null;

        if (visibility != 0 && userValue != null && !((String) userValue).isEmpty()) {
            BigInteger user = NumericLiterals.parse((String) userValue, base);
            if (!hasActiveRange || (user.compareTo(low) >= 0 && user.compareTo(high) <= 0)) {
                // A valid user value is kept in the form it was given in.
                return (String) userValue;
            }
            kconfig.warn("user value " + NumericLiterals.format(user, origType) + " on the " + origType
                    + " symbol " + nameAndLocation() + " ignored due to being outside the active range (["
                    + NumericLiterals.format(low, origType) + ", " + NumericLiterals.format(high, origType)
                    + "]) -- falling back on defaults");
        }

        String value = "";
        BigInteger number = BigInteger.ZERO;
        boolean hasDefault = false;
        for (DefaultValue defaultValue : defaults) {
            if (Expressions.value(defaultValue.condition()) != 0) {
                hasDefault = true;
                writeToConfig = true;
                value = Expressions.strValue(defaultValue.value());
                number = parseOrZero(value, base);
                break;
            }
        }

        if (hasActiveRange) {
            BigInteger clamp = null;
            if (number.compareTo(low) < 0) {
                clamp = low;
            } else if (number.compareTo(high) > 0) {
                clamp = high;
            }
            if (clamp != null) {
                value = NumericLiterals.format(clamp, origType);
                if (hasDefault) {
                    kconfig.warn("default value " + number + " on " + nameAndLocation() + " clamped to "
                            + value + " due to being outside the active range (["
                            + NumericLiterals.format(low, origType) + ", "
                            + NumericLiterals.format(high, origType) + "])");
                }
            }
        }
        return value;
    }

    private static BigInteger parseOrZero(String text, int base) {
        return NumericLiterals.isValid(text, base) ? NumericLiterals.parse(text, base) : BigInteger.ZERO;
    }

    @Override
    public List<Integer> getAssignable() {
        if (cachedAssignable == null) {
            cachedAssignable = computeAssignable();
        }
        return cachedAssignable;
    }

    private List<Integer> computeAssignable() {
        if (!origType.isBoolOrTristate()) {
            return List.of();
        }
        int visibility = getVisibility();
        if (visibility == 0) {
            return List.of();
        }
        int reverse = Expressions.value(reverseDependency);
        boolean mPromoted = getType() == SymbolType.BOOL || Expressions.value(weakReverseDependency) == Tristate.Y;

        if (visibility == Tristate.Y) {
            if (choice != null) {
                return List.of(2);
            }
            if (reverse == 0) {
                return mPromoted ? List.of(0, 2) : List.of(0, 1, 2);
            }
            if (reverse == Tristate.Y) {
                return List.of(2);
            }
            return mPromoted ? List.of(2) : List.of(1, 2);
        }

        // Visibility m only occurs for tristate symbols, as it is promoted to y otherwise.
        if (reverse == 0) {
            return Expressions.value(weakReverseDependency) == Tristate.Y ? List.of(0, 2) : List.of(0, 1);
        }
        if (reverse == Tristate.Y) {
            return List.of(2);
        }
        return List.of(1);
    }

    @Override
    protected int computeVisibility() {
        int visibility = promptVisibility();
        if (choice != null) {
            // Non-tristate choice symbols are only visible in y mode.
            if (choice.getOrigType() == SymbolType.TRISTATE && origType != SymbolType.TRISTATE
                    && choice.getTriValue() != Tristate.Y) {
                return 0;
            }
            // Choice symbols with m visibility are not visible in y mode.
            if (origType == SymbolType.TRISTATE && visibility == Tristate.M && choice.getTriValue() == Tristate.Y) {
                return 0;
            }
        }
        if (visibility == Tristate.M && getType() != SymbolType.TRISTATE) {
            return Tristate.Y;
        }
        return visibility;
    }

    /**
     * Returns the line this symbol contributes to a configuration file: an assignment, a
     * {@code # ... is not set} line for bool and tristate symbols with value n, or the empty
     * string when the symbol is not written.
     *
     * @return The line including its trailing newline, or {@code ""}.
     */
    public String getConfigString() {
        String value = getStrValue();
        if (!writeToConfig) {
            return "";
        }
        String prefix = kconfig.getConfigPrefix();
        return switch (origType) {
            case BOOL, TRISTATE -> value.equals("n")
                    ? "# " + prefix + name + " is not set\n"
                    : prefix + name + "=" + value + "\n";
            case INT, HEX -> prefix + name + "=" + value + "\n";
            case STRING -> prefix + name + "=\"" + ConfigStrings.escape(value) + "\"\n";
            case UNKNOWN -> "";
        };
    }

    /**
     * Sets the user value from a tristate.
     *
     * @param value 0, 1 or 2.
     * @return {@code true} if the value was accepted.
     * @see #setValue(String)
     */
    public boolean setValue(int value) {
        return assignUserValue(value);
    }

    /**
     * Sets the user value. For bool and tristate symbols the text must be {@code n},
     * {@code m} or {@code y}; {@code int} and {@code hex} symbols take decimal and
     * non-negative hexadecimal literals.
     * <p>
     * Invalid values, values for symbols whose value comes from the environment and values
     * for constants are rejected with a warning and leave the symbol unchanged.
     *
     * @param value The new user value.
     * @return {@code true} if the value was accepted.
     */
    public boolean setValue(String value) {
        if (origType.isBoolOrTristate()) {
            OptionalInt tristate = Tristate.parse(value);
            if (tristate.isPresent()) {
                return assignUserValue(tristate.getAsInt());
            }
        }
        return assignUserValue(value);
    }

    private boolean assignUserValue(Object value) {
        if (value.equals(userValue) && choice == null) {
            wasSet = true;
            return true;
        }

        if (!isValidUserValue(value)) {
            String display = value instanceof Integer tristate && Tristate.isValid(tristate)
                    ? Tristate.toString(tristate) : "'" + value + "'";
            kconfig.warn("the value " + display + " is invalid for " + nameAndLocation()
                    + ", which has type " + origType + " -- assignment ignored");
            return false;
        }

        if (constant) {
            kconfig.warn("ignored attempt to assign user value to the constant symbol " + name);
            return false;
        }

        if (envVar != null) {
            kconfig.warn("ignored attempt to assign user value to " + nameAndLocation()
                    + ", which gets its value from the environment");
            return false;
        }

        userValue = value;
        wasSet = true;

        if (choice != null && Integer.valueOf(Tristate.Y).equals(value)) {
            choice.setUserSelection(this);
            if (hasPrompt()) {
                choice.recursivelyInvalidate();
            }
        } else if (hasPrompt()) {
            recursivelyInvalidate();
        } else {
            kconfig.warnNoPrompt(nameAndLocation() + " has no prompt, meaning user values have no effect on it");
        }
        return true;
    }

    private boolean isValidUserValue(Object value) {
        return switch (origType) {
            case BOOL -> value instanceof Integer tristate && (tristate == 0 || tristate == 2);
            case TRISTATE -> value instanceof Integer tristate && Tristate.isValid(tristate);
            case STRING -> value instanceof String;
            case INT -> value instanceof String text && NumericLiterals.isValid(text, 10);
            case HEX -> value instanceof String text && NumericLiterals.isValid(text, 16)
                    && NumericLiterals.parse(text, 16).signum() >= 0;
            case UNKNOWN -> false;
        };
    }

    /**
     * Removes the user value, if any.
     */
    public void unsetValue() {
        if (userValue != null) {
            userValue = null;
            if (hasPrompt()) {
                recursivelyInvalidate();
            }
        }
    }

    @Override
    public void invalidate() {
        if (constant) {
            return;
        }
        cachedTriValue = null;
        cachedStrValue = null;
        cachedVisibility = null;
        cachedAssignable = null;
    }

    @Override
    public String toString() {
        List<String> fields = new ArrayList<>();
        fields.add("symbol " + name);
        fields.add(getType().toString());
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                fields.add("\"" + node.getPrompt().text() + "\"");
            }
        }
        fields.add("value " + (origType.isBoolOrTristate() ? getStrValue() : "\"" + getStrValue() + "\""));

        if (!constant) {
            if (userValue != null) {
                fields.add("user value " + (origType.isBoolOrTristate()
                        ? Tristate.toString((Integer) userValue) : "\"" + userValue + "\""));
            }
            fields.add("visibility " + Tristate.toString(getVisibility()));
            if (choice != null) {
                fields.add("choice symbol");
            }
            if (allnoconfigY) {
                fields.add("allnoconfig_y");
            }
            if (this == kconfig.getDefconfigList()) {
                fields.add("is the defconfig_list symbol");
            }
            if (envVar != null) {
                fields.add("from environment variable " + envVar);
            }
            if (this == kconfig.getModules()) {
                fields.add("is the modules symbol");
            }
            fields.add("direct deps " + Tristate.toString(Expressions.value(directDependency)));
        }

        if (!nodes.isEmpty()) {
            for (MenuNode node : nodes) {
                fields.add(node.getLocation().toString());
            }
        } else {
            fields.add(constant ? "constant" : "undefined");
        }
        return "<" + String.join(", ", fields) + ">";
    }
}
