package org.jkconfig.model;

import org.jkconfig.Kconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * A {@code choice} block: a group of symbols of which at most one is y.
 * <p>
 * The mode of a choice is its tristate value. In y mode exactly one visible member, the
 * selection, is y; in m mode members may individually be m or n; in n mode (only possible
 * for optional choices) every member is n.
 */
public final class Choice extends ConfigItem {

    private final String name;
    private final List<Symbol> symbols = new ArrayList<>();
    private boolean optional;

    private Integer userValue;
    private Symbol userSelection;
    private boolean selectionCached;
    private Symbol cachedSelection;
    private List<Integer> cachedAssignable;

    /**
     * @param kconfig The configuration the choice belongs to.
     * @param name The choice name, or {@code null} for an unnamed choice.
     */
    public Choice(Kconfig kconfig, String name) {
        super(kconfig);
        this.name = name;
        this.directDependency = kconfig.getN();
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @return The member symbols, in definition order.
     */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public void addSymbol(Symbol symbol) {
        if (!symbols.contains(symbol)) {
            symbols.add(symbol);
        }
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    /**
     * @return The user mode, or {@code null}.
     */
    public Integer getUserValue() {
        return userValue;
    }

    /**
     * @return The member last set to y by the user, or {@code null}.
     */
    public Symbol getUserSelection() {
        return userSelection;
    }

    void setUserSelection(Symbol symbol) {
        userSelection = symbol;
        wasSet = true;
    }

    @Override
    public SymbolType getType() {
        if (origType == SymbolType.TRISTATE && kconfig.getModules().getTriValue() == Tristate.N) {
            return SymbolType.BOOL;
        }
        return origType;
    }

    /**
     * @return The mode: at least m for non-optional choices, raised to the user mode and
     *         limited by the visibility. m is promoted to y for bool choices.
     */
    @Override
    public int getTriValue() {
        int value = optional ? Tristate.N : Tristate.M;
        if (userValue != null) {
            value = Math.max(value, userValue);
        }
        value = Math.min(value, getVisibility());
        return value == Tristate.M && getType() == SymbolType.BOOL ? Tristate.Y : value;
    }

    @Override
    public String getStrValue() {
        return Tristate.toString(getTriValue());
    }

    @Override
    public List<Integer> getAssignable() {
        if (cachedAssignable == null) {
            cachedAssignable = computeAssignable();
        }
        return cachedAssignable;
    }

    private List<Integer> computeAssignable() {
        int visibility = getVisibility();
        if (visibility == 0) {
            return List.of();
        }
        if (visibility == Tristate.Y) {
            if (!optional) {
                return getType() == SymbolType.BOOL ? List.of(2) : List.of(1, 2);
            }
            return getType() == SymbolType.BOOL ? List.of(0, 2) : List.of(0, 1, 2);
        }
        return optional ? List.of(0, 1) : List.of(1);
    }

    @Override
    protected int computeVisibility() {
        int visibility = promptVisibility();
        return visibility == Tristate.M && getType() != SymbolType.TRISTATE ? Tristate.Y : visibility;
    }

    /**
     * Returns the member that is y in y mode: the user selection if it is visible, else the
     * first default whose condition holds and whose symbol is visible, else the first visible
     * member.
     *
     * @return The selected member, or {@code null} when not in y mode or no member is visible.
     */
    public Symbol getSelection() {
        if (!selectionCached) {
            cachedSelection = computeSelection();
            selectionCached = true;
        }
        return cachedSelection;
    }

    private Symbol computeSelection() {
        if (getTriValue() != Tristate.Y) {
            return null;
        }
        if (userSelection != null && userSelection.getVisibility() != 0) {
            return userSelection;
        }
        for (DefaultValue defaultValue : defaults) {
            Symbol symbol = (Symbol) defaultValue.value();
            if (Expressions.value(defaultValue.condition()) != 0 && symbol.getVisibility() != 0) {
                return symbol;
            }
        }
        for (Symbol symbol : symbols) {
            if (symbol.getVisibility() != 0) {
                return symbol;
            }
        }
        return null;
    }

    /**
     * Sets the user mode.
     *
     * @param value 0, 1 or 2; bool choices accept only 0 and 2.
     * @return {@code true} if the value was accepted.
     */
    public boolean setValue(int value) {
        if (Integer.valueOf(value).equals(userValue)) {
            wasSet = true;
            return true;
        }
        boolean valid = origType == SymbolType.BOOL ? value == 0 || value == 2
                : origType == SymbolType.TRISTATE && Tristate.isValid(value);
        if (!valid) {
            kconfig.warn("the value '" + (Tristate.isValid(value) ? Tristate.toString(value) : value)
                    + "' is invalid for the choice, which has type " + origType + " -- assignment ignored");
            return false;
        }
        userValue = value;
        wasSet = true;
        recursivelyInvalidate();
        return true;
    }

    /**
     * Sets the user mode from {@code n}, {@code m} or {@code y}.
     *
     * @param value The mode as text.
     * @return {@code true} if the value was accepted.
     */
    public boolean setValue(String value) {
        OptionalInt tristate = Tristate.parse(value);
        if (tristate.isEmpty()) {
            kconfig.warn("the value '" + value + "' is invalid for the choice, which has type " + origType
                    + " -- assignment ignored");
            return false;
        }
        return setValue(tristate.getAsInt());
    }

    /**
     * Removes the user mode and the user selection.
     */
    public void unsetValue() {
        if (userValue != null || userSelection != null) {
            userValue = null;
            userSelection = null;
            recursivelyInvalidate();
        }
    }

    @Override
    public void invalidate() {
        cachedVisibility = null;
        cachedAssignable = null;
        cachedSelection = null;
        selectionCached = false;
    }

    @Override
    public String toString() {
        List<String> fields = new ArrayList<>();
        fields.add(name == null ? "choice" : "choice " + name);
        fields.add(getType().toString());
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                fields.add("\"" + node.getPrompt().text() + "\"");
            }
        }
        fields.add("mode " + getStrValue());
        if (userValue != null) {
            fields.add("user mode " + Tristate.toString(userValue));
        }
        Symbol selection = getSelection();
        if (selection != null) {
            fields.add(selection.getName() + " selected");
        }
        if (userSelection != null) {
            fields.add(userSelection.getName() + " selected by user"
                    + (selection != userSelection ? " (overridden)" : ""));
        }
        fields.add("visibility " + Tristate.toString(getVisibility()));
        if (optional) {
            fields.add("optional");
        }
        for (MenuNode node : nodes) {
            fields.add(node.getLocation().toString());
        }
        return "<" + String.join(", ", fields) + ">";
    }
}
