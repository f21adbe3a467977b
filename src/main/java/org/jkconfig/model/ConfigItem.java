package org.jkconfig.model;

import org.jkconfig.Kconfig;
import org.jkconfig.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * State shared by symbols and choices: their definition locations, defaults, direct
 * dependencies and the cached values that are dropped on invalidation.
 * <p>
 * Values are computed lazily and cached. Changing a user value invalidates the item and,
 * transitively, every item listed as a dependent that currently holds cached values.
 */
public abstract sealed class ConfigItem implements Expr permits Symbol, Choice {

    protected final Kconfig kconfig;
    protected final List<MenuNode> nodes = new ArrayList<>();
    protected final List<DefaultValue> defaults = new ArrayList<>();
    private final Set<ConfigItem> dependents = new LinkedHashSet<>();

    protected Expr directDependency;
    protected SymbolType origType = SymbolType.UNKNOWN;
    protected Integer cachedVisibility;
    protected boolean wasSet;

    protected ConfigItem(Kconfig kconfig) {
        this.kconfig = kconfig;
    }

    /**
     * @return The name, or {@code null} for an unnamed choice.
     */
    public abstract String getName();

    /**
     * @return The current tristate value.
     */
    public abstract int getTriValue();

    /**
     * @return The current value as text.
     */
    public abstract String getStrValue();

    /**
     * @return The tristate values that a user value can currently be set to, in increasing order.
     */
    public abstract List<Integer> getAssignable();

    /**
     * @return The effective type, which turns tristate into bool while modules are disabled.
     */
    public abstract SymbolType getType();

    /**
     * Drops every cached value of this item alone.
     */
    public abstract void invalidate();

    protected abstract int computeVisibility();

    public Kconfig getKconfig() {
        return kconfig;
    }

    /**
     * @return The type as declared in the Kconfig files.
     */
    public SymbolType getOrigType() {
        return origType;
    }

    public void setOrigType(SymbolType origType) {
        this.origType = origType;
    }

    /**
     * @return The menu nodes this item is defined at, in parse order.
     */
    public List<MenuNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public void addNode(MenuNode node) {
        nodes.add(node);
    }

    /**
     * @return All defaults from all definition locations, with dependencies propagated.
     */
    public List<DefaultValue> getDefaults() {
        return Collections.unmodifiableList(defaults);
    }

    public void addDefaults(List<DefaultValue> values) {
        defaults.addAll(values);
    }

    /**
     * @return The OR of the dependencies of all definition locations.
     */
    public Expr getDirectDependency() {
        return directDependency;
    }

    public void addDirectDependency(Expr dependency) {
        directDependency = Expressions.or(directDependency, dependency);
    }

    /**
     * @return The items whose values may change when the value of this item changes.
     */
    public Set<ConfigItem> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    public void addDependent(ConfigItem item) {
        dependents.add(item);
    }

    /**
     * @return The maximum of the prompt conditions over all definition locations, adjusted for
     *         the choice mode and promoted from m to y for non-tristate items.
     */
    public int getVisibility() {
        if (cachedVisibility == null) {
            cachedVisibility = computeVisibility();
        }
        return cachedVisibility;
    }

    protected int promptVisibility() {
        int visibility = 0;
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                visibility = Math.max(visibility, Expressions.value(node.getPrompt().condition()));
            }
        }
        return visibility;
    }

    /**
     * @return Whether any definition location has a prompt.
     */
    public boolean hasPrompt() {
        return nodes.stream().anyMatch(node -> node.getPrompt() != null);
    }

    public boolean wasSet() {
        return wasSet;
    }

    public void setWasSet(boolean wasSet) {
        this.wasSet = wasSet;
    }

    /**
     * Invalidates this item and every dependent holding cached values. Invalidating the
     * modules symbol invalidates the whole configuration.
     */
    protected void recursivelyInvalidate() {
        if (this == kconfig.getModules()) {
            kconfig.invalidateAll();
            return;
        }
        invalidate();
        for (ConfigItem item : dependents) {
            // Items without a cached visibility hold no cached values.
            if (item.cachedVisibility != null) {
                item.recursivelyInvalidate();
            }
        }
    }

    /**
     * @return The locations of all definitions.
     */
    public List<SourceInfo> getLocations() {
        return nodes.stream().map(MenuNode::getLocation).toList();
    }

    /**
     * @return The name followed by the definition locations, as used in diagnostics,
     *         e.g. {@code FOO (defined at Kconfig:3, Kconfig:10)}.
     */
    public String nameAndLocation() {
        String name = Expressions.itemToString(this);
        if (nodes.isEmpty()) {
            return name + " (undefined)";
        }
        return name + " (defined at " + getLocations().stream()
                .map(SourceInfo::toString)
                .collect(Collectors.joining(", ")) + ")";
    }
}
