package org.jkconfig.model;

import org.jkconfig.Kconfig;
import org.jkconfig.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the menu tree. Every {@code config}, {@code menuconfig}, {@code choice},
 * {@code menu}, {@code comment} and {@code if} statement creates one; a symbol or choice
 * defined in several places owns one node per definition.
 * <p>
 * The properties of a node come in two versions: as parsed, and with the dependencies
 * of the enclosing menus, choices and {@code if} blocks propagated into their conditions.
 * Only the propagated versions take part in evaluation.
 */
public final class MenuNode {

    /**
     * What a node was created for.
     */
    public enum Kind {
        SYMBOL,
        CHOICE,
        MENU,
        COMMENT,
        /** An {@code if} block; these are removed from the tree once it is finalized. */
        IF
    }

    private final Kconfig kconfig;
    private final Kind kind;
    private final ConfigItem item;
    private SourceInfo location;

    private MenuNode parent;
    private MenuNode list;
    private MenuNode next;

    private Prompt prompt;
    private String help;
    private Expr dependency;
    private Expr visibleIf;
    private boolean menuconfig;

    private List<DefaultValue> defaults = new ArrayList<>();
    private List<TargetCondition> selects = new ArrayList<>();
    private List<TargetCondition> implies = new ArrayList<>();
    private List<Range> ranges = new ArrayList<>();

    private Prompt parsedPrompt;
    private Expr parsedDependency;
    private List<DefaultValue> parsedDefaults;
    private List<TargetCondition> parsedSelects;
    private List<TargetCondition> parsedImplies;
    private List<Range> parsedRanges;

    /**
     * @param kconfig The configuration the node belongs to.
     * @param kind What the node was created for.
     * @param item The symbol or choice for {@link Kind#SYMBOL} and {@link Kind#CHOICE} nodes, else {@code null}.
     * @param parent The enclosing node, or {@code null} for the top node.
     * @param location Where the defining statement is.
     */
    public MenuNode(Kconfig kconfig, Kind kind, ConfigItem item, MenuNode parent, SourceInfo location) {
        this.kconfig = kconfig;
        this.kind = kind;
        this.item = item;
        this.parent = parent;
        this.location = location;
        this.dependency = kconfig.getY();
        this.visibleIf = kconfig.getY();
    }

    public Kconfig getKconfig() {
        return kconfig;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return The symbol or choice, or {@code null} for menus, comments and {@code if} blocks.
     */
    public ConfigItem getItem() {
        return item;
    }

    public SourceInfo getLocation() {
        return location;
    }

    public void setLocation(SourceInfo location) {
        this.location = location;
    }

    public String getFileName() {
        return location.fileName();
    }

    public int getLineNumber() {
        return location.lineNumber();
    }

    public MenuNode getParent() {
        return parent;
    }

    public void setParent(MenuNode parent) {
        this.parent = parent;
    }

    /**
     * @return The first child, or {@code null}.
     */
    public MenuNode getList() {
        return list;
    }

    public void setList(MenuNode list) {
        this.list = list;
    }

    /**
     * @return The next sibling, or {@code null}.
     */
    public MenuNode getNext() {
        return next;
    }

    public void setNext(MenuNode next) {
        this.next = next;
    }

    /**
     * @return The prompt, or {@code null} if the node has none.
     */
    public Prompt getPrompt() {
        return prompt;
    }

    public void setPrompt(Prompt prompt) {
        this.prompt = prompt;
    }

    /**
     * @return The help text (ending in a newline unless empty), or {@code null}.
     */
    public String getHelp() {
        return help;
    }

    public void setHelp(String help) {
        this.help = help;
    }

    /**
     * @return The dependencies of the node, including those of the enclosing blocks once the tree is finalized.
     */
    public Expr getDependency() {
        return dependency;
    }

    public void setDependency(Expr dependency) {
        this.dependency = dependency;
    }

    /**
     * @return The {@code visible if} condition of a menu, y for other nodes.
     */
    public Expr getVisibleIf() {
        return visibleIf;
    }

    public void setVisibleIf(Expr visibleIf) {
        this.visibleIf = visibleIf;
    }

    public boolean isMenuconfig() {
        return menuconfig;
    }

    public void setMenuconfig(boolean menuconfig) {
        this.menuconfig = menuconfig;
    }

    public List<DefaultValue> getDefaults() {
        return Collections.unmodifiableList(defaults);
    }

    public void addDefault(DefaultValue value) {
        defaults.add(value);
    }

    public List<TargetCondition> getSelects() {
        return Collections.unmodifiableList(selects);
    }

    public void addSelect(TargetCondition select) {
        selects.add(select);
    }

    public List<TargetCondition> getImplies() {
        return Collections.unmodifiableList(implies);
    }

    public void addImply(TargetCondition imply) {
        implies.add(imply);
    }

    public List<Range> getRanges() {
        return Collections.unmodifiableList(ranges);
    }

    public void addRange(Range range) {
        ranges.add(range);
    }

    /**
     * ANDs a dependency into the node dependencies, the prompt condition and every property
     * condition. The first call records the properties as parsed.
     *
     * @param inherited The dependency of the enclosing block.
     * @param visibility The accumulated {@code visible if} conditions of the enclosing menus,
     *                   applied to the prompts of symbols and choices only.
     */
    public void propagateDependency(Expr inherited, Expr visibility) {
        if (parsedDependency == null) {
            parsedPrompt = prompt;
            parsedDependency = dependency;
            parsedDefaults = List.copyOf(defaults);
            parsedSelects = List.copyOf(selects);
            parsedImplies = List.copyOf(implies);
            parsedRanges = List.copyOf(ranges);
        }

        Expr dep = Expressions.and(dependency, inherited);
        dependency = dep;
        if (prompt != null) {
            prompt = new Prompt(prompt.text(), Expressions.and(prompt.condition(), dep));
        }
        if (item == null) {
            return;
        }
        if (prompt != null) {
            prompt = new Prompt(prompt.text(), Expressions.and(prompt.condition(), visibility));
        }
        defaults = new ArrayList<>(defaults.stream()
                .map(d -> new DefaultValue(d.value(), Expressions.and(d.condition(), dep)))
                .toList());
        ranges = new ArrayList<>(ranges.stream()
                .map(r -> new Range(r.low(), r.high(), Expressions.and(r.condition(), dep)))
                .toList());
        selects = new ArrayList<>(selects.stream()
                .map(s -> new TargetCondition(s.target(), Expressions.and(s.condition(), dep)))
                .toList());
        implies = new ArrayList<>(implies.stream()
                .map(s -> new TargetCondition(s.target(), Expressions.and(s.condition(), dep)))
                .toList());
    }

    public Prompt getParsedPrompt() {
        return parsedDependency == null ? prompt : parsedPrompt;
    }

    public Expr getParsedDependency() {
        return parsedDependency == null ? dependency : parsedDependency;
    }

    public List<DefaultValue> getParsedDefaults() {
        return parsedDependency == null ? getDefaults() : parsedDefaults;
    }

    public List<TargetCondition> getParsedSelects() {
        return parsedDependency == null ? getSelects() : parsedSelects;
    }

    public List<TargetCondition> getParsedImplies() {
        return parsedDependency == null ? getImplies() : parsedImplies;
    }

    public List<Range> getParsedRanges() {
        return parsedDependency == null ? getRanges() : parsedRanges;
    }

    @Override
    public String toString() {
        List<String> fields = new ArrayList<>();
        switch (kind) {
            case SYMBOL -> fields.add("menu node for symbol " + item.getName());
            case CHOICE -> fields.add("menu node for choice" + (item.getName() == null ? "" : " " + item.getName()));
            case MENU -> fields.add("menu node for menu");
            case COMMENT -> fields.add("menu node for comment");
            case IF -> fields.add("menu node for if (should not appear in the final tree)");
        }
        if (prompt != null) {
            fields.add("prompt \"" + prompt.text() + "\" (visibility "
                    + Tristate.toString(Expressions.value(prompt.condition())) + ")");
        }
        if (item instanceof Symbol && menuconfig) {
            fields.add("is menuconfig");
        }
        fields.add("deps " + Tristate.toString(Expressions.value(dependency)));
        if (kind == Kind.MENU) {
            fields.add("'visible if' deps " + Tristate.toString(Expressions.value(visibleIf)));
        }
        if (item != null && help != null) {
            fields.add("has help");
        }
        if (list != null) {
            fields.add("has child");
        }
        if (next != null) {
            fields.add("has next");
        }
        fields.add(location.toString());
        return "<" + String.join(", ", fields) + ">";
    }
}
