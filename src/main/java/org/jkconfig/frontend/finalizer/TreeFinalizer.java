package org.jkconfig.frontend.finalizer;

import org.jkconfig.Kconfig;
import org.jkconfig.model.Choice;
import org.jkconfig.model.ConfigItem;
import org.jkconfig.model.DefaultValue;
import org.jkconfig.model.Expr;
import org.jkconfig.model.Expressions;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.NumericLiterals;
import org.jkconfig.model.Range;
import org.jkconfig.model.Symbol;
import org.jkconfig.model.SymbolType;
import org.jkconfig.model.TargetCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the parsed menu tree into its final shape and completes the symbol model.
 * <ul>
 *     <li>Dependencies of menus, choices and {@code if} blocks are propagated into the
 *     conditions of the enclosed nodes.</li>
 *     <li>The properties of every definition are collected on its symbol or choice, and
 *     {@code select} and {@code imply} become reverse dependencies of their targets.</li>
 *     <li>Symbols followed by nodes depending on them get those nodes as an implicit submenu.</li>
 *     <li>{@code if} nodes and prompt-less containers are flattened away.</li>
 *     <li>Choice members are attached and typed, and the index of dependent items used for
 *     cache invalidation is built.</li>
 * </ul>
 */
public class TreeFinalizer {

    private final Kconfig kconfig;

    public TreeFinalizer(Kconfig kconfig) {
        this.kconfig = kconfig;
    }

    /**
     * Finalizes the whole tree below the top node.
     */
    public void finalizeTree() {
        finalizeNode(kconfig.getTopNode(), kconfig.getY());
        buildDependents();
        warnUndefinedSymbols();
    }

    private void finalizeNode(MenuNode node, Expr visibleIf) {
        if (node.getList() != null) {
            if (node.getKind() == MenuNode.Kind.MENU) {
                visibleIf = Expressions.and(visibleIf, node.getVisibleIf());
            }
            propagateDependencies(node, visibleIf);
            for (MenuNode child = node.getList(); child != null; child = child.getNext()) {
                finalizeNode(child, visibleIf);
            }
        } else if (node.getItem() instanceof Symbol) {
            addPropertiesToItem(node);

            MenuNode last = node;
            while (last.getNext() != null && dependsOnSymbol(last.getNext(), node.getItem())) {
                // Nested implicit menus are built by the recursive call.
                finalizeNode(last.getNext(), visibleIf);
                last = last.getNext();
                last.setParent(node);
            }
            if (last != node) {
                node.setList(node.getNext());
                node.setNext(last.getNext());
                last.setNext(null);
            }
        }

        if (node.getList() != null) {
            flatten(node.getList());
            removeIfs(node);
        }

        // Empty choices have no children but still need their properties.
        if (node.getItem() instanceof Choice) {
            addPropertiesToItem(node);
            finalizeChoice(node);
        }
    }

    private static boolean dependsOnSymbol(MenuNode candidate, ConfigItem item) {
        Expr condition = candidate.getPrompt() != null ? candidate.getPrompt().condition() : candidate.getDependency();
        return Expressions.dependsOn(condition, item);
    }

    private static void propagateDependencies(MenuNode node, Expr visibleIf) {
        Expr baseDependency = node.getItem() instanceof Choice choice ? choice : node.getDependency();
        for (MenuNode child = node.getList(); child != null; child = child.getNext()) {
            child.propagateDependency(baseDependency, visibleIf);
        }
    }

    private static void addPropertiesToItem(MenuNode node) {
        ConfigItem item = node.getItem();
        item.addDirectDependency(node.getDependency());
        item.addDefaults(node.getDefaults());
        if (item instanceof Symbol symbol) {
            symbol.addRanges(node.getRanges());
            symbol.addSelects(node.getSelects());
            symbol.addImplies(node.getImplies());
            for (TargetCondition select : node.getSelects()) {
                select.target().addReverseDependency(Expressions.and(symbol, select.condition()));
            }
            for (TargetCondition imply : node.getImplies()) {
                imply.target().addWeakReverseDependency(Expressions.and(symbol, imply.condition()));
            }
        }
    }

    /**
     * Moves the children of prompt-less nodes, such as {@code if} blocks and invisible symbols
     * with implicit submenus, up to follow their former parent.
     */
    private static void flatten(MenuNode first) {
        for (MenuNode node = first; node != null; node = node.getNext()) {
            if (node.getList() != null && node.getPrompt() == null && !(node.getItem() instanceof Choice)) {
                MenuNode last = node.getList();
                while (true) {
                    last.setParent(node.getParent());
                    if (last.getNext() == null) {
                        break;
                    }
                    last = last.getNext();
                }
                last.setNext(node.getNext());
                node.setNext(node.getList());
                node.setList(null);
            }
        }
    }

    /**
     * Unlinks the {@code if} nodes among the children, whose own children were already flattened.
     */
    private static void removeIfs(MenuNode node) {
        MenuNode current = node.getList();
        while (current != null && current.getKind() == MenuNode.Kind.IF) {
            current = current.getNext();
        }
        node.setList(current);
        while (current != null) {
            MenuNode next = current.getNext();
            while (next != null && next.getKind() == MenuNode.Kind.IF) {
                next = next.getNext();
            }
            current.setNext(next);
            current = next;
        }
    }

    private void finalizeChoice(MenuNode node) {
        Choice choice = (Choice) node.getItem();
        for (MenuNode child = node.getList(); child != null; child = child.getNext()) {
            if (child.getItem() instanceof Symbol symbol) {
                symbol.setChoice(choice);
                choice.addSymbol(symbol);
            }
        }

        if (choice.getOrigType() == SymbolType.UNKNOWN) {
            for (Symbol symbol : choice.getSymbols()) {
                if (symbol.getOrigType() != SymbolType.UNKNOWN) {
                    choice.setOrigType(symbol.getOrigType());
                    break;
                }
            }
        }
        for (Symbol symbol : choice.getSymbols()) {
            if (symbol.getOrigType() == SymbolType.UNKNOWN) {
                symbol.setOrigType(choice.getOrigType());
                if (choice.getOrigType() == SymbolType.UNKNOWN) {
                    kconfig.warn(symbol.nameAndLocation() + ", a choice symbol, has no type");
                }
            }
        }
    }

    /**
     * Registers every symbol and choice as a dependent of the items its value is computed from,
     * so that changing a value invalidates exactly the affected caches.
     */
    private void buildDependents() {
        for (Symbol symbol : kconfig.getDefinedSyms()) {
            List<Expr> inputs = new ArrayList<>();
            for (MenuNode node : symbol.getNodes()) {
                if (node.getPrompt() != null) {
                    inputs.add(node.getPrompt().condition());
                }
            }
            for (DefaultValue defaultValue : symbol.getDefaults()) {
                inputs.add(defaultValue.value());
                inputs.add(defaultValue.condition());
            }
            inputs.add(symbol.getReverseDependency());
            inputs.add(symbol.getWeakReverseDependency());
            for (Range range : symbol.getRanges()) {
                inputs.add(range.low());
                inputs.add(range.high());
                inputs.add(range.condition());
            }
            inputs.add(symbol.getDirectDependency());
            registerDependent(symbol, inputs);
        }

        for (Choice choice : kconfig.getChoices()) {
            List<Expr> inputs = new ArrayList<>();
            for (MenuNode node : choice.getNodes()) {
                if (node.getPrompt() != null) {
                    inputs.add(node.getPrompt().condition());
                }
            }
            for (DefaultValue defaultValue : choice.getDefaults()) {
                inputs.add(defaultValue.condition());
            }
            registerDependent(choice, inputs);
            // The selection changes with the visibility of the members.
            for (Symbol symbol : choice.getSymbols()) {
                symbol.addDependent(choice);
            }
        }
    }

    private static void registerDependent(ConfigItem dependent, List<Expr> inputs) {
        List<ConfigItem> items = new ArrayList<>();
        for (Expr input : inputs) {
            Expressions.collectItems(input, items);
        }
        for (ConfigItem item : items) {
            if (!(item instanceof Symbol symbol && symbol.isConstant())) {
                item.addDependent(dependent);
            }
        }
    }

    private void warnUndefinedSymbols() {
        for (Symbol symbol : kconfig.getSyms().values()) {
            if (symbol.isConstant() || !symbol.getNodes().isEmpty() || symbol == kconfig.getModules()
                    || isNumber(symbol.getName())) {
                continue;
            }
            kconfig.getFirstReference(symbol).ifPresent(location ->
                    kconfig.warn("undefined symbol " + symbol.getName(), location));
        }
    }

    private static boolean isNumber(String name) {
        return NumericLiterals.isValid(name, 10) || NumericLiterals.isValid(name, 16);
    }
}
