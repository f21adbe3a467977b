package org.jkconfig.model;

import org.jkconfig.Kconfig;
import org.jkconfig.io.ConfigStrings;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders symbols, choices and menu nodes back into Kconfig syntax.
 * <p>
 * The properties are printed as they were parsed, so the dependencies inherited from enclosing
 * menus and {@code if} blocks do not show up in conditions.
 */
public final class DefinitionFormatter {

    private DefinitionFormatter() {
    }

    /**
     * Renders every definition of a symbol or choice, separated by blank lines.
     *
     * @param item The symbol or choice.
     * @return The definitions, or the empty string for undefined symbols.
     */
    public static String format(ConfigItem item) {
        return item.getNodes().stream()
                .map(DefinitionFormatter::format)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Renders a single menu node.
     *
     * @param node The node.
     * @return The definition, ending in a newline.
     */
    public static String format(MenuNode node) {
        Kconfig kconfig = node.getKconfig();
        List<String> lines = new ArrayList<>();
        switch (node.getKind()) {
            case MENU, COMMENT -> {
                lines.add((node.getKind() == MenuNode.Kind.MENU ? "menu" : "comment")
                        + " \"" + ConfigStrings.escape(node.getParsedPrompt().text()) + "\"");
                addDependency(lines, node);
                if (node.getKind() == MenuNode.Kind.MENU && !Expressions.isConstant(node.getVisibleIf(), "y")) {
                    lines.add("\tvisible if " + Expressions.toString(node.getVisibleIf()));
                }
            }
            case IF -> lines.add("if " + Expressions.toString(node.getParsedDependency()));
            case SYMBOL, CHOICE -> formatItemNode(lines, node, kconfig);
        }
        return String.join("\n", lines) + "\n";
    }

    private static void formatItemNode(List<String> lines, MenuNode node, Kconfig kconfig) {
        ConfigItem item = node.getItem();
        if (item instanceof Symbol symbol) {
            lines.add((node.isMenuconfig() ? "menuconfig " : "config ") + symbol.getName());
        } else {
            lines.add(item.getName() == null ? "choice" : "choice " + item.getName());
        }

        if (item.getOrigType() != SymbolType.UNKNOWN) {
            lines.add("\t" + item.getOrigType());
        }

        Prompt prompt = node.getParsedPrompt();
        if (prompt != null) {
            addWithCondition(lines, "prompt \"" + ConfigStrings.escape(prompt.text()) + "\"", prompt.condition());
        }

        if (item instanceof Symbol symbol) {
            if (symbol.isAllnoconfigY()) {
                lines.add("\toption allnoconfig_y");
            }
            if (symbol == kconfig.getDefconfigList()) {
                lines.add("\toption defconfig_list");
            }
            if (symbol.getEnvVar() != null) {
                lines.add("\toption env=\"" + symbol.getEnvVar() + "\"");
            }
            if (symbol == kconfig.getModules()) {
                lines.add("\toption modules");
            }
            for (Range range : node.getParsedRanges()) {
                addWithCondition(lines, "range " + Expressions.itemToString(range.low()) + " "
                        + Expressions.itemToString(range.high()), range.condition());
            }
        }

        for (DefaultValue defaultValue : node.getParsedDefaults()) {
            addWithCondition(lines, "default " + Expressions.toString(defaultValue.value()), defaultValue.condition());
        }

        if (item instanceof Choice choice && choice.isOptional()) {
            lines.add("\toptional");
        }

        for (TargetCondition select : node.getParsedSelects()) {
            addWithCondition(lines, "select " + select.target().getName(), select.condition());
        }
        for (TargetCondition imply : node.getParsedImplies()) {
            addWithCondition(lines, "imply " + imply.target().getName(), imply.condition());
        }

        addDependency(lines, node);

        if (node.getHelp() != null) {
            lines.add("\thelp");
            if (!node.getHelp().isEmpty()) {
                for (String line : node.getHelp().split("\n")) {
                    lines.add("\t  " + line);
                }
            }
        }
    }

    private static void addDependency(List<String> lines, MenuNode node) {
        Expr dependency = node.getParsedDependency();
        if (!Expressions.isConstant(dependency, "y")) {
            lines.add("\tdepends on " + Expressions.toString(dependency));
        }
    }

    private static void addWithCondition(List<String> lines, String text, Expr condition) {
        lines.add("\t" + (Expressions.isConstant(condition, "y") ? text : text + " if " + Expressions.toString(condition)));
    }
}
