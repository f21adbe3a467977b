package org.jkconfig.frontend.parser;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.lexer.TokenType;
import org.jkconfig.model.Choice;
import org.jkconfig.model.ConfigItem;
import org.jkconfig.model.DefaultValue;
import org.jkconfig.model.Expr;
import org.jkconfig.model.Expressions;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Prompt;
import org.jkconfig.model.Range;
import org.jkconfig.model.Symbol;
import org.jkconfig.model.SymbolType;
import org.jkconfig.model.TargetCondition;

import java.util.Locale;
import java.util.Optional;

/**
 * Parses the property lines that follow a {@code config}, {@code menuconfig}, {@code choice},
 * {@code menu} or {@code comment} statement.
 * <p>
 * The first line that does not start with a property keyword ends the property list and is
 * handed back to the parser as the next statement.
 */
final class PropertyParser {

    private final ParsingContext context;
    private final Kconfig kconfig;

    PropertyParser(ParsingContext context) {
        this.context = context;
        this.kconfig = context.getKconfig();
    }

    /**
     * @param node The node receiving the properties.
     * @return false when the line just read is not a property and must be reused.
     * @throws KconfigSyntaxException if a property is malformed.
     */
    boolean parseProperty(MenuNode node) throws KconfigSyntaxException {
        Token first = context.advance();
        Keyword keyword = first.keyword();
        switch (keyword) {
            case BOOL, BOOLEAN, TRISTATE, STRING, INT, HEX -> {
                setType(node, typeOf(keyword));
                if (!context.isAtEndOfLine()) {
                    parsePrompt(node);
                }
            }
            case DEF_BOOL, DEF_TRISTATE, DEF_STRING, DEF_INT, DEF_HEX -> {
                setType(node, typeOf(keyword));
                parseDefault(node);
            }
            case DEFAULT -> parseDefault(node);
            case PROMPT -> parsePrompt(node);
            case DEPENDS -> {
                if (!context.match(Keyword.ON)) {
                    throw context.error("expected \"on\" after \"depends\"");
                }
                Expr dependency = context.parseExpression(true);
                context.expectEndOfLine();
                node.setDependency(Expressions.and(node.getDependency(), dependency));
            }
            case SELECT -> {
                requireSymbol(node, "only symbols can select");
                node.addSelect(new TargetCondition(context.expectNonConstantSymbol(), context.parseCondition()));
            }
            case IMPLY -> {
                requireSymbol(node, "only symbols can imply");
                node.addImply(new TargetCondition(context.expectNonConstantSymbol(), context.parseCondition()));
            }
            case RANGE -> {
                requireSymbol(node, "only symbols can have ranges");
                Symbol low = context.expectSymbol();
                Symbol high = context.expectSymbol();
                node.addRange(new Range(low, high, context.parseCondition()));
            }
            case HELP -> {
                context.expectEndOfLine();
                String help = HelpTextReader.read(context.getReader());
                if (help.isEmpty()) {
                    kconfig.warn(describe(node) + " has 'help' but empty help text");
                }
                node.setHelp(help);
            }
            case OPTION -> parseOption(node);
            case VISIBLE -> {
                if (!context.match(Keyword.IF)) {
                    throw context.error("expected \"if\" after \"visible\"");
                }
                if (node.getKind() != MenuNode.Kind.MENU) {
                    throw context.error("\"visible if\" is only valid for menus");
                }
                Expr visibleIf = context.parseExpression(true);
                context.expectEndOfLine();
                node.setVisibleIf(Expressions.and(node.getVisibleIf(), visibleIf));
            }
            case OPTIONAL -> {
                if (!(node.getItem() instanceof Choice choice)) {
                    throw context.error("\"optional\" is only valid for choices");
                }
                context.expectEndOfLine();
                choice.setOptional(true);
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    private void parseDefault(MenuNode node) throws KconfigSyntaxException {
        ConfigItem item = requireItem(node, "defaults");
        Expr value = item instanceof Choice ? context.expectSymbol() : context.parseExpression(false);
        node.addDefault(new DefaultValue(value, context.parseCondition()));
    }

    private void parsePrompt(MenuNode node) throws KconfigSyntaxException {
        if (node.getPrompt() != null) {
            kconfig.warn(describe(node) + " defined with multiple prompts in single location");
        }
        Token token = context.peek();
        if (token == null || (token.type() != TokenType.STRING && token.type() != TokenType.WORD)) {
            throw context.error("expected prompt string");
        }
        String text = context.expectText("prompt string");
        if (!text.equals(text.strip())) {
            kconfig.warn(describe(node) + " has leading or trailing whitespace in its prompt");
            text = text.strip();
        }
        node.setPrompt(new Prompt(text, context.parseCondition()));
    }

    private void parseOption(MenuNode node) throws KconfigSyntaxException {
        if (context.match(Keyword.ENV)) {
            if (!context.match(TokenType.EQUAL)) {
                throw context.error("expected \"=\" after \"env\"");
            }
            Symbol symbol = requireSymbol(node, "'option env' is only valid for symbols");
            String variable = context.expectText("environment variable name");
            context.expectEndOfLine();
            symbol.setEnvVar(variable);
            Optional<String> value = context.getEnvironment().get(variable);
            if (value.isPresent()) {
                node.addDefault(new DefaultValue(kconfig.lookupConstant(value.get()), kconfig.getY()));
            } else {
                context.warn(symbol.getName() + " has 'option env=\"" + variable + "\"', but the environment "
                        + "variable " + variable + " is not set");
            }
        } else if (context.match(Keyword.DEFCONFIG_LIST)) {
            Symbol symbol = requireSymbol(node, "'option defconfig_list' is only valid for symbols");
            context.expectEndOfLine();
            if (kconfig.getDefconfigList() == null) {
                kconfig.setDefconfigList(symbol);
            } else if (kconfig.getDefconfigList() != symbol) {
                context.warn("'option defconfig_list' set on multiple symbols ("
                        + kconfig.getDefconfigList().getName() + " and " + symbol.getName() + "). Only "
                        + kconfig.getDefconfigList().getName() + " will be used.");
            }
        } else if (context.match(Keyword.MODULES)) {
            context.expectEndOfLine();
            if (node.getItem() != kconfig.getModules()) {
                context.warn("the 'modules' option is not supported on " + describe(node)
                        + ". The modules symbol is always the symbol named MODULES.");
            }
        } else if (context.match(Keyword.ALLNOCONFIG_Y)) {
            Symbol symbol = requireSymbol(node, "the 'allnoconfig_y' option is only valid for symbols");
            context.expectEndOfLine();
            symbol.setAllnoconfigY(true);
        } else {
            throw context.error("unrecognized option");
        }
    }

    private void setType(MenuNode node, SymbolType type) throws KconfigSyntaxException {
        ConfigItem item = requireItem(node, "types");
        if (item.getOrigType() == SymbolType.UNKNOWN) {
            item.setOrigType(type);
        } else if (item.getOrigType() != type) {
            kconfig.warn(describe(node) + " defined with multiple types, " + item.getOrigType() + " will be used");
        }
    }

    private ConfigItem requireItem(MenuNode node, String what) throws KconfigSyntaxException {
        if (node.getItem() == null) {
            throw context.error(what + " can only be given to symbols and choices");
        }
        return node.getItem();
    }

    private Symbol requireSymbol(MenuNode node, String message) throws KconfigSyntaxException {
        if (node.getItem() instanceof Symbol symbol) {
            return symbol;
        }
        throw context.error(message);
    }

    private static SymbolType typeOf(Keyword keyword) {
        return switch (keyword) {
            case BOOL, BOOLEAN, DEF_BOOL -> SymbolType.BOOL;
            case TRISTATE, DEF_TRISTATE -> SymbolType.TRISTATE;
            case STRING, DEF_STRING -> SymbolType.STRING;
            case INT, DEF_INT -> SymbolType.INT;
            case HEX, DEF_HEX -> SymbolType.HEX;
            default -> throw new IllegalArgumentException("not a type keyword: " + keyword);
        };
    }

    /**
     * @return The name and location of the item, or the kind and location for menus and comments.
     */
    static String describe(MenuNode node) {
        if (node.getItem() != null) {
            return node.getItem().nameAndLocation();
        }
        return node.getKind().name().toLowerCase(Locale.ROOT) + " (defined at " + node.getLocation() + ")";
    }
}
