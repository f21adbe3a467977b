package org.jkconfig.frontend.parser.features.config;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Symbol;

/**
 * Handles the {@code config NAME} and {@code menuconfig NAME} statements.
 * Each statement adds one definition location to the symbol.
 */
public class ConfigStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        Kconfig kconfig = context.getKconfig();
        Symbol symbol = context.expectNonConstantSymbol();
        context.expectEndOfLine();

        MenuNode node = new MenuNode(kconfig, MenuNode.Kind.SYMBOL, symbol, parent, context.location());
        node.setMenuconfig(keyword.is(Keyword.MENUCONFIG));
        if (symbol.getNodes().isEmpty()) {
            kconfig.registerDefinedSymbol(symbol);
        }
        symbol.addNode(node);

        context.parseProperties(node);
        if (node.isMenuconfig() && node.getPrompt() == null) {
            kconfig.warn("the menuconfig symbol " + symbol.nameAndLocation() + " has no prompt");
        }

        previous.setNext(node);
        return node;
    }
}
