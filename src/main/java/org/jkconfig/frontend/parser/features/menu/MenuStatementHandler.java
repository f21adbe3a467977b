package org.jkconfig.frontend.parser.features.menu;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Prompt;

/**
 * Handles {@code menu "title" ... endmenu} blocks.
 */
public class MenuStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        Kconfig kconfig = context.getKconfig();
        String title = context.expectText("menu title");
        context.expectEndOfLine();

        MenuNode node = new MenuNode(kconfig, MenuNode.Kind.MENU, null, parent, context.location());
        node.setPrompt(new Prompt(title, kconfig.getY()));

        context.parseProperties(node);
        context.parseBlock(Keyword.ENDMENU, node, node);
        node.setList(node.getNext());

        previous.setNext(node);
        return node;
    }
}
