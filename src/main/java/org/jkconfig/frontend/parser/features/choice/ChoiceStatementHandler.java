package org.jkconfig.frontend.parser.features.choice;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.lexer.TokenType;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.Choice;
import org.jkconfig.model.MenuNode;

/**
 * Handles {@code choice [NAME] ... endchoice} blocks.
 * Choices with the same name share one {@link Choice}, with one node per block.
 */
public class ChoiceStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        Kconfig kconfig = context.getKconfig();
        String name = null;
        Token next = context.peek();
        if (next != null) {
            if (next.type() != TokenType.WORD) {
                throw context.error("expected choice name");
            }
            name = context.advance().text();
        }
        context.expectEndOfLine();

        Choice choice = kconfig.lookupChoice(name);
        MenuNode node = new MenuNode(kconfig, MenuNode.Kind.CHOICE, choice, parent, context.location());
        choice.addNode(node);

        context.parseProperties(node);
        context.parseBlock(Keyword.ENDCHOICE, node, node);
        node.setList(node.getNext());

        previous.setNext(node);
        return node;
    }
}
