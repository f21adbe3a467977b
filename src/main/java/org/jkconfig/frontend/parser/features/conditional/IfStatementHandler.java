package org.jkconfig.frontend.parser.features.conditional;

import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.MenuNode;

/**
 * Handles {@code if EXPR ... endif} blocks. The node only carries the condition down to the
 * enclosed nodes and is removed from the tree during finalization.
 */
public class IfStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        MenuNode node = new MenuNode(context.getKconfig(), MenuNode.Kind.IF, null, parent, context.location());
        node.setDependency(context.parseExpression(true));
        context.expectEndOfLine();

        context.parseBlock(Keyword.ENDIF, node, node);
        node.setList(node.getNext());

        previous.setNext(node);
        return node;
    }
}
