package org.jkconfig.frontend.parser.features.comment;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Prompt;

/**
 * Handles {@code comment "text"} statements, which show a line of text in the menu and
 * a comment block in written configuration files.
 */
public class CommentStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        Kconfig kconfig = context.getKconfig();
        String text = context.expectText("comment text");
        context.expectEndOfLine();

        MenuNode node = new MenuNode(kconfig, MenuNode.Kind.COMMENT, null, parent, context.location());
        node.setPrompt(new Prompt(text, kconfig.getY()));
        context.parseProperties(node);

        previous.setNext(node);
        return node;
    }
}
