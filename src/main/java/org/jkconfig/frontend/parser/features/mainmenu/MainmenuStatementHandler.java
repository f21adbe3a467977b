package org.jkconfig.frontend.parser.features.mainmenu;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Prompt;

/**
 * Handles {@code mainmenu "title"}, which sets the prompt of the top node.
 */
public class MainmenuStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        Kconfig kconfig = context.getKconfig();
        String title = context.expectText("main menu title");
        context.expectEndOfLine();

        MenuNode top = kconfig.getTopNode();
        top.setPrompt(new Prompt(title, kconfig.getY()));
        top.setLocation(context.location());
        return previous;
    }
}
