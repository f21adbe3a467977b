package org.jkconfig.frontend.statement;

import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.parser.features.choice.ChoiceStatementHandler;
import org.jkconfig.frontend.parser.features.comment.CommentStatementHandler;
import org.jkconfig.frontend.parser.features.conditional.IfStatementHandler;
import org.jkconfig.frontend.parser.features.config.ConfigStatementHandler;
import org.jkconfig.frontend.parser.features.mainmenu.MainmenuStatementHandler;
import org.jkconfig.frontend.parser.features.menu.MenuStatementHandler;
import org.jkconfig.frontend.parser.features.source.SourceStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of statement keywords
 * to their corresponding handlers.
 */
public class StatementHandlerRegistry {
    private final Map<Keyword, IStatementHandler> handlers = new EnumMap<>(Keyword.class);

    /**
     * Registers a new statement handler.
     * @param keyword The keyword that starts the statement.
     * @param handler The handler for the statement.
     */
    public void register(Keyword keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given statement keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(Keyword keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        ConfigStatementHandler configHandler = new ConfigStatementHandler();
        registry.register(Keyword.CONFIG, configHandler);
        registry.register(Keyword.MENUCONFIG, configHandler);
        registry.register(Keyword.CHOICE, new ChoiceStatementHandler());
        registry.register(Keyword.MENU, new MenuStatementHandler());
        registry.register(Keyword.COMMENT, new CommentStatementHandler());
        registry.register(Keyword.IF, new IfStatementHandler());
        registry.register(Keyword.MAINMENU, new MainmenuStatementHandler());

        SourceStatementHandler sourceHandler = new SourceStatementHandler();
        registry.register(Keyword.SOURCE, sourceHandler);
        registry.register(Keyword.RSOURCE, sourceHandler);
        registry.register(Keyword.OSOURCE, sourceHandler);
        registry.register(Keyword.ORSOURCE, sourceHandler);

        return registry;
    }
}
