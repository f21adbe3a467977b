package org.jkconfig.frontend.parser.features.source;

import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.frontend.source.SourceResolver;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.model.MenuNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the {@code source}, {@code rsource}, {@code osource} and {@code orsource} statements.
 * <p>
 * Environment variables in the file name are expanded. The {@code r} variants resolve the name
 * against the directory of the including file, and the {@code o} variants skip missing files.
 * The statements of the included file continue the current block.
 */
public class SourceStatementHandler implements IStatementHandler {

    private static final Logger LOG = LoggerFactory.getLogger(SourceStatementHandler.class);

    @Override
    public MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous)
            throws KconfigException {
        String pattern = context.expectText("file name");
        context.expectEndOfLine();

        String fileName = context.getEnvironment().expand(pattern);
        if (keyword.is(Keyword.RSOURCE) || keyword.is(Keyword.ORSOURCE)) {
            fileName = SourceResolver.relativeTo(context.getReader().getFileName(), fileName);
        }
        if ((keyword.is(Keyword.OSOURCE) || keyword.is(Keyword.ORSOURCE)) && !context.fileExists(fileName)) {
            LOG.debug("Skipping missing optional file {} at {}", fileName, context.location());
            return previous;
        }
        return context.includeFile(fileName, parent, previous);
    }
}
