package org.jkconfig.frontend.statement;

import org.jkconfig.api.KconfigException;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.parser.ParsingContext;
import org.jkconfig.model.MenuNode;

/**
 * The base interface for all statement handlers.
 * Each handler is responsible for parsing one kind of statement (e.g. {@code config} or {@code menu})
 * and linking the node it creates into the menu tree.
 */
public interface IStatementHandler {

    /**
     * Parses the statement whose keyword has just been consumed.
     *
     * @param context The context that provides access to the tokens of the line and to the parser.
     * @param keyword The statement keyword.
     * @param parent The parent of the node the statement creates.
     * @param previous The node created by the preceding statement of the block.
     * @return The node that now ends the block, which is {@code previous} for statements
     *         that do not create a node.
     * @throws KconfigException if the statement is malformed or a sourced file cannot be read.
     */
    MenuNode parse(ParsingContext context, Token keyword, MenuNode parent, MenuNode previous) throws KconfigException;
}
