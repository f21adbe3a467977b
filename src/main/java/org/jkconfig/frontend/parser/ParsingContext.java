package org.jkconfig.frontend.parser;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.api.SourceInfo;
import org.jkconfig.config.Environment;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.lexer.TokenType;
import org.jkconfig.frontend.source.SourceReader;
import org.jkconfig.model.Expr;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Symbol;

/**
 * An interface that encapsulates the state of the parser while a statement is handled.
 * It gives statement handlers access to the tokens of the current line, the line reader
 * and the configuration being built, without coupling them to the parser itself.
 */
public interface ParsingContext {

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     * @throws KconfigSyntaxException if the line has no more tokens.
     */
    Token advance() throws KconfigSyntaxException;

    /**
     * Returns the current token without consuming it.
     * @return The current token, or {@code null} at the end of the line.
     */
    Token peek();

    /**
     * Consumes the current token if it is the given keyword.
     * @param keyword The keyword to match.
     * @return true if the token was consumed.
     */
    boolean match(Keyword keyword);

    /**
     * Consumes the current token if it has the given type.
     * @param type The token type to match.
     * @return true if the token was consumed.
     */
    boolean match(TokenType type);

    /**
     * @return true if every token of the current line has been consumed.
     */
    boolean isAtEndOfLine();

    /**
     * @throws KconfigSyntaxException if tokens are left on the current line.
     */
    void expectEndOfLine() throws KconfigSyntaxException;

    /**
     * Consumes a string or a plain word.
     * @param what A description of the expected text, for the error message.
     * @return The text.
     * @throws KconfigSyntaxException if the current token is not a string or word.
     */
    String expectText(String what) throws KconfigSyntaxException;

    /**
     * Consumes a symbol reference: an unquoted word or a quoted constant.
     * @return The symbol.
     * @throws KconfigSyntaxException if the current token is not a symbol.
     */
    Symbol expectSymbol() throws KconfigSyntaxException;

    /**
     * Consumes the name of a non-constant symbol.
     * @return The symbol, created if it did not exist yet.
     * @throws KconfigSyntaxException if the current token is not such a name.
     */
    Symbol expectNonConstantSymbol() throws KconfigSyntaxException;

    /**
     * Parses an expression from the current token on.
     * @param transformM Whether a bare {@code m} is rewritten to {@code m && MODULES}.
     * @return The expression.
     * @throws KconfigSyntaxException if the expression is malformed.
     */
    Expr parseExpression(boolean transformM) throws KconfigSyntaxException;

    /**
     * Parses an optional {@code if EXPR} suffix and checks that the line ends after it.
     * @return The condition, or y if there is none.
     * @throws KconfigSyntaxException if the suffix is malformed or followed by more tokens.
     */
    Expr parseCondition() throws KconfigSyntaxException;

    /**
     * Parses statements into a chain of sibling nodes until the given end keyword or,
     * without one, the end of the current file.
     *
     * @param endMarker {@code endmenu}, {@code endchoice}, {@code endif}, or {@code null}.
     * @param parent The parent of the parsed nodes.
     * @param previous The node the first parsed node is linked after.
     * @return The last node of the chain, or {@code previous} if no node was parsed.
     * @throws KconfigException if the block is malformed or a file cannot be read.
     */
    MenuNode parseBlock(Keyword endMarker, MenuNode parent, MenuNode previous) throws KconfigException;

    /**
     * Parses the property lines following a statement into the node.
     * @param node The node of the statement.
     * @throws KconfigSyntaxException if a property is malformed.
     */
    void parseProperties(MenuNode node) throws KconfigSyntaxException;

    /**
     * Parses the statements of another file into the current block.
     *
     * @param fileName The file name, relative to {@code srctree}.
     * @param parent The parent of the parsed nodes.
     * @param previous The node the first parsed node is linked after.
     * @return The last node parsed, or {@code previous}.
     * @throws KconfigException if the file cannot be read, is already being parsed or is malformed.
     */
    MenuNode includeFile(String fileName, MenuNode parent, MenuNode previous) throws KconfigException;

    /**
     * @param fileName The file name, relative to {@code srctree}.
     * @return Whether the file exists.
     */
    boolean fileExists(String fileName);

    /**
     * @return The reader of the file currently being parsed.
     */
    SourceReader getReader();

    /**
     * @return The location of the current line, or {@code null} for ad hoc expressions.
     */
    SourceInfo location();

    /**
     * Creates a syntax error for the current line.
     * @param message The description of the problem.
     * @return The exception, for the caller to throw.
     */
    KconfigSyntaxException error(String message);

    /**
     * Reports a warning at the current line.
     * @param message The warning message.
     */
    void warn(String message);

    Kconfig getKconfig();

    Environment getEnvironment();
}
