package org.jkconfig.frontend.parser;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigException;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.api.SourceInfo;
import org.jkconfig.config.Environment;
import org.jkconfig.frontend.lexer.Keyword;
import org.jkconfig.frontend.lexer.Lexer;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.lexer.TokenType;
import org.jkconfig.frontend.source.SourceReader;
import org.jkconfig.frontend.source.SourceResolver;
import org.jkconfig.frontend.statement.IStatementHandler;
import org.jkconfig.frontend.statement.StatementHandlerRegistry;
import org.jkconfig.model.Expr;
import org.jkconfig.model.MenuNode;
import org.jkconfig.model.Symbol;
import org.jkconfig.model.Tristate;

import java.util.List;
import java.util.Optional;

/**
 * The parser for Kconfig files. It reads one logical line at a time, tokenizes it with the
 * {@link Lexer} and dispatches statements to the handlers of the {@link StatementHandlerRegistry},
 * which link the nodes they create into the menu tree of the {@link Kconfig}.
 * <p>
 * The parser is also used to parse ad hoc expressions, see {@link #parseExpression(String)}.
 */
public class Parser implements ParsingContext {

    private final Kconfig kconfig;
    private final Environment environment;
    private final SourceResolver sources;
    private final StatementHandlerRegistry statementRegistry;

    private String line = "";
    private List<Token> tokens = List.of();
    private int current = 0;
    private boolean reuseTokens;

    /**
     * Constructs a new Parser.
     * @param kconfig The configuration receiving the parsed symbols and nodes.
     * @param environment The environment used for {@code srctree} and variable expansion.
     */
    public Parser(Kconfig kconfig, Environment environment) {
        this.kconfig = kconfig;
        this.environment = environment;
        this.sources = new SourceResolver(environment);
        this.statementRegistry = StatementHandlerRegistry.initialize();
    }

    /**
     * Parses a top-level Kconfig file. The parsed statements become the children of the top node.
     *
     * @param fileName The file name, relative to {@code srctree} when that is set.
     * @param top The top node.
     * @throws KconfigException if a file cannot be read or is malformed.
     */
    public void parse(String fileName, MenuNode top) throws KconfigException {
        sources.enter(fileName, null);
        try {
            parseBlock(null, top, top).setNext(null);
        } finally {
            sources.leave();
        }
        top.setList(top.getNext());
        top.setNext(null);
    }

    /**
     * Parses an expression in condition mode. The whole text must form one expression.
     *
     * @param text The expression text.
     * @return The expression.
     * @throws KconfigSyntaxException if the text is not a single well-formed expression.
     */
    public Expr parseExpression(String text) throws KconfigSyntaxException {
        line = text;
        tokens = new Lexer(text, null, 0).tokenizeExpression();
        current = 0;
        Expr expr = parseExpression(true);
        expectEndOfLine();
        return expr;
    }

    @Override
    public MenuNode parseBlock(Keyword endMarker, MenuNode parent, MenuNode previous) throws KconfigException {
        MenuNode prev = previous;
        while (nextLine()) {
            Token keyword = advance();
            if (endMarker != null && keyword.is(endMarker)) {
                expectEndOfLine();
                prev.setNext(null);
                return prev;
            }
            Optional<IStatementHandler> handler = statementRegistry.get(keyword.keyword());
            if (handler.isEmpty()) {
                throw error(isEndMarker(keyword) ? "unexpected '" + keyword.text() + "'" : "unrecognized construct");
            }
            prev = handler.get().parse(this, keyword, parent, prev);
        }
        if (endMarker != null) {
            throw error("unexpected end of file " + getReader().getFileName() + ", expected '" + endMarker + "'");
        }
        return prev;
    }

    private static boolean isEndMarker(Token token) {
        return token.is(Keyword.ENDMENU) || token.is(Keyword.ENDCHOICE) || token.is(Keyword.ENDIF);
    }

    @Override
    public void parseProperties(MenuNode node) throws KconfigSyntaxException {
        PropertyParser properties = new PropertyParser(this);
        while (nextLine()) {
            if (!properties.parseProperty(node)) {
                reuseTokens = true;
                return;
            }
        }
    }

    @Override
    public MenuNode includeFile(String fileName, MenuNode parent, MenuNode previous) throws KconfigException {
        sources.enter(fileName, location());
        try {
            return parseBlock(null, parent, previous);
        } finally {
            sources.leave();
        }
    }

    @Override
    public boolean fileExists(String fileName) {
        return sources.exists(fileName);
    }

    /**
     * Moves to the next non-blank logical line of the current file, or back to the start of the
     * current line if it was handed back by the property parser.
     *
     * @return false at the end of the file.
     */
    private boolean nextLine() throws KconfigSyntaxException {
        if (reuseTokens) {
            reuseTokens = false;
            current = 0;
            return true;
        }
        SourceReader reader = getReader();
        while (true) {
            String next = reader.nextLine();
            if (next == null) {
                return false;
            }
            line = next;
            tokens = new Lexer(next, reader.getFileName(), reader.getLineNumber()).tokenizeStatement();
            current = 0;
            if (!tokens.isEmpty()) {
                return true;
            }
        }
    }

    @Override
    public Token advance() throws KconfigSyntaxException {
        if (isAtEndOfLine()) {
            throw error("unexpected end of line");
        }
        return tokens.get(current++);
    }

    @Override
    public Token peek() {
        return isAtEndOfLine() ? null : tokens.get(current);
    }

    @Override
    public boolean match(Keyword keyword) {
        if (!isAtEndOfLine() && tokens.get(current).is(keyword)) {
            current++;
            return true;
        }
        return false;
    }

    @Override
    public boolean match(TokenType type) {
        if (!isAtEndOfLine() && tokens.get(current).type() == type) {
            current++;
            return true;
        }
        return false;
    }

    @Override
    public boolean isAtEndOfLine() {
        return current >= tokens.size();
    }

    @Override
    public void expectEndOfLine() throws KconfigSyntaxException {
        if (!isAtEndOfLine()) {
            throw error("extra tokens at end of line");
        }
    }

    @Override
    public String expectText(String what) throws KconfigSyntaxException {
        Token token = peek();
        if (token == null || (token.type() != TokenType.STRING && token.type() != TokenType.WORD)) {
            throw error("expected " + what);
        }
        current++;
        return token.text();
    }

    @Override
    public Symbol expectSymbol() throws KconfigSyntaxException {
        Token token = peek();
        if (token == null || (token.type() != TokenType.WORD && token.type() != TokenType.STRING)) {
            throw error("expected symbol");
        }
        current++;
        if (token.type() == TokenType.STRING) {
            return kconfig.lookupConstant(token.text());
        }
        return symbolNamed(token.text());
    }

    @Override
    public Symbol expectNonConstantSymbol() throws KconfigSyntaxException {
        Token token = peek();
        if (token == null || token.type() != TokenType.WORD || Tristate.parse(token.text()).isPresent()) {
            throw error("expected nonconstant symbol");
        }
        current++;
        return symbolNamed(token.text());
    }

    private Symbol symbolNamed(String name) {
        switch (name) {
            case "n":
                return kconfig.getN();
            case "m":
                return kconfig.getM();
            case "y":
                return kconfig.getY();
            default:
                Symbol symbol = kconfig.lookupSymbol(name);
                SourceInfo location = location();
                if (location != null) {
                    kconfig.noteReference(symbol, location);
                }
                return symbol;
        }
    }

    @Override
    public Expr parseExpression(boolean transformM) throws KconfigSyntaxException {
        return new ExpressionParser(this, transformM).expression();
    }

    @Override
    public Expr parseCondition() throws KconfigSyntaxException {
        Expr condition = kconfig.getY();
        if (match(Keyword.IF)) {
            condition = parseExpression(true);
        }
        expectEndOfLine();
        return condition;
    }

    @Override
    public SourceReader getReader() {
        return sources.current();
    }

    @Override
    public SourceInfo location() {
        SourceReader reader = getReader();
        return reader == null ? null : new SourceInfo(reader.getFileName(), reader.getLineNumber());
    }

    @Override
    public KconfigSyntaxException error(String message) {
        String text = "couldn't parse '" + line.strip() + "': " + message;
        SourceInfo location = location();
        return location == null ? new KconfigSyntaxException(text) : new KconfigSyntaxException(text, location);
    }

    @Override
    public void warn(String message) {
        kconfig.warn(message, location());
    }

    @Override
    public Kconfig getKconfig() {
        return kconfig;
    }

    @Override
    public Environment getEnvironment() {
        return environment;
    }
}
