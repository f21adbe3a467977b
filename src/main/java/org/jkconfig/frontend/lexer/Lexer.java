package org.jkconfig.frontend.lexer;

import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits one logical Kconfig line into tokens.
 * <p>
 * Statements must start with a keyword. Words made of letters, digits, {@code _}, {@code -}
 * and {@code $} become {@link TokenType#WORD} tokens unless they are keywords. Strings may be
 * single- or double-quoted; a backslash takes the next character literally. A {@code #}
 * outside a string starts a comment that runs to the end of the line.
 */
public class Lexer {

    private final String line;
    private final String fileName;
    private final int lineNumber;
    private final List<Token> tokens = new ArrayList<>();
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param line The logical line, with continuation lines already joined.
     * @param fileName The name of the file being parsed, for error reporting, or {@code null}.
     * @param lineNumber The line number, for error reporting.
     */
    public Lexer(String line, String fileName, int lineNumber) {
        this.line = line;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    /**
     * Tokenizes a statement line.
     * @return The tokens, or an empty list for blank and comment lines.
     * @throws KconfigSyntaxException if the line does not start with a keyword or contains an unknown token.
     */
    public List<Token> tokenizeStatement() throws KconfigSyntaxException {
        skipWhitespace();
        if (isAtEnd() || peek() == '#') {
            return tokens;
        }
        int start = current;
        while (!isAtEnd() && isCommandChar(peek())) {
            current++;
        }
        String word = line.substring(start, current);
        Optional<Keyword> keyword = Keyword.fromText(word);
        if (keyword.isEmpty()) {
            // Old Kconfig files spell the help keyword "---help---".
            if (stripDashesAndWhitespace(line).equals("help")) {
                tokens.add(new Token(TokenType.KEYWORD, "help", Keyword.HELP, lineNumber, start + 1, fileName));
                return tokens;
            }
            throw error("unknown token at start of line");
        }
        tokens.add(new Token(TokenType.KEYWORD, word, keyword.get(), lineNumber, start + 1, fileName));
        scanRest();
        return tokens;
    }

    /**
     * Tokenizes a bare expression, as passed to expression evaluation.
     * @return The tokens.
     * @throws KconfigSyntaxException if the text contains an unknown token or an unterminated string.
     */
    public List<Token> tokenizeExpression() throws KconfigSyntaxException {
        scanRest();
        return tokens;
    }

    private void scanRest() throws KconfigSyntaxException {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                return;
            }
            int start = current;
            char c = peek();
            if (isWordChar(c)) {
                while (!isAtEnd() && isWordChar(peek())) {
                    current++;
                }
                String word = line.substring(start, current);
                Optional<Keyword> keyword = Keyword.fromText(word);
                if (keyword.isPresent()) {
                    addToken(TokenType.KEYWORD, word, keyword.get(), start);
                } else {
                    addToken(TokenType.WORD, word, null, start);
                }
            } else if (c == '"' || c == '\'') {
                addToken(TokenType.STRING, string(c), null, start);
            } else if (c == '#') {
                return;
            } else if (line.startsWith("&&", current)) {
                current += 2;
                addToken(TokenType.AND, "&&", null, start);
            } else if (line.startsWith("||", current)) {
                current += 2;
                addToken(TokenType.OR, "||", null, start);
            } else if (line.startsWith("!=", current)) {
                current += 2;
                addToken(TokenType.UNEQUAL, "!=", null, start);
            } else if (line.startsWith("<=", current)) {
                current += 2;
                addToken(TokenType.LESS_EQUAL, "<=", null, start);
            } else if (line.startsWith(">=", current)) {
                current += 2;
                addToken(TokenType.GREATER_EQUAL, ">=", null, start);
            } else {
                current++;
                switch (c) {
                    case '!' -> addToken(TokenType.NOT, "!", null, start);
                    case '=' -> addToken(TokenType.EQUAL, "=", null, start);
                    case '<' -> addToken(TokenType.LESS, "<", null, start);
                    case '>' -> addToken(TokenType.GREATER, ">", null, start);
                    case '(' -> addToken(TokenType.OPEN_PAREN, "(", null, start);
                    case ')' -> addToken(TokenType.CLOSE_PAREN, ")", null, start);
                    default -> throw error("unknown token '" + c + "'");
                }
            }
        }
    }

    private String string(char quote) throws KconfigSyntaxException {
        current++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("unterminated string");
            }
            char c = line.charAt(current);
            if (c == quote) {
                current++;
                return value.toString();
            }
            if (c == '\\') {
                if (current + 1 >= line.length()) {
                    throw error("unterminated string");
                }
                value.append(line.charAt(current + 1));
                current += 2;
            } else {
                value.append(c);
                current++;
            }
        }
    }

    private void addToken(TokenType type, String text, Keyword keyword, int start) {
        tokens.add(new Token(type, text, keyword, lineNumber, start + 1, fileName));
    }

    private KconfigSyntaxException error(String message) {
        return fileName == null
                ? new KconfigSyntaxException(message + " in '" + line + "'")
                : new KconfigSyntaxException(message, new SourceInfo(fileName, lineNumber));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            current++;
        }
    }

    private static String stripDashesAndWhitespace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isDashOrBlank(text.charAt(start))) {
            start++;
        }
        while (end > start && isDashOrBlank(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isDashOrBlank(char c) {
        return c == '-' || c == ' ' || c == '\t' || c == '\n';
    }

    private static boolean isCommandChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static boolean isWordChar(char c) {
        return isCommandChar(c) || c == '$';
    }

    private char peek() {
        return line.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= line.length();
    }
}
