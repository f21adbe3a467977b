package org.jkconfig.frontend.lexer;

/**
 * Represents a single token extracted from a Kconfig line by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The text of the token; for strings, the value with quotes and escapes removed.
 * @param keyword The keyword for {@link TokenType#KEYWORD} tokens, else {@code null}.
 * @param line The line number the token was found on.
 * @param column The column number where the token begins.
 * @param fileName The file the line belongs to, or {@code null} for ad hoc expressions.
 */
public record Token(
        TokenType type,
        String text,
        Keyword keyword,
        int line,
        int column,
        String fileName
) {
    /**
     * @param expected The keyword to test for.
     * @return Whether this token is that keyword.
     */
    public boolean is(Keyword expected) {
        return type == TokenType.KEYWORD && keyword == expected;
    }
}
