package org.jkconfig.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A reserved word, see {@link Keyword}. */
    KEYWORD,
    /** An unquoted word: a symbol name or a number. */
    WORD,
    /** A single- or double-quoted string. */
    STRING,

    // Operators.
    /** {@code &&} */
    AND,
    /** {@code ||} */
    OR,
    /** {@code !} */
    NOT,
    /** {@code =} */
    EQUAL,
    /** {@code !=} */
    UNEQUAL,
    /** {@code <} */
    LESS,
    /** {@code <=} */
    LESS_EQUAL,
    /** {@code >} */
    GREATER,
    /** {@code >=} */
    GREATER_EQUAL,
    /** {@code (} */
    OPEN_PAREN,
    /** {@code )} */
    CLOSE_PAREN
}
