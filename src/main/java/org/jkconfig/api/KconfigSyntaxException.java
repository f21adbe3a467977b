package org.jkconfig.api;

/**
 * A fatal error in Kconfig source text: a malformed token, an unbalanced expression,
 * an unterminated block or a recursive {@code source}.
 */
public class KconfigSyntaxException extends KconfigException {

    /**
     * Creates a syntax error with no location, as raised when evaluating ad hoc expression strings.
     * @param message The detail message.
     */
    public KconfigSyntaxException(String message) {
        super(message);
    }

    /**
     * Creates a syntax error tagged with a file and line.
     * @param message The detail message.
     * @param sourceInfo The location of the offending line.
     */
    public KconfigSyntaxException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }
}
