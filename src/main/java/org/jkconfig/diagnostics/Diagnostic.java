package org.jkconfig.diagnostics;

/**
 * Represents a single warning raised while parsing or evaluating a configuration.
 *
 * @param message The warning message.
 * @param fileName The name of the file the warning refers to, or {@code null}.
 * @param lineNumber The line number of the warning, or 0 if there is no location.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * Formats the warning the way it is printed on the console,
     * e.g. {@code Kconfig:12: warning: FOO defined with multiple prompts in single location}.
     *
     * @return The formatted warning.
     */
    public String format() {
        String text = "warning: " + message;
        return fileName == null ? text : fileName + ":" + lineNumber + ": " + text;
    }

    @Override
    public String toString() {
        return format();
    }
}
