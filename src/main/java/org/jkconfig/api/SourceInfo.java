package org.jkconfig.api;

/**
 * A position in a Kconfig source file.
 *
 * @param fileName The file name as recorded during parsing (relative to {@code srctree} when it was set).
 * @param lineNumber The 1-based line number.
 */
public record SourceInfo(String fileName, int lineNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
