package org.jkconfig.frontend.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the lines of one Kconfig file and keeps track of the current line number.
 * <p>
 * Logical lines join physical lines ending in a backslash. A single line can be pushed
 * back with {@link #unget(String)}, which the help text reader uses to hand the line that
 * ended a help block back to the statement parser.
 */
public class SourceReader {

    private final String fileName;
    private final List<String> lines;
    private int index = 0;
    private int lineNumber = 0;
    private String saved;

    /**
     * @param fileName The file name recorded in locations.
     * @param content The file content.
     */
    public SourceReader(String fileName, String content) {
        this.fileName = fileName;
        List<String> split = new ArrayList<>(Arrays.asList(content.split("\r\n|\r|\n", -1)));
        if (!split.isEmpty() && split.get(split.size() - 1).isEmpty()) {
            split.remove(split.size() - 1);
        }
        this.lines = split;
    }

    /**
     * Reads a file as UTF-8.
     *
     * @param path The file to read.
     * @param fileName The file name recorded in locations.
     * @return The reader.
     * @throws IOException if the file cannot be read.
     */
    public static SourceReader open(Path path, String fileName) throws IOException {
        return new SourceReader(fileName, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * @return The number of the physical line read last.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return The next physical line without its line terminator, or {@code null} at the end of the file.
     */
    public String nextRawLine() {
        if (saved != null) {
            String line = saved;
            saved = null;
            lineNumber++;
            return line;
        }
        if (index >= lines.size()) {
            return null;
        }
        lineNumber++;
        return lines.get(index++);
    }

    /**
     * @return The next logical line, or {@code null} at the end of the file.
     */
    public String nextLine() {
        String line = nextRawLine();
        if (line == null) {
            return null;
        }
        while (line.endsWith("\\")) {
            String continuation = nextRawLine();
            line = line.substring(0, line.length() - 1);
            if (continuation == null) {
                break;
            }
            line += continuation;
        }
        return line;
    }

    /**
     * Pushes a physical line back so the next read returns it again.
     *
     * @param line The line returned by the last read.
     */
    public void unget(String line) {
        saved = line;
        lineNumber--;
    }
}
