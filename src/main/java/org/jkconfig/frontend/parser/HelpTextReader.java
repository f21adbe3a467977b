package org.jkconfig.frontend.parser;

import org.jkconfig.frontend.source.SourceReader;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the indented text block following a {@code help} line.
 * <p>
 * The first non-blank line sets the base indentation, with tabs expanded to 8-column stops.
 * The block runs while lines are blank or indented at least that far; the first line indented
 * less is pushed back to the reader.
 */
final class HelpTextReader {

    private static final int TAB_WIDTH = 8;

    private HelpTextReader() {
    }

    /**
     * @param reader The reader positioned after the {@code help} line.
     * @return The dedented text ending in a newline, or the empty string if the block is empty.
     */
    static String read(SourceReader reader) {
        String line = reader.nextRawLine();
        while (line != null && line.isBlank()) {
            line = reader.nextRawLine();
        }
        if (line == null) {
            return "";
        }

        String expanded = expandTabs(line);
        int indent = indentation(expanded);
        if (indent == 0) {
            reader.unget(line);
            return "";
        }

        List<String> lines = new ArrayList<>();
        lines.add(dedent(expanded, indent));
        while ((line = reader.nextRawLine()) != null) {
            expanded = expandTabs(line);
            if (!expanded.isBlank() && indentation(expanded) < indent) {
                reader.unget(line);
                break;
            }
            lines.add(dedent(expanded, indent));
        }
        return String.join("\n", lines).stripTrailing() + "\n";
    }

    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = TAB_WIDTH - result.length() % TAB_WIDTH;
                result.append(" ".repeat(spaces));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static int indentation(String line) {
        int indent = 0;
        while (indent < line.length() && line.charAt(indent) == ' ') {
            indent++;
        }
        return indent;
    }

    private static String dedent(String line, int indent) {
        return (line.length() <= indent ? "" : line.substring(indent)).stripTrailing();
    }
}
