package org.jkconfig.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class ConfigStringsTest {

    @Test
    void escapesBackslashesAndQuotes() {
        assertEquals("a \\\"b\\\" \\\\ c", ConfigStrings.escape("a \"b\" \\ c"));
        assertEquals("plain", ConfigStrings.escape("plain"));
    }

    @Test
    void unescapeTakesTheCharacterAfterEachBackslash() {
        assertEquals("a \"b\" \\ c", ConfigStrings.unescape("a \\\"b\\\" \\\\ c"));
        assertEquals("xn", ConfigStrings.unescape("x\\n"));
        assertEquals("trailing\\", ConfigStrings.unescape("trailing\\"));
    }
}
