package org.jkconfig.io;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escaping of string values as they appear between double quotes in configuration files.
 */
public final class ConfigStrings {

    private static final Pattern ESCAPED_CHAR = Pattern.compile("\\\\(.)");

    private ConfigStrings() {
    }

    /**
     * Prefixes every backslash and double quote with a backslash.
     *
     * @param text The raw value.
     * @return The escaped value.
     */
    public static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Replaces every backslash and the character following it with that character.
     * A trailing lone backslash is kept.
     *
     * @param text The escaped value.
     * @return The raw value.
     */
    public static String unescape(String text) {
        Matcher matcher = ESCAPED_CHAR.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group(1)));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
