package org.jkconfig.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The reserved words of the Kconfig language.
 */
public enum Keyword {
    ALLNOCONFIG_Y("allnoconfig_y"),
    BOOL("bool"),
    BOOLEAN("boolean"),
    CHOICE("choice"),
    COMMENT("comment"),
    CONFIG("config"),
    DEF_BOOL("def_bool"),
    DEF_HEX("def_hex"),
    DEF_INT("def_int"),
    DEF_STRING("def_string"),
    DEF_TRISTATE("def_tristate"),
    DEFAULT("default"),
    DEFCONFIG_LIST("defconfig_list"),
    DEPENDS("depends"),
    ENDCHOICE("endchoice"),
    ENDIF("endif"),
    ENDMENU("endmenu"),
    ENV("env"),
    HELP("help"),
    HEX("hex"),
    IF("if"),
    IMPLY("imply"),
    INT("int"),
    MAINMENU("mainmenu"),
    MENU("menu"),
    MENUCONFIG("menuconfig"),
    MODULES("modules"),
    ON("on"),
    OPTION("option"),
    OPTIONAL("optional"),
    ORSOURCE("orsource"),
    OSOURCE("osource"),
    PROMPT("prompt"),
    RANGE("range"),
    RSOURCE("rsource"),
    SELECT("select"),
    SOURCE("source"),
    STRING("string"),
    TRISTATE("tristate"),
    VISIBLE("visible");

    private static final Map<String, Keyword> BY_TEXT = Arrays.stream(values())
            .collect(Collectors.toMap(Keyword::getText, Function.identity()));

    private final String text;

    Keyword(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * @param text A word.
     * @return The keyword spelled that way, if any.
     */
    public static Optional<Keyword> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }

    @Override
    public String toString() {
        return text;
    }
}
