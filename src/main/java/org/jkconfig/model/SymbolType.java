package org.jkconfig.model;

/**
 * The value types a symbol or choice can have.
 */
public enum SymbolType {
    UNKNOWN("unknown", 0),
    BOOL("bool", 0),
    TRISTATE("tristate", 0),
    STRING("string", 0),
    INT("int", 10),
    HEX("hex", 16);

    private final String keyword;
    private final int base;

    SymbolType(String keyword, int base) {
        this.keyword = keyword;
        this.base = base;
    }

    /**
     * @return The radix values of this type are parsed in when compared; 0 means
     *         the radix is taken from the prefix of the value.
     */
    public int getBase() {
        return base;
    }

    public boolean isBoolOrTristate() {
        return this == BOOL || this == TRISTATE;
    }

    public boolean isNumeric() {
        return this == INT || this == HEX;
    }

    /**
     * @return The name used for the type in Kconfig files and diagnostics.
     */
    @Override
    public String toString() {
        return keyword;
    }
}
