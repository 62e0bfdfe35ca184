package com.cyclerprotocol.procedure;

/** End-condition comparison operators as written in Maccor procedures. */
public enum Comparison {
    EQUAL("="),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    LESS("<"),
    UNSUPPORTED("?");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Comparison fromSource(String symbol) {
        if (symbol == null) {
            return UNSUPPORTED;
        }
        String trimmed = symbol.trim();
        for (Comparison comparison : values()) {
            if (comparison != UNSUPPORTED && comparison.symbol.equals(trimmed)) {
                return comparison;
            }
        }
        return UNSUPPORTED;
    }
}
