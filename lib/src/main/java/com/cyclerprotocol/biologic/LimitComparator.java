package com.cyclerprotocol.biologic;

/** Modulo Bat only compares strictly. */
public enum LimitComparator {
    GREATER(">"),
    LESS("<");

    private final String symbol;

    LimitComparator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
