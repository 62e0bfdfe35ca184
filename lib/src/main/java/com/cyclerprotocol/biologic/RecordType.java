package com.cyclerprotocol.biologic;

/** Modulo Bat sequence types, rendered in the {@code ctrl_type} column. */
public enum RecordType {
    REST("Rest"),
    CONSTANT_CURRENT("CC"),
    CONSTANT_VOLTAGE("CV"),
    LOOP("Loop");

    private final String label;

    RecordType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
