package com.cyclerprotocol.biologic;

/** Quantity observed by a limit or report slot. */
public enum MeasuredQuantity {
    TIME("Time"),
    VOLTAGE("Voltage"),
    CURRENT("Current");

    private final String label;

    MeasuredQuantity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
