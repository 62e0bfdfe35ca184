package com.cyclerprotocol.biologic;

import java.util.Objects;

public final class ReportSlot {
    private final MeasuredQuantity quantity;
    private final String value;
    private final String unit;

    public ReportSlot(MeasuredQuantity quantity, String value, String unit) {
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.value = Objects.requireNonNull(value, "value");
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public MeasuredQuantity getQuantity() {
        return quantity;
    }

    public String getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReportSlot)) {
            return false;
        }
        ReportSlot other = (ReportSlot) obj;
        return quantity == other.quantity && value.equals(other.value) && unit.equals(other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantity, value, unit);
    }

    @Override
    public String toString() {
        return quantity.getLabel() + " every " + value + " " + unit;
    }
}
