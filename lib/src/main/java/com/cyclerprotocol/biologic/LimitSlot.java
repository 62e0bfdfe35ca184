package com.cyclerprotocol.biologic;

import java.util.Objects;

public final class LimitSlot {
    static final String GOTO_ACTION = "Goto sequence";

    private final MeasuredQuantity quantity;
    private final LimitComparator comparator;
    private final String value;
    private final String unit;
    private final int gotoIndex;
    private final boolean jump;

    public LimitSlot(
            MeasuredQuantity quantity,
            LimitComparator comparator,
            String value,
            String unit,
            int gotoIndex,
            boolean jump) {
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.value = Objects.requireNonNull(value, "value");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.gotoIndex = gotoIndex;
        this.jump = jump;
    }

    public MeasuredQuantity getQuantity() {
        return quantity;
    }

    public LimitComparator getComparator() {
        return comparator;
    }

    public String getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public int getGotoIndex() {
        return gotoIndex;
    }

    /** Whether the limit jumps somewhere other than the following sequence. */
    public boolean isJump() {
        return jump;
    }

    /** Same limit pointing at {@code target} from the sequence at {@code ownIndex}. */
    LimitSlot retarget(int target, int ownIndex) {
        return new LimitSlot(quantity, comparator, value, unit, target, target != ownIndex + 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LimitSlot)) {
            return false;
        }
        LimitSlot other = (LimitSlot) obj;
        return gotoIndex == other.gotoIndex
                && jump == other.jump
                && quantity == other.quantity
                && comparator == other.comparator
                && value.equals(other.value)
                && unit.equals(other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantity, comparator, value, unit, gotoIndex, jump);
    }

    @Override
    public String toString() {
        return quantity.getLabel() + " " + comparator.getSymbol() + " " + value + " " + unit + " -> " + gotoIndex;
    }
}
