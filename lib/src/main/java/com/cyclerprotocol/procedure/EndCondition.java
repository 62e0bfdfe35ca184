package com.cyclerprotocol.procedure;

import java.util.Objects;

/** A Maccor {@code EndEntry}: stop the step when the comparison holds and continue at {@code gotoStep}. */
public final class EndCondition {
    private final EndConditionKind kind;
    private final String kindLabel;
    private final Comparison comparison;
    private final String comparisonLabel;
    private final String value;
    private final int gotoStep;

    public EndCondition(
            EndConditionKind kind,
            String kindLabel,
            Comparison comparison,
            String comparisonLabel,
            String value,
            int gotoStep) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.kindLabel = kindLabel == null ? kind.name() : kindLabel;
        this.comparison = Objects.requireNonNull(comparison, "comparison");
        this.comparisonLabel = comparisonLabel == null ? comparison.getSymbol() : comparisonLabel;
        this.value = value == null ? "" : value;
        this.gotoStep = gotoStep;
    }

    public static EndCondition of(EndConditionKind kind, Comparison comparison, String value, int gotoStep) {
        return new EndCondition(kind, null, comparison, null, value, gotoStep);
    }

    /** The loop counter entry closing a {@code Loop} step. */
    public static EndCondition loopCount(int repeats, int gotoStep) {
        return new EndCondition(
                EndConditionKind.LOOP_COUNT, "Loop Cnt", Comparison.EQUAL, null, Integer.toString(repeats), gotoStep);
    }

    public EndConditionKind getKind() {
        return kind;
    }

    public String getKindLabel() {
        return kindLabel;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public String getComparisonLabel() {
        return comparisonLabel;
    }

    public String getValue() {
        return value;
    }

    public int getGotoStep() {
        return gotoStep;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EndCondition)) {
            return false;
        }
        EndCondition other = (EndCondition) obj;
        return gotoStep == other.gotoStep
                && kind == other.kind
                && comparison == other.comparison
                && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, comparison, value, gotoStep);
    }

    @Override
    public String toString() {
        return kindLabel + " " + comparisonLabel + " " + value + " -> step " + gotoStep;
    }
}
