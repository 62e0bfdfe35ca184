package com.cyclerprotocol.procedure;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** One Maccor {@code TestStep}. Step numbers are 1-based and contiguous within a procedure. */
public final class Step {
    private final int number;
    private final StepType type;
    private final String typeLabel;
    private final ControlMode mode;
    private final String modeLabel;
    private final String value;
    private final List<EndCondition> endConditions;
    private final List<ReportTrigger> reports;

    public Step(
            int number,
            StepType type,
            String typeLabel,
            ControlMode mode,
            String modeLabel,
            String value,
            List<EndCondition> endConditions,
            List<ReportTrigger> reports) {
        if (number < 1) {
            throw new IllegalArgumentException("Step numbers start at 1: " + number);
        }
        this.number = number;
        this.type = Objects.requireNonNull(type, "type");
        this.typeLabel = typeLabel == null ? type.name() : typeLabel;
        this.mode = mode;
        this.modeLabel = modeLabel == null ? (mode == null ? "" : mode.name()) : modeLabel;
        this.value = value;
        this.endConditions = List.copyOf(endConditions);
        this.reports = List.copyOf(reports);
    }

    public int getNumber() {
        return number;
    }

    public StepType getType() {
        return type;
    }

    public String getTypeLabel() {
        return typeLabel;
    }

    /** May be {@code null} for rest and control-flow steps. */
    public ControlMode getMode() {
        return mode;
    }

    public String getModeLabel() {
        return modeLabel;
    }

    /** Control value as written in the source, or {@code null}. */
    public String getValue() {
        return value;
    }

    public List<EndCondition> getEndConditions() {
        return endConditions;
    }

    public List<ReportTrigger> getReports() {
        return reports;
    }

    public Optional<EndCondition> findEndCondition(EndConditionKind kind) {
        for (EndCondition condition : endConditions) {
            if (condition.getKind() == kind) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Step " + number + " (" + typeLabel + ")";
    }
}
