package com.cyclerprotocol.procedure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered Maccor test procedure. The list is expected to finish with exactly one {@link StepType#END} step; the
 * planner checks this before converting.
 */
public final class Procedure {
    private final String sourceName;
    private final List<Step> steps;

    public Procedure(String sourceName, List<Step> steps) {
        this.sourceName = sourceName == null ? "<memory>" : sourceName;
        this.steps = List.copyOf(steps);
        for (int i = 0; i < this.steps.size(); i++) {
            if (this.steps.get(i).getNumber() != i + 1) {
                throw new IllegalArgumentException(
                        "Step numbers must be contiguous from 1; found "
                                + this.steps.get(i).getNumber()
                                + " at position "
                                + (i + 1));
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() {
        return steps.size();
    }

    /** @param number 1-based step number */
    public Step step(int number) {
        return steps.get(number - 1);
    }

    /** Number of the terminal End step, which is also the step count. */
    public int endStepNumber() {
        return steps.size();
    }

    /** Fluent construction with automatic step numbering. */
    public static final class Builder {
        private String sourceName;
        private final List<Step> steps = new ArrayList<>();

        private Builder() {}

        public Builder sourceName(String name) {
            this.sourceName = name;
            return this;
        }

        public Builder rest(List<EndCondition> ends, List<ReportTrigger> reports) {
            return add(StepType.REST, "Rest", null, null, ends, reports);
        }

        public Builder charge(ControlMode mode, String value, List<EndCondition> ends, List<ReportTrigger> reports) {
            return add(StepType.CHARGE, "Charge", mode, value, ends, reports);
        }

        public Builder discharge(
                ControlMode mode, String value, List<EndCondition> ends, List<ReportTrigger> reports) {
            return add(StepType.DISCHARGE, "Dischrge", mode, value, ends, reports);
        }

        public Builder doLoop() {
            return add(StepType.DO, "Do 1", null, null, List.of(), List.of());
        }

        public Builder loop(int repeats) {
            int next = steps.size() + 2;
            return add(StepType.LOOP, "Loop 1", null, null, List.of(EndCondition.loopCount(repeats, next)), List.of());
        }

        public Builder advanceCycle() {
            return add(StepType.ADVANCE_CYCLE, "AdvCycle", null, null, List.of(), List.of());
        }

        public Builder end() {
            return add(StepType.END, "End", null, null, List.of(), List.of());
        }

        public Builder add(
                StepType type,
                String typeLabel,
                ControlMode mode,
                String value,
                List<EndCondition> ends,
                List<ReportTrigger> reports) {
            Objects.requireNonNull(type, "type");
            steps.add(new Step(steps.size() + 1, type, typeLabel, mode, null, value, ends, reports));
            return this;
        }

        public Builder add(Step step) {
            steps.add(step);
            return this;
        }

        public Procedure build() {
            return new Procedure(sourceName, steps);
        }
    }
}
