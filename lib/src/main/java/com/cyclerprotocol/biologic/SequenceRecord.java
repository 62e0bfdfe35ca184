package com.cyclerprotocol.biologic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a Modulo Bat sequence table. Instances are immutable; the unroller derives shifted copies through
 * {@link #withIndexShift(int, int, int)}.
 */
public final class SequenceRecord {
    /** Sequence index Modulo Bat treats as "end of procedure". */
    public static final int END_OF_PROCEDURE = 9999;

    public static final String CHARGE = "Charge";
    public static final String DISCHARGE = "Discharge";

    private final int index;
    private final RecordType type;
    private final String appliedQuantity;
    private final String controlValue;
    private final String controlUnit;
    private final String controlReference;
    private final String nominalN;
    private final String direction;
    private final List<LimitSlot> limits;
    private final List<ReportSlot> reports;
    private final int loopRepeat;
    private final int loopTarget;

    private SequenceRecord(Builder builder) {
        this.index = builder.index;
        this.type = Objects.requireNonNull(builder.type, "type");
        this.appliedQuantity = builder.appliedQuantity;
        this.controlValue = builder.controlValue;
        this.controlUnit = builder.controlUnit;
        this.controlReference = builder.controlReference;
        this.nominalN = builder.nominalN;
        this.direction = builder.direction;
        this.limits = List.copyOf(builder.limits);
        this.reports = List.copyOf(builder.reports);
        this.loopRepeat = builder.loopRepeat;
        this.loopTarget = builder.loopTarget;
        if (index < 0) {
            throw new IllegalArgumentException("Sequence index must be non-negative: " + index);
        }
        if (limits.size() > SequenceFields.MAX_SLOTS || reports.size() > SequenceFields.MAX_SLOTS) {
            throw new IllegalArgumentException("Sequence " + index + " exceeds " + SequenceFields.MAX_SLOTS + " slots");
        }
    }

    public static Builder builder(int index, RecordType type) {
        return new Builder(index, type);
    }

    /**
     * A Modulo Bat loop sequence jumping back to {@code target} {@code repeats} times. The applied quantity and
     * control value mirror what EC-Lab writes for loops; neither has any effect.
     */
    public static SequenceRecord loop(int index, int target, int repeats) {
        return builder(index, RecordType.LOOP)
                .appliedQuantity("C / N")
                .control("100.000", null, null)
                .loop(repeats, target)
                .build();
    }

    public int getIndex() {
        return index;
    }

    public RecordType getType() {
        return type;
    }

    public String getAppliedQuantity() {
        return appliedQuantity;
    }

    public String getControlValue() {
        return controlValue;
    }

    public String getControlUnit() {
        return controlUnit;
    }

    public String getControlReference() {
        return controlReference;
    }

    public String getNominalN() {
        return nominalN;
    }

    /** {@link #CHARGE}, {@link #DISCHARGE}, or {@code null} to keep the template default. */
    public String getDirection() {
        return direction;
    }

    public List<LimitSlot> getLimits() {
        return limits;
    }

    public List<ReportSlot> getReports() {
        return reports;
    }

    public int getLoopRepeat() {
        return loopRepeat;
    }

    /** Loop-control target ({@code ctrl_seq}); meaningful only for {@link RecordType#LOOP}. */
    public int getLoopTarget() {
        return loopTarget;
    }

    /**
     * Copy moved forward by {@code offset}. Goto and loop-control targets inside {@code [low, high]} move with it;
     * targets outside that range keep pointing at the single physical sequence they named. Jump flags are
     * recomputed against the new index.
     */
    public SequenceRecord withIndexShift(int offset, int low, int high) {
        Builder shifted = toBuilder();
        shifted.index = index + offset;
        shifted.limits.clear();
        for (LimitSlot limit : limits) {
            int target = limit.getGotoIndex();
            int moved = inRange(target, low, high) ? target + offset : target;
            shifted.limits.add(limit.retarget(moved, shifted.index));
        }
        if (type == RecordType.LOOP && inRange(loopTarget, low, high)) {
            shifted.loopTarget = loopTarget + offset;
        }
        return shifted.build();
    }

    private static boolean inRange(int target, int low, int high) {
        return low <= target && target <= high;
    }

    /**
     * Fields this record sets explicitly, keyed by Modulo Bat column name. Columns absent here take the template
     * default when rendered.
     */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SequenceFields.NS, Integer.toString(index));
        fields.put(SequenceFields.CTRL_TYPE, type.getLabel());
        putIfSet(fields, SequenceFields.APPLY_I_C, appliedQuantity);
        putIfSet(fields, SequenceFields.CTRL1_VAL, controlValue);
        putIfSet(fields, SequenceFields.CTRL1_VAL_UNIT, controlUnit);
        putIfSet(fields, SequenceFields.CTRL1_VAL_VS, controlReference);
        putIfSet(fields, SequenceFields.N, nominalN);
        putIfSet(fields, SequenceFields.CHARGE_DISCHARGE, direction);
        if (type == RecordType.LOOP) {
            fields.put(SequenceFields.CTRL_REPEAT, Integer.toString(loopRepeat));
            fields.put(SequenceFields.CTRL_SEQ, Integer.toString(loopTarget));
        }

        fields.put(SequenceFields.LIM_NB, Integer.toString(limits.size()));
        for (int slot = 1; slot <= SequenceFields.MAX_SLOTS; slot++) {
            if (slot <= limits.size()) {
                LimitSlot limit = limits.get(slot - 1);
                fields.put(SequenceFields.limit(slot, "type"), limit.getQuantity().getLabel());
                fields.put(SequenceFields.limit(slot, "comp"), limit.getComparator().getSymbol());
                fields.put(SequenceFields.limit(slot, "value"), limit.getValue());
                fields.put(SequenceFields.limit(slot, "value_unit"), limit.getUnit());
                if (limit.isJump()) {
                    fields.put(SequenceFields.limit(slot, "action"), LimitSlot.GOTO_ACTION);
                }
                fields.put(SequenceFields.limit(slot, "seq"), Integer.toString(limit.getGotoIndex()));
            } else {
                fields.put(SequenceFields.limit(slot, "seq"), Integer.toString(index + 1));
            }
        }

        fields.put(SequenceFields.REC_NB, Integer.toString(reports.size()));
        for (int slot = 1; slot <= reports.size(); slot++) {
            ReportSlot report = reports.get(slot - 1);
            fields.put(SequenceFields.report(slot, "type"), report.getQuantity().getLabel());
            fields.put(SequenceFields.report(slot, "value"), report.getValue());
            fields.put(SequenceFields.report(slot, "value_unit"), report.getUnit());
        }
        return fields;
    }

    private static void putIfSet(Map<String, String> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    public Builder toBuilder() {
        Builder builder = new Builder(index, type);
        builder.appliedQuantity = appliedQuantity;
        builder.controlValue = controlValue;
        builder.controlUnit = controlUnit;
        builder.controlReference = controlReference;
        builder.nominalN = nominalN;
        builder.direction = direction;
        builder.limits.addAll(limits);
        builder.reports.addAll(reports);
        builder.loopRepeat = loopRepeat;
        builder.loopTarget = loopTarget;
        return builder;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SequenceRecord)) {
            return false;
        }
        SequenceRecord other = (SequenceRecord) obj;
        return index == other.index
                && loopRepeat == other.loopRepeat
                && loopTarget == other.loopTarget
                && type == other.type
                && Objects.equals(appliedQuantity, other.appliedQuantity)
                && Objects.equals(controlValue, other.controlValue)
                && Objects.equals(controlUnit, other.controlUnit)
                && Objects.equals(controlReference, other.controlReference)
                && Objects.equals(nominalN, other.nominalN)
                && Objects.equals(direction, other.direction)
                && limits.equals(other.limits)
                && reports.equals(other.reports);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, type, controlValue, controlUnit, limits, reports, loopRepeat, loopTarget);
    }

    @Override
    public String toString() {
        if (type == RecordType.LOOP) {
            return String.format(Locale.ROOT, "Ns=%d Loop x%d -> %d", index, loopRepeat, loopTarget);
        }
        return String.format(Locale.ROOT, "Ns=%d %s %s limits=%s", index, type.getLabel(), direction, limits);
    }

    public static final class Builder {
        private int index;
        private final RecordType type;
        private String appliedQuantity;
        private String controlValue;
        private String controlUnit;
        private String controlReference;
        private String nominalN;
        private String direction;
        private final List<LimitSlot> limits = new ArrayList<>();
        private final List<ReportSlot> reports = new ArrayList<>();
        private int loopRepeat;
        private int loopTarget;

        private Builder(int index, RecordType type) {
            this.index = index;
            this.type = type;
        }

        public Builder appliedQuantity(String value) {
            this.appliedQuantity = value;
            return this;
        }

        public Builder control(String value, String unit, String reference) {
            this.controlValue = value;
            this.controlUnit = unit;
            this.controlReference = reference;
            return this;
        }

        public Builder nominalN(String value) {
            this.nominalN = value;
            return this;
        }

        public Builder direction(String value) {
            this.direction = value;
            return this;
        }

        public Builder addLimit(LimitSlot limit) {
            limits.add(Objects.requireNonNull(limit, "limit"));
            return this;
        }

        public Builder addReport(ReportSlot report) {
            reports.add(Objects.requireNonNull(report, "report"));
            return this;
        }

        public Builder loop(int repeats, int target) {
            this.loopRepeat = repeats;
            this.loopTarget = target;
            return this;
        }

        public SequenceRecord build() {
            return new SequenceRecord(this);
        }
    }
}
