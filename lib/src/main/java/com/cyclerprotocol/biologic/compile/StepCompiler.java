package com.cyclerprotocol.biologic.compile;

import com.cyclerprotocol.biologic.ConversionException;
import com.cyclerprotocol.biologic.ConversionMessage;
import com.cyclerprotocol.biologic.ErrorKind;
import com.cyclerprotocol.biologic.LimitComparator;
import com.cyclerprotocol.biologic.LimitSlot;
import com.cyclerprotocol.biologic.MeasuredQuantity;
import com.cyclerprotocol.biologic.RecordType;
import com.cyclerprotocol.biologic.ReportSlot;
import com.cyclerprotocol.biologic.SequenceFields;
import com.cyclerprotocol.biologic.SequenceRecord;
import com.cyclerprotocol.biologic.convert.ConvertedValue;
import com.cyclerprotocol.biologic.convert.MagnitudeConverter;
import com.cyclerprotocol.biologic.convert.TimeConverter;
import com.cyclerprotocol.procedure.Comparison;
import com.cyclerprotocol.procedure.ControlMode;
import com.cyclerprotocol.procedure.EndCondition;
import com.cyclerprotocol.procedure.ReportTrigger;
import com.cyclerprotocol.procedure.Step;
import com.cyclerprotocol.procedure.StepType;
import java.util.List;
import java.util.Objects;

/**
 * Turns one physical Maccor step (rest, charge or discharge) into one Modulo Bat sequence. Control-flow steps are the
 * planner's business and are rejected here.
 */
public final class StepCompiler {
    static final String REST_N = "1.00";
    static final String CONTROLLED_N = "15.00";
    static final String NO_REFERENCE = "<None>";
    static final String REFERENCE = "Ref";

    /**
     * @param goToLowerBound lowest step number a goto may target, the start of the enclosing loop
     * @param endStepNumber number of the End step, the highest valid goto target
     * @param messages receives non-fatal diagnostics
     */
    public SequenceRecord compile(
            Step step,
            StepSequenceMap sequenceMap,
            int goToLowerBound,
            int endStepNumber,
            List<ConversionMessage> messages)
            throws ConversionException {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(sequenceMap, "sequenceMap");
        int index = sequenceMap.sequenceOf(step.getNumber());
        SequenceRecord.Builder builder = startRecord(step, index);

        List<EndCondition> ends = step.getEndConditions();
        if (ends.size() > SequenceFields.MAX_SLOTS) {
            throw new ConversionException(
                    ErrorKind.TOO_MANY_LIMITS,
                    step.getNumber(),
                    ends.size() + " end entries, Modulo Bat allows " + SequenceFields.MAX_SLOTS
                            + "; remove limits from the source procedure");
        }
        for (EndCondition end : ends) {
            builder.addLimit(compileLimit(step, end, index, sequenceMap, goToLowerBound, endStepNumber, messages));
        }

        List<ReportTrigger> reports = step.getReports();
        if (reports.size() > SequenceFields.MAX_SLOTS) {
            throw new ConversionException(
                    ErrorKind.TOO_MANY_REPORTS,
                    step.getNumber(),
                    reports.size() + " report entries, Modulo Bat allows " + SequenceFields.MAX_SLOTS);
        }
        for (ReportTrigger report : reports) {
            builder.addReport(compileReport(step, report, messages));
        }
        return builder.build();
    }

    private static SequenceRecord.Builder startRecord(Step step, int index) throws ConversionException {
        switch (step.getType()) {
            case REST:
                // EC-Lab defaults this to the previous step's direction; it only matters when cycles advance on
                // charge/discharge alternance, which the emitted header never enables.
                return SequenceRecord.builder(index, RecordType.REST)
                        .appliedQuantity("I")
                        .nominalN(REST_N)
                        .direction(SequenceRecord.CHARGE);
            case CHARGE:
            case DISCHARGE:
                return startControlledRecord(step, index);
            default:
                throw new ConversionException(
                        ErrorKind.UNSUPPORTED_STEP, step.getNumber(), "unsupported step type " + step.getTypeLabel());
        }
    }

    private static SequenceRecord.Builder startControlledRecord(Step step, int index) throws ConversionException {
        RecordType type;
        String reference;
        if (step.getMode() == ControlMode.CURRENT) {
            type = RecordType.CONSTANT_CURRENT;
            reference = NO_REFERENCE;
        } else if (step.getMode() == ControlMode.VOLTAGE) {
            type = RecordType.CONSTANT_VOLTAGE;
            reference = REFERENCE;
        } else {
            throw new ConversionException(
                    ErrorKind.UNSUPPORTED_STEP,
                    step.getNumber(),
                    "unsupported " + step.getTypeLabel() + " mode " + step.getModeLabel());
        }
        // Voltage-mode values go through the current ladder as well; Maccor exports seen so far agree with that.
        // TODO: confirm against an EC-Lab CV export whether ctrl1_val should use the voltage ladder instead.
        ConvertedValue control;
        try {
            control = MagnitudeConverter.amps(step.getValue());
        } catch (NumberFormatException ex) {
            throw new ConversionException(
                    ErrorKind.UNSUPPORTED_STEP,
                    step.getNumber(),
                    "control value " + step.getValue() + " is not a number");
        }
        return SequenceRecord.builder(index, type)
                .appliedQuantity("C / N")
                .control(control.value(), control.unit(), reference)
                .nominalN(CONTROLLED_N)
                .direction(step.getType() == StepType.CHARGE
                        ? SequenceRecord.CHARGE
                        : SequenceRecord.DISCHARGE);
    }

    private static LimitSlot compileLimit(
            Step step,
            EndCondition end,
            int index,
            StepSequenceMap sequenceMap,
            int goToLowerBound,
            int endStepNumber,
            List<ConversionMessage> messages)
            throws ConversionException {
        int target = end.getGotoStep();
        if (target < goToLowerBound || target > endStepNumber) {
            throw new ConversionException(
                    ErrorKind.GOTO_OUTSIDE_LOOP,
                    step.getNumber(),
                    "goto step " + target + " could break loop nesting; allowed range is "
                            + goToLowerBound + ".." + endStepNumber);
        }
        int gotoIndex = sequenceMap.gotoTargetOf(target);
        boolean jump = gotoIndex != index + 1;

        MeasuredQuantity quantity;
        LimitComparator comparator;
        ConvertedValue value;
        try {
            switch (end.getKind()) {
                case STEP_TIME:
                    if (end.getComparison() != Comparison.EQUAL) {
                        throw unsupportedEnd(step, end);
                    }
                    // Maccor's "StepTime = t" fires once t has elapsed; the closest strict comparator is '>'.
                    quantity = MeasuredQuantity.TIME;
                    comparator = LimitComparator.GREATER;
                    value = TimeConverter.convert(end.getValue());
                    break;
                case VOLTAGE:
                    quantity = MeasuredQuantity.VOLTAGE;
                    comparator = strictComparator(step, end);
                    value = MagnitudeConverter.volts(end.getValue());
                    break;
                case CURRENT:
                    quantity = MeasuredQuantity.CURRENT;
                    comparator = strictComparator(step, end);
                    value = MagnitudeConverter.amps(end.getValue());
                    break;
                default:
                    throw unsupportedEnd(step, end);
            }
        } catch (NumberFormatException ex) {
            throw new ConversionException(
                    ErrorKind.UNSUPPORTED_END_CONDITION,
                    step.getNumber(),
                    "end entry value " + end.getValue() + " is malformed: " + ex.getMessage());
        }
        notePrecisionLoss(step, value, messages);
        return new LimitSlot(quantity, comparator, value.value(), value.unit(), gotoIndex, jump);
    }

    /** Modulo Bat has no inclusive comparators; on floating-point readings the strict ones behave the same. */
    private static LimitComparator strictComparator(Step step, EndCondition end) throws ConversionException {
        switch (end.getComparison()) {
            case GREATER_OR_EQUAL:
                return LimitComparator.GREATER;
            case LESS_OR_EQUAL:
                return LimitComparator.LESS;
            default:
                throw unsupportedEnd(step, end);
        }
    }

    private static ConversionException unsupportedEnd(Step step, EndCondition end) {
        return new ConversionException(
                ErrorKind.UNSUPPORTED_END_CONDITION,
                step.getNumber(),
                "unsupported end entry " + end.getKindLabel() + " " + end.getComparisonLabel());
    }

    private static ReportSlot compileReport(Step step, ReportTrigger report, List<ConversionMessage> messages)
            throws ConversionException {
        MeasuredQuantity quantity;
        ConvertedValue value;
        try {
            switch (report.getKind()) {
                case STEP_TIME:
                    quantity = MeasuredQuantity.TIME;
                    value = TimeConverter.convert(report.getValue());
                    break;
                case VOLTAGE:
                    quantity = MeasuredQuantity.VOLTAGE;
                    value = MagnitudeConverter.volts(report.getValue());
                    break;
                case CURRENT:
                    quantity = MeasuredQuantity.CURRENT;
                    value = MagnitudeConverter.amps(report.getValue());
                    break;
                default:
                    throw new ConversionException(
                            ErrorKind.UNSUPPORTED_REPORT_TYPE,
                            step.getNumber(),
                            "unsupported report type " + report.getKindLabel());
            }
        } catch (NumberFormatException ex) {
            throw new ConversionException(
                    ErrorKind.UNSUPPORTED_REPORT_TYPE,
                    step.getNumber(),
                    "report value " + report.getValue() + " is malformed: " + ex.getMessage());
        }
        notePrecisionLoss(step, value, messages);
        return new ReportSlot(quantity, value.value(), value.unit());
    }

    private static void notePrecisionLoss(Step step, ConvertedValue value, List<ConversionMessage> messages) {
        if (value.precisionLost()) {
            messages.add(
                    new ConversionMessage(
                            ConversionMessage.Level.INFO,
                            step.getNumber(),
                            "time rounded to " + value.value() + " " + value.unit()));
        }
    }
}
