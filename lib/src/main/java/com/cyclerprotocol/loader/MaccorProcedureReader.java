package com.cyclerprotocol.loader;

import com.cyclerprotocol.loader.ast.XmlElementNode;
import com.cyclerprotocol.procedure.Comparison;
import com.cyclerprotocol.procedure.ControlMode;
import com.cyclerprotocol.procedure.EndCondition;
import com.cyclerprotocol.procedure.EndConditionKind;
import com.cyclerprotocol.procedure.Procedure;
import com.cyclerprotocol.procedure.ReportKind;
import com.cyclerprotocol.procedure.ReportTrigger;
import com.cyclerprotocol.procedure.Step;
import com.cyclerprotocol.procedure.StepType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps the {@code MaccorTestProcedure/ProcSteps/TestStep} elements of a parsed document onto a {@link Procedure}.
 * Unknown step types, modes and end kinds are kept as {@code UNSUPPORTED} with their source label so the converter
 * can report them against the right step.
 */
public final class MaccorProcedureReader {
    static final String ROOT = "MaccorTestProcedure";
    static final String PROC_STEPS = "ProcSteps";
    static final String TEST_STEP = "TestStep";

    public Procedure read(String sourceName, XmlElementNode root) throws ProcedureParseException {
        Objects.requireNonNull(root, "root");
        if (!ROOT.equals(root.getName())) {
            throw new ProcedureParseException(
                    sourceName, "expected <" + ROOT + "> document element, found <" + root.getName() + ">");
        }
        XmlElementNode procSteps = root.child(PROC_STEPS);
        if (procSteps == null) {
            throw new ProcedureParseException(sourceName, "could not find " + ROOT + "/" + PROC_STEPS);
        }
        List<XmlElementNode> testSteps = procSteps.children(TEST_STEP);
        if (testSteps.isEmpty()) {
            throw new ProcedureParseException(sourceName, PROC_STEPS + " contains no " + TEST_STEP);
        }

        List<Step> steps = new ArrayList<>();
        for (XmlElementNode testStep : testSteps) {
            steps.add(readStep(sourceName, steps.size() + 1, testStep, testSteps.size()));
        }
        if (steps.get(steps.size() - 1).getType() != StepType.END) {
            throw new ProcedureParseException(sourceName, "the last TestStep must be an End step");
        }
        return new Procedure(sourceName, steps);
    }

    private Step readStep(String sourceName, int number, XmlElementNode testStep, int stepCount)
            throws ProcedureParseException {
        String typeLabel = textOrEmpty(testStep.childText("StepType"));
        String modeLabel = textOrEmpty(testStep.childText("StepMode"));
        String value = testStep.childText("StepValue");

        List<EndCondition> ends = new ArrayList<>();
        XmlElementNode endsNode = testStep.child("Ends");
        if (endsNode != null) {
            for (XmlElementNode entry : endsNode.children("EndEntry")) {
                ends.add(readEndEntry(sourceName, number, entry, stepCount));
            }
        }

        List<ReportTrigger> reports = new ArrayList<>();
        XmlElementNode reportsNode = testStep.child("Reports");
        if (reportsNode != null) {
            for (XmlElementNode entry : reportsNode.children("ReportEntry")) {
                String kindLabel = textOrEmpty(entry.childText("ReportType"));
                reports.add(
                        new ReportTrigger(ReportKind.fromSource(kindLabel), kindLabel, entry.childText("Value")));
            }
        }

        return new Step(
                number,
                StepType.fromSource(typeLabel),
                typeLabel,
                ControlMode.fromSource(modeLabel),
                modeLabel,
                value == null || value.isEmpty() ? null : value,
                ends,
                reports);
    }

    private EndCondition readEndEntry(String sourceName, int number, XmlElementNode entry, int stepCount)
            throws ProcedureParseException {
        String kindLabel = textOrEmpty(entry.childText("EndType"));
        String operator = textOrEmpty(entry.childText("Oper"));
        int gotoStep = gotoStep(sourceName, number, entry, stepCount);
        return new EndCondition(
                EndConditionKind.fromSource(kindLabel),
                kindLabel,
                Comparison.fromSource(operator),
                operator,
                entry.childText("Value"),
                gotoStep);
    }

    /** Maccor writes goto targets zero-padded ({@code 002}); a blank target means the following step. */
    private static int gotoStep(String sourceName, int number, XmlElementNode entry, int stepCount)
            throws ProcedureParseException {
        String text = textOrEmpty(entry.childText("Step"));
        if (text.isEmpty()) {
            return Math.min(number + 1, stepCount);
        }
        int target;
        try {
            target = Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new ProcedureParseException(
                    sourceName,
                    "step " + number + " EndEntry at " + entry.location() + " has goto step '" + text + "'",
                    ex);
        }
        if (target < 1 || target > stepCount) {
            throw new ProcedureParseException(
                    sourceName,
                    "step " + number + " EndEntry at " + entry.location() + " jumps to step " + target + " of "
                            + stepCount);
        }
        return target;
    }

    private static String textOrEmpty(String text) {
        return text == null ? "" : text;
    }
}
