package com.cyclerprotocol.biologic.plan;

import com.cyclerprotocol.biologic.ConversionException;
import com.cyclerprotocol.biologic.ErrorKind;
import com.cyclerprotocol.biologic.SequenceRecord;
import com.cyclerprotocol.biologic.compile.StepSequenceMap;
import com.cyclerprotocol.biologic.convert.DecimalText;
import com.cyclerprotocol.procedure.EndCondition;
import com.cyclerprotocol.procedure.EndConditionKind;
import com.cyclerprotocol.procedure.Procedure;
import com.cyclerprotocol.procedure.Step;
import com.cyclerprotocol.procedure.StepType;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sizing pass. Walks the procedure once, assigning every step the sequence index its output starts at and deciding for
 * each loop whether Modulo Bat's native loop can express it or the body has to be unrolled. Nothing is emitted here;
 * {@link SequenceGenerator} needs the finished layout before it can resolve any goto.
 */
public final class ControlFlowPlanner {
    static final int SYNTHETIC_ADVANCE_CYCLE_SIZE = 2;

    private static final class LoopContext {
        private final int doStep;
        private int sequenceCount;
        private boolean willUnroll;

        LoopContext(int doStep) {
            this.doStep = doStep;
        }
    }

    public ConversionPlan plan(Procedure procedure) throws ConversionException {
        Objects.requireNonNull(procedure, "procedure");
        List<Step> steps = procedure.getSteps();
        if (steps.isEmpty() || steps.get(steps.size() - 1).getType() != StepType.END) {
            throw new IllegalArgumentException("Procedure " + procedure.getSourceName() + " must finish with an End step");
        }
        int endStep = procedure.endStepNumber();

        Map<Integer, Integer> sequenceByStep = new LinkedHashMap<>();
        sequenceByStep.put(endStep, SequenceRecord.END_OF_PROCEDURE);
        Map<Integer, LoopDecision> loops = new LinkedHashMap<>();
        Map<Integer, AdvanceCycleDecision> advanceCycles = new LinkedHashMap<>();

        Deque<LoopContext> contexts = new ArrayDeque<>();
        contexts.push(new LoopContext(0));
        int nextSequence = 0;

        for (Step step : steps.subList(0, steps.size() - 1)) {
            int number = step.getNumber();
            sequenceByStep.put(number, nextSequence);
            boolean lastInLoop = procedure.step(number + 1).getType() == StepType.LOOP;
            LoopContext current = contexts.peek();

            switch (step.getType()) {
                case DO:
                    // A loop inside a loop cannot be a single native loop, so the enclosing level unrolls.
                    current.willUnroll = true;
                    contexts.push(new LoopContext(number));
                    break;
                case ADVANCE_CYCLE:
                    // Absorbing needs a body for the native loop to point back at.
                    if (lastInLoop && !current.willUnroll && current.sequenceCount > 0) {
                        advanceCycles.put(number, AdvanceCycleDecision.ABSORBED_BY_LOOP);
                    } else {
                        current.willUnroll = true;
                        advanceCycles.put(number, AdvanceCycleDecision.SYNTHESIZED);
                        current.sequenceCount += SYNTHETIC_ADVANCE_CYCLE_SIZE;
                        nextSequence += SYNTHETIC_ADVANCE_CYCLE_SIZE;
                    }
                    break;
                case LOOP:
                    if (contexts.size() == 1) {
                        throw new ConversionException(
                                ErrorKind.UNBALANCED_LOOP, number, "Loop step without a matching Do step");
                    }
                    int repeats = repeatCount(step);
                    contexts.pop();
                    // An empty body unrolls to nothing rather than a loop pointing at itself.
                    LoopDecision decision =
                            current.willUnroll || current.sequenceCount == 0
                                    ? LoopDecision.unrolled(current.doStep, number, current.sequenceCount, repeats)
                                    : LoopDecision.nativeLoop(current.doStep, number, current.sequenceCount, repeats);
                    loops.put(number, decision);
                    nextSequence += decision.emittedSize() - current.sequenceCount;
                    contexts.peek().sequenceCount += decision.emittedSize();
                    break;
                default:
                    if (lastInLoop) {
                        // The native loop emulation relies on the body ending in an advance cycle.
                        current.willUnroll = true;
                    }
                    current.sequenceCount += 1;
                    nextSequence += 1;
                    break;
            }
        }

        if (contexts.size() != 1) {
            throw new ConversionException(
                    ErrorKind.UNBALANCED_LOOP, contexts.peek().doStep, "Do step is never closed by a Loop step");
        }
        int planned = contexts.pop().sequenceCount;
        if (planned != nextSequence) {
            throw new IllegalStateException(
                    "Sizing disagreement: " + planned + " sequences counted per loop level, " + nextSequence + " in total");
        }
        return new ConversionPlan(
                new StepSequenceMap(sequenceByStep, nextSequence), loops, advanceCycles, nextSequence);
    }

    static int repeatCount(Step loopStep) throws ConversionException {
        EndCondition count =
                loopStep.findEndCondition(EndConditionKind.LOOP_COUNT)
                        .orElseThrow(
                                () ->
                                        new ConversionException(
                                                ErrorKind.MISSING_LOOP_COUNT,
                                                loopStep.getNumber(),
                                                "Loop step has no Loop Cnt end entry"));
        try {
            BigDecimal value = DecimalText.parse(count.getValue());
            if (value == null || value.signum() < 0) {
                throw new NumberFormatException("negative or blank");
            }
            return value.intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new ConversionException(
                    ErrorKind.MISSING_LOOP_COUNT,
                    loopStep.getNumber(),
                    "Loop Cnt value " + count.getValue() + " is not a repeat count");
        }
    }
}
