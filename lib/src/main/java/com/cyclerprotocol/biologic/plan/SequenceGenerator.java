package com.cyclerprotocol.biologic.plan;

import com.cyclerprotocol.biologic.ConversionException;
import com.cyclerprotocol.biologic.ConversionMessage;
import com.cyclerprotocol.biologic.SequenceRecord;
import com.cyclerprotocol.biologic.compile.StepCompiler;
import com.cyclerprotocol.biologic.compile.StepSequenceMap;
import com.cyclerprotocol.procedure.Procedure;
import com.cyclerprotocol.procedure.Step;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generation pass. Replays the procedure against a finished {@link ConversionPlan}, compiling physical steps and
 * emitting loop and advance-cycle sequences exactly as planned.
 */
public final class SequenceGenerator {
    private static final Logger LOGGER = Logger.getLogger(SequenceGenerator.class.getName());

    private final StepCompiler compiler;

    public SequenceGenerator(StepCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public SequenceGenerator() {
        this(new StepCompiler());
    }

    public List<SequenceRecord> generate(Procedure procedure, ConversionPlan plan, List<ConversionMessage> messages)
            throws ConversionException {
        Objects.requireNonNull(procedure, "procedure");
        Objects.requireNonNull(plan, "plan");
        StepSequenceMap sequenceMap = plan.getSequenceMap();
        int endStep = procedure.endStepNumber();
        List<Step> steps = procedure.getSteps();

        Deque<List<SequenceRecord>> bodies = new ArrayDeque<>();
        bodies.push(new ArrayList<>());
        Deque<Integer> loopStarts = new ArrayDeque<>();
        // Gotos may not leave the innermost loop entered so far.
        int goToLowerBound = 0;

        for (Step step : steps.subList(0, steps.size() - 1)) {
            int number = step.getNumber();
            int index = sequenceMap.sequenceOf(number);
            switch (step.getType()) {
                case DO:
                    goToLowerBound = number;
                    bodies.push(new ArrayList<>());
                    loopStarts.push(index);
                    break;
                case LOOP:
                    goToLowerBound = number;
                    int loopStart = loopStarts.pop();
                    LoopDecision decision = plan.loopDecision(number);
                    List<SequenceRecord> body = bodies.pop();
                    if (decision.isUnrolled()) {
                        body = LoopUnroller.unroll(body, decision.getRepeats(), loopStart, index);
                        LOGGER.log(
                                Level.FINE,
                                "loop ending at step {0} unrolled to {1} sequences",
                                new Object[] {number, body.size()});
                    } else {
                        body.add(SyntheticSequences.nativeLoop(index, loopStart, decision.getRepeats()));
                    }
                    bodies.peek().addAll(body);
                    break;
                case ADVANCE_CYCLE:
                    if (plan.advanceCycleDecision(number) == AdvanceCycleDecision.SYNTHESIZED) {
                        goToLowerBound = number;
                        bodies.peek().addAll(SyntheticSequences.advanceCycle(index, number));
                    }
                    break;
                default:
                    bodies.peek().add(compiler.compile(step, sequenceMap, goToLowerBound, endStep, messages));
                    break;
            }
        }

        if (bodies.size() != 1) {
            throw new IllegalStateException("Loop nesting left open after generation");
        }
        List<SequenceRecord> sequences = bodies.pop();
        if (sequences.size() != plan.getTotalSequences()) {
            throw new IllegalStateException(
                    "Generated " + sequences.size() + " sequences, sizing planned " + plan.getTotalSequences());
        }
        for (int i = 0; i < sequences.size(); i++) {
            if (sequences.get(i).getIndex() != i) {
                throw new IllegalStateException(
                        "Sequence at position " + i + " carries index " + sequences.get(i).getIndex());
            }
        }
        LOGGER.log(Level.FINE, "conversion created {0} sequences", sequences.size());
        return sequences;
    }
}
