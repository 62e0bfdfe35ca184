package com.cyclerprotocol.biologic.plan;

import com.cyclerprotocol.biologic.compile.StepSequenceMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Output of the sizing pass: final sequence layout plus the per-loop and per-advance-cycle decisions. */
public final class ConversionPlan {
    private final StepSequenceMap sequenceMap;
    private final Map<Integer, LoopDecision> loopsByLoopStep;
    private final Map<Integer, AdvanceCycleDecision> advanceCyclesByStep;
    private final int totalSequences;

    ConversionPlan(
            StepSequenceMap sequenceMap,
            Map<Integer, LoopDecision> loopsByLoopStep,
            Map<Integer, AdvanceCycleDecision> advanceCyclesByStep,
            int totalSequences) {
        this.sequenceMap = sequenceMap;
        this.loopsByLoopStep = Collections.unmodifiableMap(new LinkedHashMap<>(loopsByLoopStep));
        this.advanceCyclesByStep = Collections.unmodifiableMap(new LinkedHashMap<>(advanceCyclesByStep));
        this.totalSequences = totalSequences;
    }

    public StepSequenceMap getSequenceMap() {
        return sequenceMap;
    }

    public LoopDecision loopDecision(int loopStep) {
        LoopDecision decision = loopsByLoopStep.get(loopStep);
        if (decision == null) {
            throw new IllegalStateException("No loop decision for step " + loopStep);
        }
        return decision;
    }

    public AdvanceCycleDecision advanceCycleDecision(int step) {
        AdvanceCycleDecision decision = advanceCyclesByStep.get(step);
        if (decision == null) {
            throw new IllegalStateException("No advance-cycle decision for step " + step);
        }
        return decision;
    }

    public int getTotalSequences() {
        return totalSequences;
    }
}
