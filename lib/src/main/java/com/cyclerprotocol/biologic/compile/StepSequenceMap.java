package com.cyclerprotocol.biologic.compile;

import com.cyclerprotocol.biologic.SequenceRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sequence index at which each source step's output begins. Steps absorbed into a loop or advance-cycle construct
 * share the index of whatever follows them. The End step maps to {@link SequenceRecord#END_OF_PROCEDURE}.
 */
public final class StepSequenceMap {
    private final Map<Integer, Integer> sequenceByStep;
    private final int sequenceCount;

    /**
     * @param sequenceCount number of sequences the layout emits; a step placed at this index emits nothing and is
     *     followed only by the end of the procedure
     */
    public StepSequenceMap(Map<Integer, Integer> sequenceByStep, int sequenceCount) {
        this.sequenceByStep = Collections.unmodifiableMap(new LinkedHashMap<>(sequenceByStep));
        this.sequenceCount = sequenceCount;
    }

    public int sequenceOf(int stepNumber) {
        Integer sequence = sequenceByStep.get(stepNumber);
        if (sequence == null) {
            throw new IllegalStateException("No sequence assigned to step " + stepNumber);
        }
        return sequence;
    }

    /** Index a limit jumping to {@code stepNumber} must name. */
    public int gotoTargetOf(int stepNumber) {
        int sequence = sequenceOf(stepNumber);
        return sequence >= sequenceCount ? SequenceRecord.END_OF_PROCEDURE : sequence;
    }

    @Override
    public String toString() {
        return sequenceByStep.toString();
    }
}
