package com.cyclerprotocol.biologic.plan;

import com.cyclerprotocol.biologic.ConversionException;
import com.cyclerprotocol.biologic.ErrorKind;
import com.cyclerprotocol.biologic.SequenceRecord;
import java.util.List;

/** Sequences the converter invents for Maccor control flow that has no physical counterpart. */
public final class SyntheticSequences {

    private SyntheticSequences() {}

    /** Loop sequence closing a natively emitted loop. */
    public static SequenceRecord nativeLoop(int index, int loopStart, int repeats) {
        return SequenceRecord.loop(index, loopStart, repeats);
    }

    /**
     * Modulo Bat has no advance-cycle sequence, but with {@code Cycle Definition : Loop} every completed loop counts
     * a cycle. A zero-repeat loop is passed straight over; the loop after it jumps back to it exactly once, which
     * bumps the cycle counter once and then falls through.
     */
    public static List<SequenceRecord> advanceCycle(int index, int stepNumber) throws ConversionException {
        if (index == 0) {
            // ctrl_seq must be non-negative and below Ns, impossible for sequence 0.
            throw new ConversionException(
                    ErrorKind.ADVANCE_CYCLE_AT_START,
                    stepNumber,
                    "Modulo Bat cannot advance the cycle number at sequence 0");
        }
        SequenceRecord blank = SequenceRecord.loop(index, index, 0);
        SequenceRecord advance = SequenceRecord.loop(index + 1, index, 1);
        return List.of(blank, advance);
    }
}
