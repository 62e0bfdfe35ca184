package com.cyclerprotocol.biologic.plan;

import com.cyclerprotocol.biologic.SequenceRecord;
import java.util.ArrayList;
import java.util.List;

/** Replaces a loop by physical copies of its body. */
public final class LoopUnroller {

    private LoopUnroller() {}

    /**
     * Returns the body followed by {@code repeats} shifted copies, {@code body.size() * (repeats + 1)} sequences in
     * all. In copy {@code i}, targets inside {@code [loopStart, loopEnd]} move by {@code i * body.size()}; targets
     * outside stay put.
     *
     * @param loopStart index of the first body sequence
     * @param loopEnd index directly after the body, where the loop sequence would have gone
     */
    public static List<SequenceRecord> unroll(List<SequenceRecord> body, int repeats, int loopStart, int loopEnd) {
        if (repeats < 0) {
            throw new IllegalArgumentException("Negative repeat count: " + repeats);
        }
        int length = body.size();
        List<SequenceRecord> unrolled = new ArrayList<>(length * (repeats + 1));
        unrolled.addAll(body);
        for (int copy = 1; copy <= repeats; copy++) {
            int offset = length * copy;
            for (SequenceRecord record : body) {
                unrolled.add(record.withIndexShift(offset, loopStart, loopEnd));
            }
        }
        if (unrolled.size() != length * (repeats + 1)) {
            throw new IllegalStateException("Unrolled loop has " + unrolled.size() + " sequences");
        }
        return unrolled;
    }
}
