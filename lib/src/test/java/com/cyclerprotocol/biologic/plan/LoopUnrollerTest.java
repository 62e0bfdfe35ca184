package com.cyclerprotocol.biologic.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cyclerprotocol.biologic.LimitComparator;
import com.cyclerprotocol.biologic.LimitSlot;
import com.cyclerprotocol.biologic.MeasuredQuantity;
import com.cyclerprotocol.biologic.RecordType;
import com.cyclerprotocol.biologic.SequenceRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoopUnrollerTest {

    private static SequenceRecord rest(int index, int gotoIndex) {
        return SequenceRecord.builder(index, RecordType.REST)
                .addLimit(
                        new LimitSlot(
                                MeasuredQuantity.TIME, LimitComparator.GREATER, "1.000", "s", gotoIndex,
                                gotoIndex != index + 1))
                .build();
    }

    @Test
    void producesBodyTimesRepeatsPlusOne() {
        List<SequenceRecord> body = List.of(rest(2, 3), rest(3, 4));

        List<SequenceRecord> unrolled = LoopUnroller.unroll(body, 3, 2, 4);

        assertEquals(8, unrolled.size());
        assertSame(body.get(0), unrolled.get(0));
        assertEquals(9, unrolled.get(7).getIndex());
        assertEquals(10, unrolled.get(7).getLimits().get(0).getGotoIndex());
    }

    @Test
    void targetsOutsideTheLoopStayPut() {
        List<SequenceRecord> body = List.of(rest(2, 9999), rest(3, 0));

        List<SequenceRecord> unrolled = LoopUnroller.unroll(body, 1, 2, 4);

        assertEquals(9999, unrolled.get(2).getLimits().get(0).getGotoIndex());
        assertEquals(0, unrolled.get(3).getLimits().get(0).getGotoIndex());
    }

    @Test
    void copyLandingBeforeAnOutsideTargetNoLongerJumps() {
        // Body 1..2 exits to sequence 3, which follows the last copy.
        List<SequenceRecord> body = List.of(rest(1, 3));

        List<SequenceRecord> unrolled = LoopUnroller.unroll(body, 1, 1, 2);

        assertTrue(unrolled.get(0).getLimits().get(0).isJump());
        LimitSlot copied = unrolled.get(1).getLimits().get(0);
        assertEquals(2, unrolled.get(1).getIndex());
        assertEquals(3, copied.getGotoIndex());
        assertFalse(copied.isJump());
    }

    @Test
    void shiftedTargetsKeepTheirJumpFlag() {
        List<SequenceRecord> body = List.of(rest(2, 2), rest(3, 4));

        List<SequenceRecord> unrolled = LoopUnroller.unroll(body, 1, 2, 4);

        assertTrue(unrolled.get(2).getLimits().get(0).isJump());
        assertFalse(unrolled.get(3).getLimits().get(0).isJump());
    }

    @Test
    void innerLoopTargetsMoveWithTheCopy() {
        List<SequenceRecord> body = List.of(rest(1, 2), SequenceRecord.loop(2, 1, 4));

        List<SequenceRecord> unrolled = LoopUnroller.unroll(body, 1, 1, 3);

        assertEquals(SequenceRecord.loop(4, 3, 4), unrolled.get(3));
    }

    @Test
    void zeroRepeatsKeepsTheBody() {
        List<SequenceRecord> body = List.of(rest(0, 1));

        assertEquals(body, LoopUnroller.unroll(body, 0, 0, 1));
    }

    @Test
    void rejectsNegativeRepeats() {
        assertThrows(IllegalArgumentException.class, () -> LoopUnroller.unroll(List.of(rest(0, 1)), -1, 0, 1));
    }
}
