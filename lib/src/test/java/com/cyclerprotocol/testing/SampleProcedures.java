package com.cyclerprotocol.testing;

import com.cyclerprotocol.procedure.Comparison;
import com.cyclerprotocol.procedure.ControlMode;
import com.cyclerprotocol.procedure.EndCondition;
import com.cyclerprotocol.procedure.EndConditionKind;
import com.cyclerprotocol.procedure.Procedure;
import java.util.List;

/** Small procedures shared by the planner, generator and converter tests. */
public final class SampleProcedures {

    private SampleProcedures() {}

    public static EndCondition afterSeconds(int seconds, int gotoStep) {
        return EndCondition.of(EndConditionKind.STEP_TIME, Comparison.EQUAL, "0:0:" + seconds, gotoStep);
    }

    public static EndCondition voltageAtLeast(String volts, int gotoStep) {
        return EndCondition.of(EndConditionKind.VOLTAGE, Comparison.GREATER_OR_EQUAL, volts, gotoStep);
    }

    public static EndCondition voltageAtMost(String volts, int gotoStep) {
        return EndCondition.of(EndConditionKind.VOLTAGE, Comparison.LESS_OR_EQUAL, volts, gotoStep);
    }

    /**
     * Rest, then a loop whose body is a charge followed by AdvCycle. Fits a native loop: 3 sequences.
     *
     * <pre>
     * 1 Rest  2 Do 1  3 Charge  4 AdvCycle  5 Loop 1 (x3)  6 End
     * </pre>
     */
    public static Procedure nativeLoop() {
        return Procedure.builder()
                .sourceName("native-loop")
                .rest(List.of(afterSeconds(10, 2)), List.of())
                .doLoop()
                .charge(ControlMode.CURRENT, "1.5", List.of(voltageAtLeast("4.2", 4)), List.of())
                .advanceCycle()
                .loop(3)
                .end()
                .build();
    }

    /**
     * Loop body ends in a rest instead of AdvCycle, so it has to be unrolled: 1 + 2 * 3 sequences.
     *
     * <pre>
     * 1 Rest  2 Do 1  3 Charge  4 Rest  5 Loop 1 (x2)  6 End
     * </pre>
     */
    public static Procedure restEndsLoop() {
        return Procedure.builder()
                .sourceName("rest-ends-loop")
                .rest(List.of(afterSeconds(10, 2)), List.of())
                .doLoop()
                .charge(ControlMode.CURRENT, "1.5", List.of(voltageAtLeast("4.2", 4)), List.of())
                .rest(List.of(afterSeconds(5, 5)), List.of())
                .loop(2)
                .end()
                .build();
    }

    /**
     * AdvCycle outside any loop, emitted as the two-sequence construct.
     *
     * <pre>
     * 1 Rest  2 AdvCycle  3 Charge  4 End
     * </pre>
     */
    public static Procedure standaloneAdvanceCycle() {
        return Procedure.builder()
                .sourceName("standalone-advance-cycle")
                .rest(List.of(afterSeconds(10, 2)), List.of())
                .advanceCycle()
                .charge(ControlMode.CURRENT, "1.5", List.of(voltageAtLeast("4.2", 4)), List.of())
                .end()
                .build();
    }

    /**
     * A native inner loop nested in an outer loop that has to unroll.
     *
     * <pre>
     * 1 Rest  2 Do 1  3 Do 2  4 Charge  5 AdvCycle  6 Loop 2 (x1)  7 AdvCycle  8 Loop 1 (x2)  9 End
     * </pre>
     */
    public static Procedure nestedLoops() {
        return Procedure.builder()
                .sourceName("nested-loops")
                .rest(List.of(afterSeconds(10, 2)), List.of())
                .doLoop()
                .doLoop()
                .charge(ControlMode.CURRENT, "1.5", List.of(voltageAtLeast("4.2", 5)), List.of())
                .advanceCycle()
                .loop(1)
                .advanceCycle()
                .loop(2)
                .end()
                .build();
    }
}
