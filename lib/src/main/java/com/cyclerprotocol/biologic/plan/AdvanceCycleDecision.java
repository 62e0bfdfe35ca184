package com.cyclerprotocol.biologic.plan;

public enum AdvanceCycleDecision {
    /**
     * Last action of a natively emitted loop. With {@code Cycle Definition : Loop} the loop sequence itself advances
     * the cycle counter, so nothing is emitted.
     */
    ABSORBED_BY_LOOP,
    /** Emitted as the two-sequence blank-loop construct. */
    SYNTHESIZED
}
