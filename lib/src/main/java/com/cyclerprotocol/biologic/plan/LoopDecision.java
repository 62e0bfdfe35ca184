package com.cyclerprotocol.biologic.plan;

import java.util.Locale;

/**
 * How a single {@code Do ... Loop} pair is emitted. Decided once while sizing and followed verbatim while generating.
 */
public final class LoopDecision {

    public enum Strategy {
        /** Body once, followed by a Modulo Bat loop sequence. */
        NATIVE,
        /** Body physically repeated {@code repeats + 1} times. */
        UNROLLED
    }

    private final Strategy strategy;
    private final int doStep;
    private final int loopStep;
    private final int bodySize;
    private final int repeats;

    private LoopDecision(Strategy strategy, int doStep, int loopStep, int bodySize, int repeats) {
        this.strategy = strategy;
        this.doStep = doStep;
        this.loopStep = loopStep;
        this.bodySize = bodySize;
        this.repeats = repeats;
    }

    public static LoopDecision nativeLoop(int doStep, int loopStep, int bodySize, int repeats) {
        return new LoopDecision(Strategy.NATIVE, doStep, loopStep, bodySize, repeats);
    }

    public static LoopDecision unrolled(int doStep, int loopStep, int bodySize, int repeats) {
        return new LoopDecision(Strategy.UNROLLED, doStep, loopStep, bodySize, repeats);
    }

    public boolean isUnrolled() {
        return strategy == Strategy.UNROLLED;
    }

    public int getDoStep() {
        return doStep;
    }

    /** Sequences one pass through the body emits, loop sequence excluded. */
    public int getBodySize() {
        return bodySize;
    }

    public int getRepeats() {
        return repeats;
    }

    /** Sequences the whole construct occupies in the output. */
    public int emittedSize() {
        return isUnrolled() ? bodySize * (repeats + 1) : bodySize + 1;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "%s loop steps %d..%d body=%d repeats=%d",
                strategy,
                doStep,
                loopStep,
                bodySize,
                repeats);
    }
}
