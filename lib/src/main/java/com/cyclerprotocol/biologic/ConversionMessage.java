package com.cyclerprotocol.biologic;

/** A non-fatal diagnostic produced while converting; the conversion continues with a degraded value. */
public final class ConversionMessage {

    public enum Level {
        INFO,
        WARNING
    }

    private final Level level;
    private final int stepNumber;
    private final String message;

    public ConversionMessage(Level level, int stepNumber, String message) {
        this.level = level;
        this.stepNumber = stepNumber;
        this.message = message;
    }

    public Level getLevel() {
        return level;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return level + " step " + stepNumber + ": " + message;
    }
}
