package com.cyclerprotocol.biologic;

import java.util.Objects;

/**
 * Checked exception signalling that a Maccor procedure cannot be expressed as a Biologic Modulo Bat procedure. There
 * is no partial output: the conversion that throws this produced nothing usable.
 */
public final class ConversionException extends Exception {
    /** Step number used when the failure is not tied to a source step. */
    public static final int NO_STEP = -1;

    private final ErrorKind kind;
    private final int stepNumber;

    public ConversionException(ErrorKind kind, int stepNumber, String message) {
        super(Objects.requireNonNull(kind, "kind") + (stepNumber == NO_STEP ? "" : " at step " + stepNumber) + ": " + message);
        this.kind = kind;
        this.stepNumber = stepNumber;
    }

    public ConversionException(ErrorKind kind, String message) {
        this(kind, NO_STEP, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorKind.Category getCategory() {
        return kind.getCategory();
    }

    /** Offending source step, or {@link #NO_STEP}. */
    public int getStepNumber() {
        return stepNumber;
    }
}
