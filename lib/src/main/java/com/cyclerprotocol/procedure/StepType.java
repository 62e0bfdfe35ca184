package com.cyclerprotocol.procedure;

import java.util.Locale;

/** Kinds of Maccor test steps. Control-flow steps carry no physical action of their own. */
public enum StepType {
    REST,
    CHARGE,
    DISCHARGE,
    DO,
    LOOP,
    ADVANCE_CYCLE,
    END,
    /** A source step type the Biologic format has no counterpart for. */
    UNSUPPORTED;

    /**
     * Maps a Maccor {@code StepType} label. Maccor spells discharge as {@code Dischrge} and numbers
     * its loop markers ({@code Do 1}, {@code Loop 1}).
     */
    public static StepType fromSource(String label) {
        if (label == null) {
            return UNSUPPORTED;
        }
        String trimmed = label.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("rest")) {
            return REST;
        }
        if (lower.equals("charge")) {
            return CHARGE;
        }
        if (lower.equals("dischrge") || lower.equals("discharge")) {
            return DISCHARGE;
        }
        if (lower.equals("advcycle")) {
            return ADVANCE_CYCLE;
        }
        if (lower.equals("end")) {
            return END;
        }
        if (lower.startsWith("do")) {
            return isLoopMarker(lower.substring(2)) ? DO : UNSUPPORTED;
        }
        if (lower.startsWith("loop")) {
            return isLoopMarker(lower.substring(4)) ? LOOP : UNSUPPORTED;
        }
        return UNSUPPORTED;
    }

    private static boolean isLoopMarker(String suffix) {
        return suffix.trim().chars().allMatch(Character::isDigit);
    }
}
