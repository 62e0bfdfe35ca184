package com.cyclerprotocol.procedure;

import java.util.Locale;

public enum ControlMode {
    CURRENT,
    VOLTAGE,
    POWER,
    RESISTANCE,
    UNSUPPORTED;

    /** Returns {@code null} for a blank label; rest and control-flow steps carry no mode. */
    public static ControlMode fromSource(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "current":
                return CURRENT;
            case "voltage":
                return VOLTAGE;
            case "power":
                return POWER;
            case "resistance":
                return RESISTANCE;
            default:
                return UNSUPPORTED;
        }
    }
}
