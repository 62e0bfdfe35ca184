package com.cyclerprotocol.procedure;

import java.util.Locale;

public enum EndConditionKind {
    STEP_TIME,
    VOLTAGE,
    CURRENT,
    LOOP_COUNT,
    UNSUPPORTED;

    public static EndConditionKind fromSource(String label) {
        if (label == null) {
            return UNSUPPORTED;
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "steptime":
                return STEP_TIME;
            case "voltage":
                return VOLTAGE;
            case "current":
                return CURRENT;
            case "loop cnt":
                return LOOP_COUNT;
            default:
                return UNSUPPORTED;
        }
    }
}
