package com.cyclerprotocol.procedure;

import java.util.Locale;

public enum ReportKind {
    STEP_TIME,
    VOLTAGE,
    CURRENT,
    UNSUPPORTED;

    public static ReportKind fromSource(String label) {
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
            default:
                return UNSUPPORTED;
        }
    }
}
