package com.cyclerprotocol.biologic;

import java.util.Locale;

/** Column names of the Modulo Bat sequence table that the converter writes explicitly. */
public final class SequenceFields {
    public static final String NS = "Ns";
    public static final String CTRL_TYPE = "ctrl_type";
    public static final String APPLY_I_C = "Apply I/C";
    public static final String CTRL1_VAL = "ctrl1_val";
    public static final String CTRL1_VAL_UNIT = "ctrl1_val_unit";
    public static final String CTRL1_VAL_VS = "ctrl1_val_vs";
    public static final String N = "N";
    public static final String CHARGE_DISCHARGE = "charge/discharge";
    public static final String CTRL_SEQ = "ctrl_seq";
    public static final String CTRL_REPEAT = "ctrl_repeat";
    public static final String LIM_NB = "lim_nb";
    public static final String REC_NB = "rec_nb";

    /** Destination ceiling on limits and on reports per sequence. */
    public static final int MAX_SLOTS = 3;

    private SequenceFields() {}

    /** @param slot 1-based slot number */
    public static String limit(int slot, String suffix) {
        return String.format(Locale.ROOT, "lim%d_%s", slot, suffix);
    }

    /** @param slot 1-based slot number */
    public static String report(int slot, String suffix) {
        return String.format(Locale.ROOT, "rec%d_%s", slot, suffix);
    }
}
