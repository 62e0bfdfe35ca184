package com.cyclerprotocol.biologic;

/**
 * Static BT-LAB settings block written ahead of the sequence table. Values are placeholders taken from an EC-Lab
 * Modulo Bat export; {@code Cycle Definition : Loop} is required for the advance-cycle emulation to count cycles.
 */
public final class SettingsHeader {
    static final String CRLF = "\r\n";

    private static final String[] LINES = {
        "BT-LAB SETTING FILE",
        "",
        "Number of linked techniques : 1",
        "",
        "Filename : C:\\dummy.mps",
        "",
        "Device : BCS-805",
        "Ecell ctrl range : min = 0.00 V, max = 10.00 V",
        "Electrode material : ",
        "Initial state : ",
        "Electrolyte : ",
        "Comments : ",
        "Mass of active material : 0.001 mg",
        " at x = 0.000",
        "Molecular weight of active material (at x = 0) : 0.001 g/mol",
        "Atomic weight of intercalated ion : 0.001 g/mol",
        "Acquisition started at : xo = 0.000",
        "Number of e- transfered per intercalated ion : 1",
        "for DX = 1, DQ = 26.802 mA.h",
        "Battery capacity : 2.280 mA.h",
        "Electrode surface area : 0.001 cm\u00b2",
        "Characteristic mass : 9.130 mg",
        "Cycle Definition : Loop",
        "Turn to OCV between techniques",
        "",
        "Technique : 1",
        "Modulo Bat",
    };

    private SettingsHeader() {}

    /** Header text, every line CRLF-terminated. */
    public static String text() {
        StringBuilder builder = new StringBuilder();
        for (String line : LINES) {
            builder.append(line).append(CRLF);
        }
        return builder.toString();
    }
}
