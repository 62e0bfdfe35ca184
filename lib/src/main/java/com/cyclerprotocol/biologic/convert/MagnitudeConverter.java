package com.cyclerprotocol.biologic.convert;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Rescales a Maccor magnitude given in base SI units into the Modulo Bat unit ladder for that quantity, always with
 * three decimals. A smaller unit is chosen when the value is below the rung threshold or carries more decimal places
 * than three decimals at the current scale could hold.
 */
public final class MagnitudeConverter {
    static final char MICRO = '\u00b5';

    private static final class Rung {
        private final String unit;
        private final int scale;
        private final BigDecimal threshold;
        private final int maxDecimalPlaces;

        Rung(String unit, int scale, String threshold, int maxDecimalPlaces) {
            this.unit = unit;
            this.scale = scale;
            this.threshold = threshold == null ? null : new BigDecimal(threshold);
            this.maxDecimalPlaces = maxDecimalPlaces;
        }

        boolean accepts(BigDecimal magnitude, int decimalPlaces) {
            return threshold == null || magnitude.compareTo(threshold) < 0 || decimalPlaces > maxDecimalPlaces;
        }
    }

    // Rungs run smallest unit first; the last rung has no threshold and catches everything else.
    private static final List<Rung> VOLTS =
            List.of(new Rung("mV", 3, "1", 3), new Rung("V", 0, null, 0));

    private static final List<Rung> AMPS =
            List.of(
                    new Rung("pA", 12, "1e-9", 12),
                    new Rung("nA", 9, "1e-6", 9),
                    new Rung(MICRO + "A", 6, "1e-3", 6),
                    new Rung("mA", 3, "1", 3),
                    new Rung("A", 0, null, 0));

    private static final List<Rung> WATTS =
            List.of(
                    new Rung(MICRO + "W", 6, "1e-3", 6),
                    new Rung("mW", 3, "1", 3),
                    new Rung("W", 0, null, 0));

    // Resistance is the one ladder that also scales up.
    private static final List<Rung> OHMS =
            List.of(
                    new Rung(MICRO + "Ohms", 6, "1e-3", 6),
                    new Rung("mOhms", 3, "1", 3),
                    new Rung("Ohms", 0, "1e3", 0),
                    new Rung("kOhms", -3, "1e6", -3),
                    new Rung("MOhms", -6, null, 0));

    private MagnitudeConverter() {}

    public static ConvertedValue volts(String text) {
        return convert(text, VOLTS);
    }

    public static ConvertedValue amps(String text) {
        return convert(text, AMPS);
    }

    public static ConvertedValue watts(String text) {
        return convert(text, WATTS);
    }

    public static ConvertedValue ohms(String text) {
        return convert(text, OHMS);
    }

    private static ConvertedValue convert(String text, List<Rung> ladder) {
        BigDecimal value = DecimalText.parse(text);
        if (value == null) {
            throw new NumberFormatException("Missing magnitude");
        }
        int decimalPlaces = DecimalText.decimalPlaces(text);
        BigDecimal magnitude = value.abs();
        for (Rung rung : ladder) {
            if (rung.accepts(magnitude, decimalPlaces)) {
                return ConvertedValue.exact(format(value.movePointRight(rung.scale)), rung.unit);
            }
        }
        throw new IllegalStateException("Unit ladder has no catch-all rung");
    }

    static String format(BigDecimal value) {
        return value.setScale(3, RoundingMode.HALF_EVEN).toPlainString();
    }
}
