package com.cyclerprotocol.biologic.convert;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts Maccor {@code H:M:S} durations. Any component may be blank, e.g. {@code "::.5"} is half a second and
 * {@code "3600::"} is 3600 hours. Hours are kept whenever minutes and seconds are blank or zero and the hour count
 * fits in three decimals. Otherwise the coarsest Modulo Bat unit that holds the value exactly wins.
 */
public final class TimeConverter {
    /** Largest millisecond count EC-Lab accepts. */
    static final BigDecimal MAX_MILLISECONDS = new BigDecimal("1e10");

    private static final Logger LOGGER = Logger.getLogger(TimeConverter.class.getName());
    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private TimeConverter() {}

    public static ConvertedValue convert(String text) {
        if (text == null) {
            throw new NumberFormatException("Missing duration");
        }
        String[] parts = text.trim().split(":", -1);
        if (parts.length != 3) {
            throw new NumberFormatException("Duration must be H:M:S: " + text);
        }
        BigDecimal hours = component(parts[0]);
        BigDecimal minutes = component(parts[1]);
        BigDecimal seconds = component(parts[2]);

        if (isZero(minutes) && isZero(seconds) && fitsThreeDecimals(hours)) {
            return ConvertedValue.exact(MagnitudeConverter.format(hours), "hr");
        }
        BigDecimal totalMinutes = hours.multiply(SIXTY).add(minutes);
        if (isZero(seconds) && isWhole(totalMinutes)) {
            return ConvertedValue.exact(MagnitudeConverter.format(totalMinutes), "mn");
        }
        BigDecimal totalSeconds = totalMinutes.multiply(SIXTY).add(seconds);
        if (isWhole(totalSeconds)) {
            return ConvertedValue.exact(MagnitudeConverter.format(totalSeconds), "s");
        }
        BigDecimal totalMilliseconds = totalSeconds.multiply(THOUSAND).setScale(0, RoundingMode.DOWN);
        if (totalMilliseconds.compareTo(MAX_MILLISECONDS) < 0) {
            return ConvertedValue.exact(MagnitudeConverter.format(totalMilliseconds), "ms");
        }
        String fallback = MagnitudeConverter.format(totalMilliseconds.movePointLeft(3));
        LOGGER.log(
                Level.WARNING,
                "Lost precision converting time {0} to {1} s, Modulo Bat cannot represent it in ms",
                new Object[] {text, fallback});
        return new ConvertedValue(fallback, "s", true);
    }

    private static BigDecimal component(String part) {
        BigDecimal value = DecimalText.parse(part);
        return value == null ? BigDecimal.ZERO : value;
    }

    private static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    private static boolean fitsThreeDecimals(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 3;
    }

    private static boolean isWhole(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
