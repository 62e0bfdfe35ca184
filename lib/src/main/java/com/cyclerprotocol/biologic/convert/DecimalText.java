package com.cyclerprotocol.biologic.convert;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locale-neutral handling of the decimal strings Maccor writes: dot separator, optional exponent, no grouping.
 * Precision is read from the text itself so that a value written as {@code 0.0025} is not treated like {@code 0.003}.
 */
public final class DecimalText {
    private static final Pattern EXPONENT = Pattern.compile("[eE]([-+]?[0-9]+)");
    private static final Pattern FRACTION = Pattern.compile("\\.([0-9]*[1-9])");

    private DecimalText() {}

    /**
     * Parses a decimal string. Returns {@code null} for null or blank input. Throws {@link NumberFormatException}
     * for comma separators or anything {@link BigDecimal} rejects.
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.indexOf(',') >= 0) {
            throw new NumberFormatException("Grouping or comma separators not allowed: " + text);
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException ex) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
    }

    /**
     * Decimal places the text carries: fractional digits up to the last non-zero one, less the power-of-ten
     * exponent. {@code "0.0120"} gives 3, {@code "12e-3"} gives 3, {@code "5e3"} gives -3.
     */
    public static int decimalPlaces(String text) {
        int exponent = 0;
        Matcher exponentMatch = EXPONENT.matcher(text);
        if (exponentMatch.find()) {
            exponent = Integer.parseInt(exponentMatch.group(1));
        }
        int fractionDigits = 0;
        Matcher fractionMatch = FRACTION.matcher(text);
        if (fractionMatch.find()) {
            fractionDigits = fractionMatch.group(1).length();
        }
        return fractionDigits - exponent;
    }
}
