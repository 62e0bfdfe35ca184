package com.cyclerprotocol.biologic.convert;

import java.util.Objects;

/**
 * A value rendered for a Modulo Bat cell together with its unit label.
 *
 * @param precisionLost whether the value had to be rounded to fit the destination
 */
public record ConvertedValue(String value, String unit, boolean precisionLost) {

    public ConvertedValue {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
    }

    static ConvertedValue exact(String value, String unit) {
        return new ConvertedValue(value, unit, false);
    }
}
