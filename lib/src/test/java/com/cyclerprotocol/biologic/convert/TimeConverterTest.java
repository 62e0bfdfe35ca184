package com.cyclerprotocol.biologic.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TimeConverterTest {

    @Test
    void wholeHoursStayInHours() {
        assertEquals(new ConvertedValue("3600.000", "hr", false), TimeConverter.convert("3600::"));
        assertEquals(new ConvertedValue("2.000", "hr", false), TimeConverter.convert("02:00:00"));
    }

    @Test
    void fractionalHoursStayInHoursWhenMinutesAndSecondsAreZero() {
        assertEquals(new ConvertedValue("0.500", "hr", false), TimeConverter.convert("0.5::"));
        assertEquals(new ConvertedValue("1.250", "hr", false), TimeConverter.convert("1.25:0:0"));
    }

    @Test
    void hoursFinerThanThreeDecimalsFallToFinerUnits() {
        assertEquals(new ConvertedValue("360.000", "ms", false), TimeConverter.convert("0.0001::"));
        assertEquals(new ConvertedValue("45.000", "s", false), TimeConverter.convert("0.0125::"));
    }

    @Test
    void minutesWhenMinutesAreSet() {
        assertEquals(new ConvertedValue("30.000", "mn", false), TimeConverter.convert("0:30:0"));
        assertEquals(new ConvertedValue("90.000", "mn", false), TimeConverter.convert("1:30:00"));
    }

    @Test
    void secondsWhenMinutesAreNotWhole() {
        assertEquals(new ConvertedValue("45.000", "s", false), TimeConverter.convert("0:0:45"));
        assertEquals(new ConvertedValue("10.000", "s", false), TimeConverter.convert("00:00:10"));
    }

    @Test
    void fractionalSecondsBecomeMilliseconds() {
        assertEquals(new ConvertedValue("500.000", "ms", false), TimeConverter.convert("::.5"));
    }

    @Test
    void millisecondsAreTruncated() {
        assertEquals(new ConvertedValue("1234.000", "ms", false), TimeConverter.convert("::1.2345"));
    }

    @Test
    void tooManyMillisecondsFallBackToSeconds() {
        ConvertedValue value = TimeConverter.convert("3000::0.5");
        assertEquals("10800000.500", value.value());
        assertEquals("s", value.unit());
        assertTrue(value.precisionLost());
    }

    @Test
    void rejectsMalformedDurations() {
        assertThrows(NumberFormatException.class, () -> TimeConverter.convert("1:2"));
        assertThrows(NumberFormatException.class, () -> TimeConverter.convert("a:b:c"));
        assertThrows(NumberFormatException.class, () -> TimeConverter.convert(null));
    }
}
