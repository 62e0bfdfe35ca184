package com.cyclerprotocol.biologic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ConverterSettingsTest {

    @Test
    void defaultsToTwentyColumnsAndUtf8() {
        ConverterSettings settings = ConverterSettings.defaults();

        assertEquals(20, settings.getColumnWidth());
        assertEquals(StandardCharsets.UTF_8, settings.getSourceCharset());
    }

    @Test
    void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY, " 24 ");
        properties.setProperty(ConverterSettings.SOURCE_ENCODING_PROPERTY, "ISO-8859-1");

        ConverterSettings settings = ConverterSettings.fromProperties(properties);

        assertEquals(24, settings.getColumnWidth());
        assertEquals(StandardCharsets.ISO_8859_1, settings.getSourceCharset());
    }

    @Test
    void systemPropertyOverridesSuppliedValue() {
        Properties properties = new Properties();
        properties.setProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY, "24");
        String previous = System.getProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY);
        System.setProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY, "30");
        try {
            assertEquals(30, ConverterSettings.fromProperties(properties).getColumnWidth());
        } finally {
            if (previous == null) {
                System.clearProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY);
            } else {
                System.setProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY, previous);
            }
        }
    }

    @Test
    void rejectsNonNumericWidth() {
        Properties properties = new Properties();
        properties.setProperty(ConverterSettings.COLUMN_WIDTH_PROPERTY, "wide");

        assertThrows(IllegalArgumentException.class, () -> ConverterSettings.fromProperties(properties));
    }

    @Test
    void rejectsZeroWidth() {
        assertThrows(IllegalArgumentException.class, () -> ConverterSettings.defaults().withColumnWidth(0));
    }
}
