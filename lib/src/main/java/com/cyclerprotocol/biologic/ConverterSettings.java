package com.cyclerprotocol.biologic;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/** Conversion options. System properties override values supplied through {@link #fromProperties(Properties)}. */
public final class ConverterSettings {
    public static final String COLUMN_WIDTH_PROPERTY = "cyclerprotocol.columnWidth";
    public static final String SOURCE_ENCODING_PROPERTY = "cyclerprotocol.sourceEncoding";

    /** EC-Lab reads settings files as Latin-1; the micro sign and superscript two depend on it. */
    public static final Charset OUTPUT_CHARSET = StandardCharsets.ISO_8859_1;

    private final int columnWidth;
    private final Charset sourceCharset;

    public ConverterSettings(int columnWidth, Charset sourceCharset) {
        if (columnWidth <= 0) {
            throw new IllegalArgumentException("Column width must be positive: " + columnWidth);
        }
        this.columnWidth = columnWidth;
        this.sourceCharset = Objects.requireNonNull(sourceCharset, "sourceCharset");
    }

    public static ConverterSettings defaults() {
        return new ConverterSettings(ModuloBatSerializer.DEFAULT_COLUMN_WIDTH, StandardCharsets.UTF_8);
    }

    public static ConverterSettings fromProperties(Properties properties) {
        Properties merged = new Properties();
        if (properties != null) {
            merged.putAll(properties);
        }
        overrideFromSystem(merged, COLUMN_WIDTH_PROPERTY);
        overrideFromSystem(merged, SOURCE_ENCODING_PROPERTY);

        int width = ModuloBatSerializer.DEFAULT_COLUMN_WIDTH;
        String widthValue = merged.getProperty(COLUMN_WIDTH_PROPERTY);
        if (widthValue != null && !widthValue.isBlank()) {
            try {
                width = Integer.parseInt(widthValue.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                        String.format(Locale.ROOT, "%s must be an integer: %s", COLUMN_WIDTH_PROPERTY, widthValue), ex);
            }
        }
        Charset charset = StandardCharsets.UTF_8;
        String encoding = merged.getProperty(SOURCE_ENCODING_PROPERTY);
        if (encoding != null && !encoding.isBlank()) {
            charset = Charset.forName(encoding.trim());
        }
        return new ConverterSettings(width, charset);
    }

    private static void overrideFromSystem(Properties target, String key) {
        String value = System.getProperty(key);
        if (value != null) {
            target.setProperty(key, value);
        }
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    public Charset getSourceCharset() {
        return sourceCharset;
    }

    public ConverterSettings withColumnWidth(int width) {
        return new ConverterSettings(width, sourceCharset);
    }

    public ConverterSettings withSourceCharset(Charset charset) {
        return new ConverterSettings(columnWidth, charset);
    }
}
