package com.cyclerprotocol.biologic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders sequences as the Modulo Bat fixed-width table: one row per column name, one cell per sequence, every cell
 * left-justified to the same width with no separator.
 */
public final class ModuloBatSerializer {
    public static final int DEFAULT_COLUMN_WIDTH = 20;

    private final int columnWidth;

    public ModuloBatSerializer(int columnWidth) {
        if (columnWidth <= 0) {
            throw new IllegalArgumentException("Column width must be positive: " + columnWidth);
        }
        this.columnWidth = columnWidth;
    }

    public ModuloBatSerializer() {
        this(DEFAULT_COLUMN_WIDTH);
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    /** Settings header followed by the sequence table. */
    public String render(List<SequenceRecord> sequences, SequenceTemplate template) throws ConversionException {
        return SettingsHeader.text() + renderTable(sequences, template);
    }

    public String renderTable(List<SequenceRecord> sequences, SequenceTemplate template)
            throws ConversionException {
        Objects.requireNonNull(template, "template");
        List<Map<String, String>> rows = new ArrayList<>(sequences.size());
        for (SequenceRecord sequence : sequences) {
            rows.add(template.fill(sequence));
        }
        return renderRows(rows, template.getFieldOrder());
    }

    /**
     * @param rows one field map per sequence, in sequence order
     * @param fieldOrder column names in the order the destination reader expects
     */
    public String renderRows(List<Map<String, String>> rows, List<String> fieldOrder) throws ConversionException {
        StringBuilder out = new StringBuilder();
        for (String field : fieldOrder) {
            if (field.length() > columnWidth) {
                throw new ConversionException(
                        ErrorKind.FIELD_TOO_WIDE,
                        "field name " + field + " is longer than the column width " + columnWidth);
            }
            appendCell(out, field);
            for (int seq = 0; seq < rows.size(); seq++) {
                Map<String, String> row = rows.get(seq);
                String value = row.get(field);
                if (value == null) {
                    throw new ConversionException(
                            ErrorKind.MISSING_FIELD, "field " + field + " is missing from sequence " + seq);
                }
                if (value.length() > columnWidth) {
                    throw new ConversionException(
                            ErrorKind.FIELD_TOO_WIDE,
                            "value " + value + " of field " + field + " in sequence " + seq
                                    + " is longer than the column width " + columnWidth);
                }
                appendCell(out, value);
            }
            out.append(SettingsHeader.CRLF);
        }
        return out.toString();
    }

    private void appendCell(StringBuilder out, String text) {
        out.append(text);
        for (int i = text.length(); i < columnWidth; i++) {
            out.append(' ');
        }
    }
}
