package com.cyclerprotocol.biologic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical Modulo Bat column order plus per-column defaults. EC-Lab reads columns by position, so the order here is
 * part of the file format.
 */
public final class SequenceTemplate {
    static final String DEFAULT_RESOURCE = "com/cyclerprotocol/biologic/modulo-bat-template.tsv";

    private static final class DefaultHolder {
        private static final SequenceTemplate INSTANCE = loadResource(DEFAULT_RESOURCE);
    }

    private final List<String> fieldOrder;
    private final Map<String, String> defaults;

    public SequenceTemplate(List<String> fieldOrder, Map<String, String> defaults) {
        this.fieldOrder = List.copyOf(fieldOrder);
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        for (String field : this.defaults.keySet()) {
            if (!this.fieldOrder.contains(field)) {
                throw new IllegalArgumentException("Default given for unknown field: " + field);
            }
        }
    }

    /** The bundled Modulo Bat template, loaded once. */
    public static SequenceTemplate moduloBat() {
        return DefaultHolder.INSTANCE;
    }

    public static SequenceTemplate loadResource(String resourceName) {
        Objects.requireNonNull(resourceName, "resourceName");
        try (InputStream in = SequenceTemplate.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Missing sequence template resource: " + resourceName);
            }
            return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read sequence template " + resourceName, ex);
        }
    }

    public static SequenceTemplate parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static SequenceTemplate parse(Reader source) throws IOException {
        List<String> order = new ArrayList<>();
        Map<String, String> defaults = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                int tab = line.indexOf('\t');
                String field = tab < 0 ? line : line.substring(0, tab);
                if (order.contains(field)) {
                    throw new IllegalArgumentException("Duplicate template field: " + field);
                }
                order.add(field);
                if (tab >= 0) {
                    defaults.put(field, line.substring(tab + 1));
                }
            }
        }
        return new SequenceTemplate(order, defaults);
    }

    public List<String> getFieldOrder() {
        return fieldOrder;
    }

    public Map<String, String> getDefaults() {
        return defaults;
    }

    /** Template defaults overlaid with the record's explicit fields. Required fields the record omits stay absent. */
    public Map<String, String> fill(SequenceRecord record) {
        Map<String, String> row = new LinkedHashMap<>(defaults);
        row.putAll(record.toFields());
        return row;
    }
}
