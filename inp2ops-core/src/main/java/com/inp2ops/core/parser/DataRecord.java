package com.inp2ops.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One comma-separated data line, interpreted under the section in effect.
 *
 * @param line 1-based line number where the record starts
 * @param sectionName keyword of the section in effect, used in error messages
 * @param fields trimmed fields with trailing empty fields removed
 */
public record DataRecord(
    int line,
    String sectionName,
    List<String> fields
) {
    static final String SEPARATOR = ",";

    /**
     * Compact constructor with validation.
     */
    public DataRecord {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = List.copyOf(fields);
    }

    /**
     * Splits a data line into a record.
     *
     * @param text line text (continuations already joined)
     * @param line 1-based line number
     * @param sectionName keyword of the section in effect
     * @return the record
     */
    public static DataRecord split(String text, int line, String sectionName) {
        String[] parts = text.split(SEPARATOR, -1);
        List<String> fields = new ArrayList<>(parts.length);
        for (String part : parts) {
            fields.add(part.trim());
        }
        while (!fields.isEmpty() && fields.get(fields.size() - 1).isEmpty()) {
            fields.remove(fields.size() - 1);
        }
        return new DataRecord(line, sectionName, fields);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns a raw field.
     *
     * @param index 0-based field index
     * @return field text, empty if the record is shorter
     */
    public String field(int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    /**
     * Returns true if the field exists and is not empty.
     *
     * @param index 0-based field index
     * @return true if present
     */
    public boolean has(int index) {
        return !field(index).isEmpty();
    }

    /**
     * Returns true if the field holds an integer literal.
     *
     * @param index 0-based field index
     * @return true if the field parses as an int
     */
    public boolean isInteger(int index) {
        try {
            Integer.parseInt(field(index));
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Converts a field to an int.
     *
     * @param index 0-based field index
     * @return the value
     * @throws ParseException if the field is missing or not an integer
     */
    public int intField(int index) throws ParseException {
        String raw = requireField(index);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw malformed(index, "expected an integer but found '" + raw + "'");
        }
    }

    /**
     * Converts a field to a positive int id.
     *
     * @param index 0-based field index
     * @return the id
     * @throws ParseException if the field is missing, not an integer or not positive
     */
    public int idField(int index) throws ParseException {
        int id = intField(index);
        if (id <= 0) {
            throw malformed(index, "ids must be positive but found " + id);
        }
        return id;
    }

    /**
     * Converts a field to a double. Fortran-style exponents ({@code 1.0D3}) are accepted.
     *
     * @param index 0-based field index
     * @return the value
     * @throws ParseException if the field is missing or not a number
     */
    public double doubleField(int index) throws ParseException {
        String raw = requireField(index);
        try {
            double value = Double.parseDouble(raw.replace('D', 'E').replace('d', 'e'));
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw malformed(index, "expected a finite number but found '" + raw + "'");
            }
            return value;
        } catch (NumberFormatException e) {
            throw malformed(index, "expected a number but found '" + raw + "'");
        }
    }

    /**
     * Converts a field to a double, or returns the fallback if the field is absent.
     *
     * @param index 0-based field index
     * @param fallback value for an absent field
     * @return the value
     * @throws ParseException if the field is present but not a number
     */
    public double doubleFieldOr(int index, double fallback) throws ParseException {
        return has(index) ? doubleField(index) : fallback;
    }

    /**
     * Builds a malformed-record error for a field of this record.
     *
     * @param index 0-based field index
     * @param detail description
     * @return the exception, for the caller to throw
     */
    public ParseException malformed(int index, String detail) {
        return new ParseException(ParseException.Kind.MALFORMED_RECORD, line, sectionName, index, detail);
    }

    private String requireField(int index) throws ParseException {
        if (!has(index)) {
            throw malformed(index, "missing value");
        }
        return field(index);
    }
}
