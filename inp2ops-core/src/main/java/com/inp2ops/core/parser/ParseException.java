package com.inp2ops.core.parser;

/**
 * Fatal error while parsing an input deck. No partial model is produced once this is thrown.
 */
public class ParseException extends Exception {

    /**
     * Failure categories.
     */
    public enum Kind {
        /** A data line does not match its section's record schema */
        MALFORMED_RECORD,

        /** A directive is missing a required parameter or appears out of place */
        MALFORMED_DIRECTIVE,

        /** An id or name is defined twice */
        DUPLICATE_ID,

        /** A reference does not resolve after all records were collected */
        UNDEFINED_REFERENCE
    }

    private final Kind kind;
    private final int line;
    private final String sectionName;
    private final Integer fieldIndex;

    /**
     * Creates a parse error that is not tied to a particular field.
     *
     * @param kind failure category
     * @param line 1-based line number
     * @param sectionName keyword of the section in effect
     * @param detail description of the problem
     */
    public ParseException(Kind kind, int line, String sectionName, String detail) {
        this(kind, line, sectionName, null, detail);
    }

    /**
     * Creates a parse error.
     *
     * @param kind failure category
     * @param line 1-based line number
     * @param sectionName keyword of the section in effect
     * @param fieldIndex 0-based index of the offending field, or null
     * @param detail description of the problem
     */
    public ParseException(Kind kind, int line, String sectionName, Integer fieldIndex, String detail) {
        super(format(line, sectionName, fieldIndex, detail));
        this.kind = kind;
        this.line = line;
        this.sectionName = sectionName;
        this.fieldIndex = fieldIndex;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public String getSectionName() {
        return sectionName;
    }

    /**
     * Returns the 0-based index of the field that failed conversion.
     *
     * @return field index, or null when the error concerns the whole line
     */
    public Integer getFieldIndex() {
        return fieldIndex;
    }

    private static String format(int line, String sectionName, Integer fieldIndex, String detail) {
        StringBuilder sb = new StringBuilder("line ").append(line);
        if (sectionName != null) {
            sb.append(" (*").append(sectionName).append(')');
        }
        if (fieldIndex != null) {
            sb.append(", field ").append(fieldIndex);
        }
        return sb.append(": ").append(detail).toString();
    }
}
