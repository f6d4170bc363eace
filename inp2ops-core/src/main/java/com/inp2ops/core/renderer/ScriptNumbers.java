package com.inp2ops.core.renderer;

/**
 * Numeric and literal formatting shared by script renderers.
 *
 * <p>Integers render in decimal. Doubles render as {@link Double#toString(double)} with the exponent marker
 * lower-cased, so {@code 2.1E11} becomes {@code 2.1e11}; that form is locale-independent and reads back to
 * the same value. Negative zero renders as {@code 0.0}; NaN and infinities are rejected.
 */
public final class ScriptNumbers {

    private ScriptNumbers() {
        // Utility class
    }

    /**
     * Formats a double.
     *
     * @param value a finite value
     * @return the literal
     * @throws IllegalArgumentException for NaN or infinite values
     */
    public static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("cannot write non-finite number " + value + " to a script");
        }
        if (value == 0.0) {
            return "0.0";
        }
        return Double.toString(value).replace('E', 'e');
    }

    /**
     * Formats an integer.
     *
     * @param value the value
     * @return decimal literal
     */
    public static String format(int value) {
        return Integer.toString(value);
    }

    /**
     * Formats an arbitrary literal: numbers by type, anything else as a single-quoted string.
     *
     * @param value number or string
     * @return the literal
     */
    public static String literal(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return value.toString();
        }
        if (value instanceof Number number) {
            return format(number.doubleValue());
        }
        return quote(String.valueOf(value));
    }

    /**
     * Single-quotes a string, escaping backslashes and quotes.
     *
     * @param value raw string
     * @return quoted literal
     */
    public static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
