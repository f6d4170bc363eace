package com.inp2ops.core.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed keyword line such as {@code *Element, type=S4R, elset=Plate}.
 *
 * <p>The keyword and parameter names are upper-cased and internal whitespace is collapsed to one space.
 * Parameter values keep their original case. Parameters without a value (e.g., {@code generate}) map to
 * an empty string.
 *
 * @param keyword normalized keyword without the leading marker (e.g., "SHELL SECTION")
 * @param parameters parameters by upper-cased name, in input order
 * @param line 1-based line number of the directive
 */
public record DirectiveLine(
    String keyword,
    Map<String, String> parameters,
    int line
) {
    static final String MARKER = "*";
    static final String COMMENT_MARKER = "**";

    /**
     * Compact constructor with validation.
     */
    public DirectiveLine {
        Objects.requireNonNull(keyword, "keyword must not be null");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Parses a directive line.
     *
     * @param text trimmed line text starting with the directive marker
     * @param line 1-based line number
     * @return parsed directive
     * @throws ParseException if the keyword is empty
     */
    public static DirectiveLine parse(String text, int line) throws ParseException {
        if (!text.startsWith(MARKER) || text.startsWith(COMMENT_MARKER)) {
            throw new IllegalArgumentException("not a directive line: " + text);
        }
        String[] parts = text.substring(MARKER.length()).split(",", -1);
        String keyword = normalize(parts[0]);
        if (keyword.isEmpty()) {
            throw new ParseException(ParseException.Kind.MALFORMED_DIRECTIVE, line, null, "empty keyword");
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.isEmpty()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq < 0) {
                parameters.put(normalize(part), "");
            } else {
                parameters.put(normalize(part.substring(0, eq)), part.substring(eq + 1).trim());
            }
        }
        return new DirectiveLine(keyword, parameters, line);
    }

    /**
     * Returns a parameter value.
     *
     * @param name parameter name, any case
     * @return value, or null if absent or given without a value
     */
    public String parameter(String name) {
        String value = parameters.get(normalize(name));
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Returns a required parameter value.
     *
     * @param name parameter name, any case
     * @return non-empty value
     * @throws ParseException if the parameter is missing or empty
     */
    public String requireParameter(String name) throws ParseException {
        String value = parameter(name);
        if (value == null) {
            throw new ParseException(ParseException.Kind.MALFORMED_DIRECTIVE, line, keyword,
                "missing required parameter " + normalize(name).toLowerCase(Locale.ROOT) + "=");
        }
        return value;
    }

    /**
     * Returns true if the parameter is present, with or without a value.
     *
     * @param name parameter name, any case
     * @return true if present
     */
    public boolean hasFlag(String name) {
        return parameters.containsKey(normalize(name));
    }

    private static String normalize(String raw) {
        return raw.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
