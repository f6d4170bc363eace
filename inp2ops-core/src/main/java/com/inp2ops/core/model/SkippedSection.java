package com.inp2ops.core.model;

import java.util.Objects;

/**
 * Note about a directive the parser did not interpret.
 *
 * @param keyword normalized keyword (e.g., "HEADING", "STEP")
 * @param line 1-based line number of the directive
 * @param discardedLines number of data lines skipped under it
 */
public record SkippedSection(
    String keyword,
    int line,
    int discardedLines
) {
    /**
     * Compact constructor with validation.
     */
    public SkippedSection {
        Objects.requireNonNull(keyword, "keyword must not be null");
    }
}
