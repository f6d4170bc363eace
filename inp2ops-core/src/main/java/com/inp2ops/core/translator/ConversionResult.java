package com.inp2ops.core.translator;

import java.util.List;
import java.util.Objects;

/**
 * Output of a successful translation.
 *
 * @param commands the command sequence
 * @param warnings non-fatal findings in the order they were made
 */
public record ConversionResult(
    CommandSequence commands,
    List<ConversionWarning> warnings
) {
    public ConversionResult {
        Objects.requireNonNull(commands, "commands must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
