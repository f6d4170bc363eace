package com.inp2ops.core.output;

import java.util.Objects;

/**
 * A rendered script ready to be written.
 *
 * @param fileName file name relative to the output directory
 * @param content script text
 */
public record GeneratedScript(
    String fileName,
    String content
) {
    public GeneratedScript {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
    }
}
