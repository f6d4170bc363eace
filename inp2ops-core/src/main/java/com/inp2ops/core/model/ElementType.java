package com.inp2ops.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Source element type tag as written in the {@code type=} parameter of {@code *ELEMENT}.
 *
 * <p>Tags are normalized to upper case, so {@code s4r} and {@code S4R} are the same type.
 *
 * @param tag normalized element type tag (e.g., "S4R", "C3D8", "T3D2")
 */
public record ElementType(String tag) {

    /**
     * Compact constructor with validation.
     */
    public ElementType {
        Objects.requireNonNull(tag, "tag must not be null");
        tag = tag.trim().toUpperCase(Locale.ROOT);
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("tag must not be blank");
        }
    }

    /**
     * Returns true for two- and three-dimensional truss tags ({@code T2D*}, {@code T3D*}).
     *
     * <p>Must agree with the {@code TRUSS} family entries of the bundled mapping tables.
     *
     * @return true if this is a truss element type
     */
    public boolean isTruss() {
        return tag.startsWith("T2D") || tag.startsWith("T3D");
    }

    @Override
    public String toString() {
        return tag;
    }
}
