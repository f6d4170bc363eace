package com.inp2ops.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Named group of elements.
 *
 * @param name set name as first written in the input
 * @param elementIds distinct member element ids in definition order
 */
public record ElementSet(
    String name,
    List<Integer> elementIds
) {
    /**
     * Compact constructor with validation.
     */
    public ElementSet {
        Objects.requireNonNull(name, "name must not be null");
        elementIds = elementIds == null ? List.of() : List.copyOf(elementIds);
    }
}
