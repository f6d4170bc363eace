package com.inp2ops.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A finite element and its connectivity.
 *
 * @param id positive element identifier, unique within a model
 * @param type source element type
 * @param nodeIds ordered node references
 */
public record Element(
    int id,
    ElementType type,
    List<Integer> nodeIds
) {
    /**
     * Compact constructor with validation.
     */
    public Element {
        if (id <= 0) {
            throw new IllegalArgumentException("element id must be positive: " + id);
        }
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(nodeIds, "nodeIds must not be null");
        nodeIds = List.copyOf(nodeIds);
    }
}
