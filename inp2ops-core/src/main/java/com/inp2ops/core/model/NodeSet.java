package com.inp2ops.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Named group of nodes.
 *
 * @param name set name as first written in the input
 * @param nodeIds distinct member node ids in definition order
 */
public record NodeSet(
    String name,
    List<Integer> nodeIds
) {
    /**
     * Compact constructor with validation.
     */
    public NodeSet {
        Objects.requireNonNull(name, "name must not be null");
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }
}
