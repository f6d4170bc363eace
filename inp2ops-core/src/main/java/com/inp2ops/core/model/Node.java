package com.inp2ops.core.model;

/**
 * A mesh node with its global coordinates.
 *
 * @param id positive node identifier, unique within a model
 * @param x x coordinate
 * @param y y coordinate
 * @param z z coordinate
 */
public record Node(
    int id,
    double x,
    double y,
    double z
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        if (id <= 0) {
            throw new IllegalArgumentException("node id must be positive: " + id);
        }
    }
}
