package com.inp2ops.core.model;

import java.util.Objects;

/**
 * What a boundary condition or load is applied to: a single node or a node set.
 */
public sealed interface BoundaryTarget permits BoundaryTarget.NodeTarget, BoundaryTarget.NodeSetTarget {

    /**
     * Human-readable form used in messages.
     *
     * @return description of the target
     */
    String describe();

    /**
     * A single node referenced by id.
     *
     * @param nodeId node id
     */
    record NodeTarget(int nodeId) implements BoundaryTarget {
        @Override
        public String describe() {
            return "node " + nodeId;
        }
    }

    /**
     * A node set referenced by name.
     *
     * @param setName node set name
     */
    record NodeSetTarget(String setName) implements BoundaryTarget {
        public NodeSetTarget {
            Objects.requireNonNull(setName, "setName must not be null");
        }

        @Override
        public String describe() {
            return "node set " + setName;
        }
    }
}
