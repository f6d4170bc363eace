package com.inp2ops.core.model;

import java.util.Objects;

/**
 * Homogeneous or prescribed constraint on a node or node set.
 *
 * @param target constrained node or node set
 * @param fixedDofs fixed degrees of freedom: 3 translational then 3 rotational, true = fixed
 * @param magnitude prescribed value, 0.0 for a homogeneous constraint
 */
public record BoundaryCondition(
    BoundaryTarget target,
    DofMask fixedDofs,
    double magnitude
) {
    /**
     * Compact constructor with validation.
     */
    public BoundaryCondition {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(fixedDofs, "fixedDofs must not be null");
    }
}
