package com.inp2ops.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Concentrated nodal load.
 *
 * @param target loaded node or node set
 * @param components force and moment components (FX, FY, FZ, MX, MY, MZ)
 */
public record Load(
    BoundaryTarget target,
    List<Double> components
) {
    /**
     * Compact constructor with validation.
     */
    public Load {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(components, "components must not be null");
        if (components.size() != DofMask.DOF_COUNT) {
            throw new IllegalArgumentException("load needs 6 components, got " + components.size());
        }
        components = List.copyOf(components);
    }
}
