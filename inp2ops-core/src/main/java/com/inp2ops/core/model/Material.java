package com.inp2ops.core.model;

import java.util.Objects;

/**
 * A material definition.
 *
 * <p>Only isotropic elasticity and mass density are read. A material without {@code *ELASTIC} data is kept so
 * that the translator can report it, rather than failing the parse.
 *
 * @param name material name as written in the input
 * @param elastic elastic constants, or null if the material has none
 * @param density mass density, or null if not given
 */
public record Material(
    String name,
    ElasticProperties elastic,
    Double density
) {
    /**
     * Compact constructor with validation.
     */
    public Material {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the material behaviour kind used for mapping lookups.
     *
     * @return "ELASTIC" if elastic constants are present, otherwise "UNDEFINED"
     */
    public String kind() {
        return elastic != null ? "ELASTIC" : "UNDEFINED";
    }
}
