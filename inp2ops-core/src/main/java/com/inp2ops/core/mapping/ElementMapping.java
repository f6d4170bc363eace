package com.inp2ops.core.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Element Type Map entry.
 *
 * @param target target element type name
 * @param arity number of nodes the element connects
 * @param dimension topological dimension (1 line, 2 surface, 3 volume)
 * @param family structural role
 * @param ndf DOFs per node the element requires, 0 when it works with any
 * @param extraArguments constants written after the family's own arguments, empty when the target takes none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ElementMapping(
    @JsonProperty("target") String target,
    @JsonProperty("arity") int arity,
    @JsonProperty("dimension") int dimension,
    @JsonProperty("family") ElementFamily family,
    @JsonProperty("ndf") int ndf,
    @JsonProperty("extraArguments") List<Double> extraArguments
) {
    public ElementMapping {
        extraArguments = extraArguments == null ? List.of() : List.copyOf(extraArguments);
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(family, "family must not be null");
        if (arity <= 0) {
            throw new IllegalArgumentException("arity must be positive for " + target);
        }
    }

    /**
     * Returns true if the element imposes a DOF count on its nodes.
     *
     * @return false for elements that accept any DOF count
     */
    public boolean constrainsNdf() {
        return ndf > 0;
    }
}
