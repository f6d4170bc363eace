package com.inp2ops.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Section properties assigned to an element set.
 *
 * <p>The element set name doubles as the section name, so at most one section exists per set.
 *
 * @param elsetName name of the element set the section applies to
 * @param kind section kind
 * @param materialName referenced material name, null only for unsupported sections
 * @param profile beam profile name (RECT, CIRC, PIPE, ...), null for other kinds
 * @param properties numeric data in input order (thickness, area, profile dimensions)
 */
public record Section(
    String elsetName,
    SectionKind kind,
    String materialName,
    String profile,
    List<Double> properties
) {
    /**
     * Compact constructor with validation.
     */
    public Section {
        Objects.requireNonNull(elsetName, "elsetName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    /**
     * Returns the property at the given position, or the fallback if the input did not provide it.
     *
     * @param index 0-based property index
     * @param fallback value used when the property is absent
     * @return property value or fallback
     */
    public double propertyOrDefault(int index, double fallback) {
        return index < properties.size() ? properties.get(index) : fallback;
    }

    /**
     * Returns true if the input provided a property at the given position.
     *
     * @param index 0-based property index
     * @return true if present
     */
    public boolean hasProperty(int index) {
        return index < properties.size();
    }
}
